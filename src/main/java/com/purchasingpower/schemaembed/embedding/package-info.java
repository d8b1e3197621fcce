/**
 * Weighted multi-signal hashing embeddings.
 *
 * <p>Every generator tokenizes schema text, maps each word to a slot with
 * {@code index mod size} and accumulates a weight chosen by schema
 * semantics. Collisions are accepted. {@code EmbeddingCombiner} blends
 * generator outputs into the final vector.
 *
 * @since 1.0.0
 */
package com.purchasingpower.schemaembed.embedding;
