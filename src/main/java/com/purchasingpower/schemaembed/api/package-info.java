/**
 * REST API layer.
 *
 * <p>A thin HTTP wrapper over {@code SchemaEmbeddingService}; no embedding
 * logic lives here.
 *
 * @since 1.0.0
 */
package com.purchasingpower.schemaembed.api;
