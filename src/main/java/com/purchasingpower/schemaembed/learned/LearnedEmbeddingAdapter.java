package com.purchasingpower.schemaembed.learned;

import com.purchasingpower.schemaembed.core.EmbeddingVector;

/**
 * Pretrained text-embedding model behind a narrow {@code text -> vector} seam.
 *
 * Implementations must be deterministic for a fixed model version, return a
 * fixed length for a given configuration and never return NaN or infinite
 * values. Output is normalized like the hashing generators' output.
 *
 * @since 1.0.0
 */
public interface LearnedEmbeddingAdapter {

    EmbeddingVector embed(String schemaText);

    /**
     * Length of every vector returned by {@link #embed}.
     */
    int dimension();

    /**
     * Model name (for logging).
     */
    String modelName();
}
