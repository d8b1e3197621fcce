package com.purchasingpower.schemaembed.core;

import lombok.Builder;
import lombok.Data;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of one embedding request: the combined vector plus what went into it.
 *
 * @since 1.0.0
 */
@Data
@Builder
public class SchemaEmbedding {

    private EmbeddingVector combined;

    /**
     * Normalized output of every generator that ran, keyed by generator id.
     */
    @Builder.Default
    private Map<String, EmbeddingVector> generatorOutputs = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> weights = new LinkedHashMap<>();

    /**
     * Distinct words registered while producing this embedding.
     */
    private int vocabularySize;
}
