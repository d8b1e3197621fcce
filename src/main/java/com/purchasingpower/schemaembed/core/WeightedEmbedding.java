package com.purchasingpower.schemaembed.core;

import lombok.Value;

/**
 * One combiner input: a generator's output paired with its configured weight.
 */
@Value
public class WeightedEmbedding {
    String generatorId;
    EmbeddingVector vector;
    double weight;

    public static WeightedEmbedding of(String generatorId, EmbeddingVector vector, double weight) {
        return new WeightedEmbedding(generatorId, vector, weight);
    }
}
