package com.purchasingpower.schemaembed.embedding.impl;

import com.purchasingpower.schemaembed.core.GeneratorType;
import com.purchasingpower.schemaembed.embedding.WeightTable;
import com.purchasingpower.schemaembed.embedding.WeightedHashProjector;
import com.purchasingpower.schemaembed.text.SchemaTokenizer;
import com.google.common.base.Preconditions;

/**
 * General-purpose generator with positional smoothing.
 *
 * Every weight is also spread onto neighbouring slots with
 * {@code weight * decay^distance}, up to {@code windowRadius} slots away.
 *
 * @since 1.0.0
 */
public class EnhancedEmbeddingGenerator extends AbstractWeightedEmbeddingGenerator {

    private final double windowDecay;
    private final int windowRadius;

    public EnhancedEmbeddingGenerator(int embeddingSize, WeightTable weights, SchemaTokenizer tokenizer,
                                      double windowDecay, int windowRadius) {
        super(embeddingSize, weights, tokenizer);
        Preconditions.checkArgument(windowDecay >= 0.0 && windowDecay <= 1.0,
                "Window decay must be within [0, 1]: %s", windowDecay);
        Preconditions.checkArgument(windowRadius >= 0, "Window radius cannot be negative: %s", windowRadius);
        this.windowDecay = windowDecay;
        this.windowRadius = windowRadius;
    }

    @Override
    public GeneratorType getType() {
        return GeneratorType.ENHANCED;
    }

    @Override
    protected void project(double[] vector, int wordIndex, double weight) {
        WeightedHashProjector.spread(vector, wordIndex, weight, windowDecay, windowRadius);
    }

    public double getWindowDecay() {
        return windowDecay;
    }

    public int getWindowRadius() {
        return windowRadius;
    }
}
