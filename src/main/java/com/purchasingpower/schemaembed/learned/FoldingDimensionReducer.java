package com.purchasingpower.schemaembed.learned;

import com.google.common.base.Preconditions;

/**
 * Brings a model vector to a target length.
 *
 * Longer vectors are folded: component {@code i} is added to slot
 * {@code i mod target}, the same projection the hashing generators use.
 * Shorter vectors are zero-padded.
 *
 * @since 1.0.0
 */
public class FoldingDimensionReducer {

    private final int targetDimension;

    public FoldingDimensionReducer(int targetDimension) {
        Preconditions.checkArgument(targetDimension > 0, "Target dimension must be positive: %s", targetDimension);
        this.targetDimension = targetDimension;
    }

    public double[] reduce(double[] source) {
        double[] out = new double[targetDimension];
        for (int i = 0; i < source.length; i++) {
            out[i % targetDimension] += source[i];
        }
        return out;
    }

    public int getTargetDimension() {
        return targetDimension;
    }
}
