package com.purchasingpower.schemaembed.core;

import com.purchasingpower.schemaembed.exception.DimensionMismatchException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable fixed-length embedding.
 *
 * Values are copied on the way in and on the way out, so a vector cannot be
 * mutated once a generator has returned it.
 *
 * @since 1.0.0
 */
public final class EmbeddingVector {

    private final double[] values;

    private EmbeddingVector(double[] values) {
        this.values = values;
    }

    public static EmbeddingVector of(double[] values) {
        if (values == null) {
            throw new IllegalArgumentException("Vector values cannot be null");
        }
        return new EmbeddingVector(values.clone());
    }

    public static EmbeddingVector zero(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive: " + dimension);
        }
        return new EmbeddingVector(new double[dimension]);
    }

    public int dimension() {
        return values.length;
    }

    public double get(int i) {
        return values[i];
    }

    public double[] toArray() {
        return values.clone();
    }

    public List<Double> toList() {
        List<Double> result = new ArrayList<>(values.length);
        for (double value : values) {
            result.add(value);
        }
        return Collections.unmodifiableList(result);
    }

    public double magnitude() {
        double sum = 0.0;
        for (double value : values) {
            sum += value * value;
        }
        return Math.sqrt(sum);
    }

    public boolean isZero() {
        for (double value : values) {
            if (value != 0.0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Cosine similarity with {@code other}. Zero when either vector is the zero vector.
     */
    public double cosineSimilarity(EmbeddingVector other) {
        if (other.dimension() != dimension()) {
            throw new DimensionMismatchException("Cannot compare vectors", dimension(), other.dimension());
        }
        double dot = 0.0;
        for (int i = 0; i < values.length; i++) {
            dot += values[i] * other.values[i];
        }
        double denominator = magnitude() * other.magnitude();
        return denominator == 0.0 ? 0.0 : dot / denominator;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EmbeddingVector)) return false;
        return Arrays.equals(values, ((EmbeddingVector) o).values);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "EmbeddingVector{dimension=" + values.length + ", magnitude=" + magnitude() + "}";
    }
}
