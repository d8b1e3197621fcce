package com.purchasingpower.schemaembed.embedding;

/**
 * Hashing-trick primitives shared by all generators.
 *
 * A word's WordIndex index is folded into the vector with {@code floorMod};
 * different words landing on the same slot simply add up.
 *
 * @since 1.0.0
 */
public final class WeightedHashProjector {

    private WeightedHashProjector() {
    }

    public static int slot(int wordIndex, int length) {
        if (length <= 0) {
            throw new IllegalArgumentException("Vector length must be positive: " + length);
        }
        return Math.floorMod(wordIndex, length);
    }

    /**
     * {@code vector[wordIndex mod len] += weight}.
     */
    public static void accumulate(double[] vector, int wordIndex, double weight) {
        vector[slot(wordIndex, vector.length)] += weight;
    }

    /**
     * Accumulate {@code weight} at the word's slot and {@code weight * decay^d}
     * at the slots {@code d} positions either side, for {@code d = 1..radius},
     * wrapping around the vector.
     */
    public static void spread(double[] vector, int wordIndex, double weight, double decay, int radius) {
        int center = slot(wordIndex, vector.length);
        vector[center] += weight;

        double share = weight;
        for (int d = 1; d <= radius; d++) {
            share *= decay;
            if (share == 0.0) {
                break;
            }
            vector[Math.floorMod(center - d, vector.length)] += share;
            vector[Math.floorMod(center + d, vector.length)] += share;
        }
    }

    public static double magnitude(double[] vector) {
        double sum = 0.0;
        for (double v : vector) {
            sum += v * v;
        }
        return Math.sqrt(sum);
    }

    /**
     * Scale to unit Euclidean length. A zero-magnitude vector is returned
     * unchanged (as a copy) instead of dividing by zero.
     */
    public static double[] normalize(double[] vector) {
        double m = magnitude(vector);
        double[] result = vector.clone();
        if (m == 0.0) {
            return result;
        }
        for (int i = 0; i < result.length; i++) {
            result[i] /= m;
        }
        return result;
    }
}
