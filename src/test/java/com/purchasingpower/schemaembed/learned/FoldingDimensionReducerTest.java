package com.purchasingpower.schemaembed.learned;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Folding Dimension Reducer Tests")
class FoldingDimensionReducerTest {

    @Test
    @DisplayName("Longer vectors fold modulo the target length")
    void reduce_folds() {
        double[] reduced = new FoldingDimensionReducer(3).reduce(new double[]{1, 2, 3, 4, 5});

        assertThat(reduced).containsExactly(5.0, 7.0, 3.0);
    }

    @Test
    @DisplayName("Shorter vectors are zero-padded")
    void reduce_pads() {
        double[] reduced = new FoldingDimensionReducer(4).reduce(new double[]{1, 2});

        assertThat(reduced).containsExactly(1.0, 2.0, 0.0, 0.0);
    }

    @Test
    @DisplayName("Target dimension must be positive")
    void invalidTarget() {
        assertThatThrownBy(() -> new FoldingDimensionReducer(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
