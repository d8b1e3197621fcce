package com.purchasingpower.schemaembed.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Cosine similarity of two combined schema embeddings.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarityResponse {

    private boolean success;
    private String error;
    private double similarity;

    public static SimilarityResponse success(double similarity) {
        return SimilarityResponse.builder()
            .success(true)
            .similarity(similarity)
            .build();
    }

    public static SimilarityResponse error(String error) {
        return SimilarityResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
