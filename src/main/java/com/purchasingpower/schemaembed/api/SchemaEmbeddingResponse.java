package com.purchasingpower.schemaembed.api;

import com.purchasingpower.schemaembed.core.SchemaEmbedding;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Schema embedding response.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaEmbeddingResponse {

    private boolean success;
    private String error;

    private int dimension;
    private int vocabularySize;

    @Builder.Default
    private List<Double> embedding = new ArrayList<>();

    @Builder.Default
    private Map<String, List<Double>> generators = new LinkedHashMap<>();

    @Builder.Default
    private Map<String, Double> weights = new LinkedHashMap<>();

    public static SchemaEmbeddingResponse success(SchemaEmbedding result) {
        Map<String, List<Double>> generators = new LinkedHashMap<>();
        result.getGeneratorOutputs().forEach((id, vector) -> generators.put(id, vector.toList()));

        return SchemaEmbeddingResponse.builder()
            .success(true)
            .dimension(result.getCombined().dimension())
            .vocabularySize(result.getVocabularySize())
            .embedding(result.getCombined().toList())
            .generators(generators)
            .weights(result.getWeights())
            .build();
    }

    public static SchemaEmbeddingResponse error(String error) {
        return SchemaEmbeddingResponse.builder()
            .success(false)
            .error(error)
            .build();
    }
}
