package com.purchasingpower.schemaembed.learned.impl;

import com.purchasingpower.schemaembed.core.EmbeddingVector;
import com.purchasingpower.schemaembed.embedding.WeightedHashProjector;
import com.purchasingpower.schemaembed.exception.EmbeddingGenerationException;
import com.purchasingpower.schemaembed.learned.FoldingDimensionReducer;
import com.purchasingpower.schemaembed.learned.LearnedEmbeddingAdapter;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

/**
 * LearnedEmbeddingAdapter backed by a LangChain4j EmbeddingModel.
 *
 * Retries and timeouts are the model's concern (OllamaEmbeddingModel has
 * both built in). This class validates the output, optionally folds it to
 * the configured embedding size and normalizes it.
 *
 * @since 1.0.0
 */
@Slf4j
public class LangChain4jEmbeddingAdapter implements LearnedEmbeddingAdapter {

    private final EmbeddingModel embeddingModel;
    private final String modelName;
    private final FoldingDimensionReducer reducer;
    private final int dimension;

    /**
     * @param reducer null to pass the model's own dimension through
     * @param modelDimension model output length, used when no reducer is set
     */
    public LangChain4jEmbeddingAdapter(EmbeddingModel embeddingModel, String modelName,
                                       FoldingDimensionReducer reducer, int modelDimension) {
        this.embeddingModel = embeddingModel;
        this.modelName = modelName;
        this.reducer = reducer;
        this.dimension = reducer != null ? reducer.getTargetDimension() : modelDimension;
    }

    @Override
    public EmbeddingVector embed(String schemaText) {
        if (schemaText == null || schemaText.isBlank()) {
            return EmbeddingVector.zero(dimension);
        }

        log.debug("🔷 Generating learned embedding with {} (text length: {})", modelName, schemaText.length());

        Response<Embedding> response;
        try {
            response = embeddingModel.embed(schemaText);
        } catch (Exception e) {
            log.error("❌ Learned embedding failed with {}: {}", modelName, e.getMessage());
            throw new EmbeddingGenerationException("Learned embedding generation failed with " + modelName, e);
        }
        if (response == null || response.content() == null) {
            throw new EmbeddingGenerationException("Model " + modelName + " returned no embedding");
        }

        float[] raw = response.content().vector();
        double[] values = new double[raw.length];
        for (int i = 0; i < raw.length; i++) {
            if (!Float.isFinite(raw[i])) {
                throw new EmbeddingGenerationException("Model " + modelName + " returned a non-finite value at " + i);
            }
            values[i] = raw[i];
        }

        if (reducer != null) {
            values = reducer.reduce(values);
        } else if (values.length != dimension) {
            throw new EmbeddingGenerationException("Model " + modelName + " returned " + values.length
                    + " dimensions, expected " + dimension);
        }

        return EmbeddingVector.of(WeightedHashProjector.normalize(values));
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public String modelName() {
        return modelName;
    }
}
