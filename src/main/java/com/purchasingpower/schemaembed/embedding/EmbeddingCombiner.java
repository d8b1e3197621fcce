package com.purchasingpower.schemaembed.embedding;

import com.purchasingpower.schemaembed.core.EmbeddingVector;
import com.purchasingpower.schemaembed.core.WeightedEmbedding;
import com.purchasingpower.schemaembed.exception.DimensionMismatchException;
import com.purchasingpower.schemaembed.exception.EmbeddingConfigurationException;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Linear blend of generator outputs followed by normalization.
 *
 * {@code result[i] = sum_g(weight_g * vector_g[i])}, then scaled to unit
 * length. A uniform positive rescaling of all weights therefore leaves the
 * result unchanged.
 *
 * @since 1.0.0
 */
@Slf4j
public class EmbeddingCombiner {

    /**
     * @throws DimensionMismatchException if the vectors differ in length
     * @throws EmbeddingConfigurationException if there is nothing to combine
     */
    public EmbeddingVector combine(List<WeightedEmbedding> inputs) {
        if (inputs == null || inputs.isEmpty()) {
            throw new EmbeddingConfigurationException("app.embedding.generator-weights", "No generator outputs to combine");
        }

        int dimension = inputs.get(0).getVector().dimension();
        for (WeightedEmbedding input : inputs) {
            if (input.getVector().dimension() != dimension) {
                throw new DimensionMismatchException(
                        "Generator '" + input.getGeneratorId() + "' produced a vector of different length",
                        dimension, input.getVector().dimension());
            }
        }

        double[] sum = new double[dimension];
        for (WeightedEmbedding input : inputs) {
            double weight = input.getWeight();
            if (weight == 0.0) {
                continue;
            }
            for (int i = 0; i < dimension; i++) {
                sum[i] += weight * input.getVector().get(i);
            }
        }

        log.debug("Combined {} generator outputs ({} dimensions)", inputs.size(), dimension);
        return EmbeddingVector.of(WeightedHashProjector.normalize(sum));
    }

    /**
     * Combine outputs keyed by generator id. Ids missing from {@code weights}
     * get weight 0.
     */
    public EmbeddingVector combine(Map<String, EmbeddingVector> outputs, Map<String, Double> weights) {
        List<WeightedEmbedding> inputs = new ArrayList<>();
        if (outputs != null) {
            outputs.forEach((id, vector) -> {
                Double weight = weights != null ? weights.get(id) : null;
                inputs.add(WeightedEmbedding.of(id, vector, weight != null ? weight : 0.0));
            });
        }
        return combine(inputs);
    }
}
