package com.purchasingpower.schemaembed.configuration;

import com.purchasingpower.schemaembed.core.GeneratorType;
import com.purchasingpower.schemaembed.embedding.WeightTable;
import com.purchasingpower.schemaembed.exception.EmbeddingConfigurationException;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Embedding engine configuration.
 *
 * <p>Properties are loaded from the {@code app.embedding} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   embedding:
 *     embedding-size: 3072
 *     generator-weights:
 *       enhanced: 1.0
 *       primary-key-aware: 1.0
 *       foreign-key-aware: 1.0
 *     weights:
 *       primary-key-aware:
 *         primary-key-extra: 20
 *     sliding-window:
 *       decay: 0.5
 *       radius: 1
 * </pre>
 *
 * <p>Bean Validation catches malformed values while binding; {@link #validate()}
 * fills in default generator weights, checks the cross-field rules and is
 * called once at startup.
 *
 * @since 1.0.0
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.embedding")
public class EmbeddingProperties {

    /**
     * Length of every generated vector.
     * Default: 3072
     */
    @Min(1)
    private int embeddingSize = 3072;

    /**
     * Generator id to combination weight. Generators absent here get weight 0
     * and are not run. When nothing is configured, {@link #validate()} weights
     * each hashing generator 1.0.
     */
    @NotNull
    private Map<String, Double> generatorWeights = new LinkedHashMap<>();

    /**
     * Drop English stop words after tokenizing.
     * Default: false
     */
    private boolean removeStopWords = false;

    /**
     * Run generators concurrently on the embedding executor. Each generator
     * then gets its own WordIndex.
     * Default: false
     */
    private boolean parallel = false;

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private SlidingWindow slidingWindow = new SlidingWindow();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Weights weights = new Weights();

    @Valid
    @NotNull
    @NestedConfigurationProperty
    private Learned learned = new Learned();

    @Data
    public static class SlidingWindow {

        /**
         * Fraction of a weight passed on per slot of distance. Range: 0.0-1.0
         */
        private double decay = 0.5;

        /**
         * Number of neighbouring slots on each side that receive a share.
         */
        @Min(0)
        private int radius = 1;
    }

    @Data
    public static class Weights {

        @NestedConfigurationProperty
        private WeightTable enhanced = WeightTable.enhancedDefaults();

        @NestedConfigurationProperty
        private WeightTable primaryKeyAware = WeightTable.primaryKeyAwareDefaults();

        @NestedConfigurationProperty
        private WeightTable foreignKeyAware = WeightTable.foreignKeyAwareDefaults();
    }

    @Data
    public static class Learned {

        private boolean enabled = false;

        private String baseUrl = "http://localhost:11434";

        private String modelName = "mxbai-embed-large";

        /**
         * Output length of the model, used when reduction is off.
         */
        @Min(1)
        private int dimension = 1024;

        /**
         * Fold model output to {@code embedding-size} so it can be combined.
         */
        private boolean reduceToEmbeddingSize = true;

        @Min(1)
        private int timeoutSeconds = 120;

        @Min(0)
        private int maxRetries = 3;
    }

    public double weightOf(GeneratorType type) {
        Double weight = generatorWeights.get(type.getId());
        return weight != null ? weight : 0.0;
    }

    /**
     * Fail fast on configuration that would only break at generation time.
     *
     * @throws EmbeddingConfigurationException on the first invalid setting
     */
    public void validate() {
        if (generatorWeights.isEmpty()) {
            generatorWeights.putAll(defaultGeneratorWeights());
        }

        if (embeddingSize <= 0) {
            throw new EmbeddingConfigurationException("app.embedding.embedding-size",
                    "must be positive, was " + embeddingSize);
        }

        for (Map.Entry<String, Double> entry : generatorWeights.entrySet()) {
            GeneratorType.fromId(entry.getKey());
            Double weight = entry.getValue();
            if (weight == null || !Double.isFinite(weight) || weight < 0) {
                throw new EmbeddingConfigurationException("app.embedding.generator-weights." + entry.getKey(),
                        "must be a finite, non-negative number, was " + weight);
            }
        }

        boolean anyPositive = Arrays.stream(GeneratorType.values()).anyMatch(type -> weightOf(type) > 0);
        if (!anyPositive) {
            throw new EmbeddingConfigurationException("app.embedding.generator-weights",
                    "at least one generator needs a positive weight");
        }

        if (weightOf(GeneratorType.LEARNED) > 0 && !learned.isEnabled()) {
            throw new EmbeddingConfigurationException("app.embedding.generator-weights.learned",
                    "learned generator is weighted but app.embedding.learned.enabled is false");
        }
        if (weightOf(GeneratorType.LEARNED) > 0 && !learned.isReduceToEmbeddingSize()
                && learned.getDimension() != embeddingSize) {
            throw new EmbeddingConfigurationException("app.embedding.learned.dimension",
                    "model dimension " + learned.getDimension() + " cannot be combined with embedding size "
                            + embeddingSize + " unless reduce-to-embedding-size is on");
        }

        double decay = slidingWindow.getDecay();
        if (!Double.isFinite(decay) || decay < 0.0 || decay > 1.0) {
            throw new EmbeddingConfigurationException("app.embedding.sliding-window.decay",
                    "must be within [0, 1], was " + decay);
        }
        if (slidingWindow.getRadius() < 0) {
            throw new EmbeddingConfigurationException("app.embedding.sliding-window.radius",
                    "cannot be negative, was " + slidingWindow.getRadius());
        }

        checkTable("enhanced", weights.getEnhanced());
        checkTable("primary-key-aware", weights.getPrimaryKeyAware());
        checkTable("foreign-key-aware", weights.getForeignKeyAware());
    }

    private static void checkTable(String name, WeightTable table) {
        if (table == null) {
            throw new EmbeddingConfigurationException("app.embedding.weights." + name, "is missing");
        }
        String invalid = table.findInvalidWeight();
        if (invalid != null) {
            throw new EmbeddingConfigurationException("app.embedding.weights." + name + "." + invalid,
                    "must be a finite, non-negative number");
        }
    }

    private static Map<String, Double> defaultGeneratorWeights() {
        Map<String, Double> weights = new LinkedHashMap<>();
        weights.put(GeneratorType.ENHANCED.getId(), 1.0);
        weights.put(GeneratorType.PRIMARY_KEY_AWARE.getId(), 1.0);
        weights.put(GeneratorType.FOREIGN_KEY_AWARE.getId(), 1.0);
        return weights;
    }
}
