package com.purchasingpower.schemaembed.configuration;

import com.purchasingpower.schemaembed.embedding.EmbeddingCombiner;
import com.purchasingpower.schemaembed.embedding.EmbeddingGenerator;
import com.purchasingpower.schemaembed.embedding.impl.EnhancedEmbeddingGenerator;
import com.purchasingpower.schemaembed.embedding.impl.ForeignKeyAwareEmbeddingGenerator;
import com.purchasingpower.schemaembed.embedding.impl.PrimaryKeyAwareEmbeddingGenerator;
import com.purchasingpower.schemaembed.learned.FoldingDimensionReducer;
import com.purchasingpower.schemaembed.learned.LearnedEmbeddingAdapter;
import com.purchasingpower.schemaembed.learned.impl.LangChain4jEmbeddingAdapter;
import com.purchasingpower.schemaembed.schema.SchemaMetadataExtractor;
import com.purchasingpower.schemaembed.text.SchemaTokenizer;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.ollama.OllamaEmbeddingModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the embedding engine from {@link EmbeddingProperties}.
 *
 * Configuration is validated here, before any generator is built, so a bad
 * weight or size stops the application at startup.
 *
 * @since 1.0.0
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(EmbeddingProperties.class)
public class EmbeddingEngineConfig {

    private final EmbeddingProperties properties;

    public EmbeddingEngineConfig(EmbeddingProperties properties) {
        properties.validate();
        this.properties = properties;

        log.info("🔷 Embedding engine configuration");
        log.info("   - Embedding size: {}", properties.getEmbeddingSize());
        log.info("   - Generator weights: {}", properties.getGeneratorWeights());
        log.info("   - Stop-word removal: {}", properties.isRemoveStopWords());
        log.info("   - Parallel generators: {}", properties.isParallel());
        log.info("   - Sliding window: decay={}, radius={}",
                properties.getSlidingWindow().getDecay(), properties.getSlidingWindow().getRadius());
    }

    @Bean
    public SchemaTokenizer schemaTokenizer() {
        return new SchemaTokenizer(properties.isRemoveStopWords());
    }

    @Bean
    public EmbeddingCombiner embeddingCombiner() {
        return new EmbeddingCombiner();
    }

    @Bean
    public SchemaMetadataExtractor schemaMetadataExtractor() {
        return new SchemaMetadataExtractor();
    }

    @Bean
    public EmbeddingGenerator enhancedEmbeddingGenerator(SchemaTokenizer tokenizer) {
        return new EnhancedEmbeddingGenerator(
                properties.getEmbeddingSize(),
                properties.getWeights().getEnhanced(),
                tokenizer,
                properties.getSlidingWindow().getDecay(),
                properties.getSlidingWindow().getRadius());
    }

    @Bean
    public EmbeddingGenerator primaryKeyAwareEmbeddingGenerator(SchemaTokenizer tokenizer) {
        return new PrimaryKeyAwareEmbeddingGenerator(
                properties.getEmbeddingSize(), properties.getWeights().getPrimaryKeyAware(), tokenizer);
    }

    @Bean
    public EmbeddingGenerator foreignKeyAwareEmbeddingGenerator(SchemaTokenizer tokenizer) {
        return new ForeignKeyAwareEmbeddingGenerator(
                properties.getEmbeddingSize(), properties.getWeights().getForeignKeyAware(), tokenizer);
    }

    @Bean
    @ConditionalOnProperty(prefix = "app.embedding.learned", name = "enabled", havingValue = "true")
    public LearnedEmbeddingAdapter learnedEmbeddingAdapter() {
        EmbeddingProperties.Learned learned = properties.getLearned();

        log.info("🔷 Initializing learned embedding adapter");
        log.info("   - Ollama URL: {}", learned.getBaseUrl());
        log.info("   - Model: {}", learned.getModelName());
        log.info("   - Timeout: {}s", learned.getTimeoutSeconds());
        log.info("   - Max Retries: {}", learned.getMaxRetries());

        EmbeddingModel model = OllamaEmbeddingModel.builder()
                .baseUrl(learned.getBaseUrl())
                .modelName(learned.getModelName())
                .timeout(Duration.ofSeconds(learned.getTimeoutSeconds()))
                .maxRetries(learned.getMaxRetries())
                .logRequests(false)
                .logResponses(false)
                .build();

        FoldingDimensionReducer reducer = learned.isReduceToEmbeddingSize()
                ? new FoldingDimensionReducer(properties.getEmbeddingSize())
                : null;

        return new LangChain4jEmbeddingAdapter(model, learned.getModelName(), reducer, learned.getDimension());
    }
}
