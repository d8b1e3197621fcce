package com.purchasingpower.schemaembed.service.impl;

import com.purchasingpower.schemaembed.configuration.EmbeddingProperties;
import com.purchasingpower.schemaembed.core.ColumnRecord;
import com.purchasingpower.schemaembed.core.EmbeddingVector;
import com.purchasingpower.schemaembed.core.GeneratorType;
import com.purchasingpower.schemaembed.core.SchemaDocument;
import com.purchasingpower.schemaembed.core.SchemaEmbedding;
import com.purchasingpower.schemaembed.core.SchemaMetadata;
import com.purchasingpower.schemaembed.core.SynchronizedWordIndex;
import com.purchasingpower.schemaembed.core.WordIndex;
import com.purchasingpower.schemaembed.embedding.EmbeddingCombiner;
import com.purchasingpower.schemaembed.embedding.EmbeddingGenerator;
import com.purchasingpower.schemaembed.learned.LearnedEmbeddingAdapter;
import com.purchasingpower.schemaembed.schema.SchemaMetadataExtractor;
import com.purchasingpower.schemaembed.service.SchemaEmbeddingService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Default SchemaEmbeddingService.
 *
 * Sequential mode shares one WordIndex across every generator and every
 * document of a request, filled in a fixed order (document by document,
 * generators in {@link GeneratorType} order), so identical words map to
 * identical slots everywhere in the batch.
 *
 * Parallel mode gives each generator its own WordIndex, shared across the
 * documents that generator processes. A single index filled from several
 * threads would assign indices in a nondeterministic order.
 *
 * @since 1.0.0
 */
@Slf4j
@Service
public class SchemaEmbeddingServiceImpl implements SchemaEmbeddingService {

    private final List<EmbeddingGenerator> generators;
    private final Optional<LearnedEmbeddingAdapter> learnedAdapter;
    private final EmbeddingCombiner combiner;
    private final SchemaMetadataExtractor metadataExtractor;
    private final EmbeddingProperties properties;
    private final Executor executor;

    public SchemaEmbeddingServiceImpl(List<EmbeddingGenerator> generators,
                                      Optional<LearnedEmbeddingAdapter> learnedAdapter,
                                      EmbeddingCombiner combiner,
                                      SchemaMetadataExtractor metadataExtractor,
                                      EmbeddingProperties properties,
                                      @Qualifier("embeddingExecutor") Executor executor) {
        List<EmbeddingGenerator> ordered = new ArrayList<>(generators);
        ordered.sort(Comparator.comparing(g -> g.getType().ordinal()));
        this.generators = ordered;
        this.learnedAdapter = learnedAdapter;
        this.combiner = combiner;
        this.metadataExtractor = metadataExtractor;
        this.properties = properties;
        this.executor = executor;
    }

    @Override
    public SchemaEmbedding embed(String schemaText, SchemaMetadata metadata) {
        return embedAll(List.of(SchemaDocument.of(schemaText, metadata))).get(0);
    }

    @Override
    public SchemaEmbedding embed(String schemaText, List<ColumnRecord> columns) {
        return embed(schemaText, metadataExtractor.extract(columns));
    }

    @Override
    public List<SchemaEmbedding> embedAll(List<SchemaDocument> documents) {
        if (documents == null || documents.isEmpty()) {
            return List.of();
        }

        List<EmbeddingGenerator> active = generators.stream()
                .filter(g -> properties.weightOf(g.getType()) > 0)
                .toList();

        log.debug("Embedding {} schema(s) with {} generators, parallel={}",
                documents.size(), active.size(), properties.isParallel());

        List<Map<String, EmbeddingVector>> outputs = new ArrayList<>();
        for (int i = 0; i < documents.size(); i++) {
            outputs.add(new LinkedHashMap<>());
        }

        int vocabularySize = properties.isParallel()
                ? runParallel(active, documents, outputs)
                : runSequential(active, documents, outputs);

        if (properties.weightOf(GeneratorType.LEARNED) > 0) {
            LearnedEmbeddingAdapter adapter = learnedAdapter.orElseThrow(() ->
                    new IllegalStateException("Learned generator is weighted but no adapter is configured"));
            for (int i = 0; i < documents.size(); i++) {
                outputs.get(i).put(GeneratorType.LEARNED.getId(), adapter.embed(documents.get(i).getSchemaText()));
            }
        }

        List<SchemaEmbedding> results = new ArrayList<>(documents.size());
        for (Map<String, EmbeddingVector> perGenerator : outputs) {
            Map<String, Double> weights = new LinkedHashMap<>();
            perGenerator.keySet().forEach(id -> weights.put(id, properties.weightOf(GeneratorType.fromId(id))));

            results.add(SchemaEmbedding.builder()
                    .combined(combiner.combine(perGenerator, weights))
                    .generatorOutputs(perGenerator)
                    .weights(weights)
                    .vocabularySize(vocabularySize)
                    .build());
        }

        log.debug("✅ Embedded {} schema(s), vocabulary {} words", results.size(), vocabularySize);
        return results;
    }

    @Override
    public double similarity(SchemaDocument left, SchemaDocument right) {
        List<SchemaEmbedding> pair = embedAll(List.of(left, right));
        return pair.get(0).getCombined().cosineSimilarity(pair.get(1).getCombined());
    }

    @Override
    public EmbeddingVector generate(GeneratorType type, String schemaText, SchemaMetadata metadata) {
        if (type == GeneratorType.LEARNED) {
            return learnedAdapter
                    .orElseThrow(() -> new IllegalArgumentException("Learned embedding adapter is not enabled"))
                    .embed(schemaText);
        }
        return generators.stream()
                .filter(g -> g.getType() == type)
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("No generator registered for " + type.getId()))
                .generate(schemaText, metadata);
    }

    private int runSequential(List<EmbeddingGenerator> active, List<SchemaDocument> documents,
                              List<Map<String, EmbeddingVector>> outputs) {
        WordIndex shared = new SynchronizedWordIndex();
        for (int i = 0; i < documents.size(); i++) {
            SchemaDocument document = documents.get(i);
            for (EmbeddingGenerator generator : active) {
                outputs.get(i).put(generator.getType().getId(),
                        generator.generate(document.getSchemaText(), document.getMetadata(), shared));
            }
        }
        return shared.count();
    }

    private int runParallel(List<EmbeddingGenerator> active, List<SchemaDocument> documents,
                            List<Map<String, EmbeddingVector>> outputs) {
        List<WordIndex> indexes = new ArrayList<>();
        List<CompletableFuture<List<EmbeddingVector>>> futures = new ArrayList<>();
        for (EmbeddingGenerator generator : active) {
            WordIndex index = new WordIndex();
            indexes.add(index);
            futures.add(CompletableFuture.supplyAsync(() -> {
                List<EmbeddingVector> vectors = new ArrayList<>(documents.size());
                for (SchemaDocument document : documents) {
                    vectors.add(generator.generate(document.getSchemaText(), document.getMetadata(), index));
                }
                return vectors;
            }, executor));
        }

        for (int g = 0; g < active.size(); g++) {
            List<EmbeddingVector> vectors;
            try {
                vectors = futures.get(g).join();
            } catch (CompletionException e) {
                if (e.getCause() instanceof RuntimeException cause) {
                    throw cause;
                }
                throw e;
            }
            String id = active.get(g).getType().getId();
            for (int i = 0; i < documents.size(); i++) {
                outputs.get(i).put(id, vectors.get(i));
            }
        }

        return indexes.stream().mapToInt(WordIndex::count).max().orElse(0);
    }
}
