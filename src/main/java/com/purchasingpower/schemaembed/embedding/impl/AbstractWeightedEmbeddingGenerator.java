package com.purchasingpower.schemaembed.embedding.impl;

import com.purchasingpower.schemaembed.core.EmbeddingVector;
import com.purchasingpower.schemaembed.core.ForeignKey;
import com.purchasingpower.schemaembed.core.SchemaMetadata;
import com.purchasingpower.schemaembed.core.WordIndex;
import com.purchasingpower.schemaembed.embedding.EmbeddingGenerator;
import com.purchasingpower.schemaembed.embedding.WeightTable;
import com.purchasingpower.schemaembed.embedding.WeightedHashProjector;
import com.purchasingpower.schemaembed.text.SchemaTokenizer;
import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Shared weighting skeleton for the hashing generators.
 *
 * Subclasses supply the keyword lists and may change how a weight lands in
 * the vector ({@link #project}). Everything else, including the order in
 * which words are registered in the WordIndex, is fixed here so outputs are
 * reproducible.
 *
 * @since 1.0.0
 */
@Slf4j
public abstract class AbstractWeightedEmbeddingGenerator implements EmbeddingGenerator {

    private final int embeddingSize;
    private final WeightTable weights;
    private final SchemaTokenizer tokenizer;

    protected AbstractWeightedEmbeddingGenerator(int embeddingSize, WeightTable weights, SchemaTokenizer tokenizer) {
        Preconditions.checkArgument(embeddingSize > 0, "Embedding size must be positive: %s", embeddingSize);
        Preconditions.checkNotNull(weights, "Weight table cannot be null");
        Preconditions.checkNotNull(tokenizer, "Tokenizer cannot be null");
        this.embeddingSize = embeddingSize;
        this.weights = weights;
        this.tokenizer = tokenizer;
    }

    @Override
    public int getEmbeddingSize() {
        return embeddingSize;
    }

    public WeightTable getWeights() {
        return weights;
    }

    /** Accumulated unconditionally, whether or not the text mentions them. */
    protected List<String> domainKeywords() {
        return Collections.emptyList();
    }

    /** Accumulated only when present as a token of the schema text. */
    protected List<String> conditionalKeywords() {
        return Collections.emptyList();
    }

    /** Substrings marking a foreign key column as a join column. */
    protected List<String> joinPatterns() {
        return Collections.emptyList();
    }

    /**
     * Put {@code weight} into the vector for the word at {@code wordIndex}.
     */
    protected void project(double[] vector, int wordIndex, double weight) {
        WeightedHashProjector.accumulate(vector, wordIndex, weight);
    }

    @Override
    public EmbeddingVector generate(String schemaText, SchemaMetadata metadata, WordIndex wordIndex) {
        double[] raw = accumulate(schemaText, metadata, wordIndex);
        return EmbeddingVector.of(WeightedHashProjector.normalize(raw));
    }

    @Override
    public double[] accumulate(String schemaText, SchemaMetadata metadata, WordIndex wordIndex) {
        double[] vector = new double[embeddingSize];
        List<String> tokens = tokenizer.tokenize(schemaText);
        if (tokens.isEmpty()) {
            log.debug("{}: empty token stream, returning zero vector", getType().getId());
            return vector;
        }

        SchemaMetadata meta = metadata != null ? metadata : SchemaMetadata.empty();
        String primaryKey = meta.hasPrimaryKey() ? normalize(meta.getPrimaryKey()) : null;
        List<ForeignKey> foreignKeys = meta.getForeignKeys() != null ? meta.getForeignKeys() : List.of();
        Set<String> foreignKeyColumns = new HashSet<>();
        for (ForeignKey fk : foreignKeys) {
            if (fk != null && fk.getColumn() != null && !fk.getColumn().isBlank()) {
                foreignKeyColumns.add(normalize(fk.getColumn()));
            }
        }

        // 1. literal text
        for (String token : tokens) {
            double weight = weights.getBase();
            if (token.equals(primaryKey)) {
                weight += weights.getPrimaryKeyToken();
            }
            if (foreignKeyColumns.contains(token)) {
                weight += weights.getForeignKeyToken();
            }
            add(vector, wordIndex, token, weight);
        }

        // 2. primary key as a unit
        if (primaryKey != null) {
            add(vector, wordIndex, primaryKey, weights.getPrimaryKeyExtra());
        }

        // 3. foreign keys as units
        for (ForeignKey fk : foreignKeys) {
            if (fk == null || fk.getColumn() == null || fk.getColumn().isBlank()) {
                continue;
            }
            String column = normalize(fk.getColumn());
            add(vector, wordIndex, column, weights.getForeignKeyExtra());
            if (fk.hasReferencedTable()) {
                add(vector, wordIndex, normalize(fk.getReferencedTable()), weights.getReferencedExtra());
            }
            if (fk.hasReferencedColumn()) {
                add(vector, wordIndex, normalize(fk.getReferencedColumn()), weights.getReferencedExtra());
            }
            for (String pattern : joinPatterns()) {
                if (column.contains(pattern)) {
                    add(vector, wordIndex, column, weights.getJoinPattern());
                }
            }
        }

        // 4. constant domain bias
        for (String keyword : domainKeywords()) {
            add(vector, wordIndex, keyword, weights.getDomainKeyword());
        }

        // 5. keywords the text actually contains
        Set<String> present = new LinkedHashSet<>(tokens);
        for (String keyword : conditionalKeywords()) {
            if (present.contains(keyword)) {
                add(vector, wordIndex, keyword, weights.getConditional());
            }
        }

        // 6. entities
        if (meta.getEntities() != null) {
            for (String entity : meta.getEntities()) {
                if (entity != null && !entity.isBlank()) {
                    add(vector, wordIndex, normalize(entity), weights.getEntity());
                }
            }
        }

        log.debug("{}: {} tokens, vocabulary now {} words", getType().getId(), tokens.size(), wordIndex.count());
        return vector;
    }

    private void add(double[] vector, WordIndex wordIndex, String word, double weight) {
        int index = wordIndex.getOrAdd(word);
        if (weight != 0.0) {
            project(vector, index, weight);
        }
    }

    private static String normalize(String value) {
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
