package com.purchasingpower.schemaembed.embedding.impl;

import com.purchasingpower.schemaembed.core.GeneratorType;
import com.purchasingpower.schemaembed.embedding.WeightTable;
import com.purchasingpower.schemaembed.text.SchemaTokenizer;

import java.util.List;

/**
 * Emphasizes the primary key and identifier vocabulary.
 *
 * @since 1.0.0
 */
public class PrimaryKeyAwareEmbeddingGenerator extends AbstractWeightedEmbeddingGenerator {

    static final List<String> DOMAIN_KEYWORDS = List.of("primary", "key", "id", "identifier");

    // Common primary key column types
    static final List<String> KEY_TYPES = List.of("int", "bigint", "uuid", "guid");

    public PrimaryKeyAwareEmbeddingGenerator(int embeddingSize, WeightTable weights, SchemaTokenizer tokenizer) {
        super(embeddingSize, weights, tokenizer);
    }

    @Override
    public GeneratorType getType() {
        return GeneratorType.PRIMARY_KEY_AWARE;
    }

    @Override
    protected List<String> domainKeywords() {
        return DOMAIN_KEYWORDS;
    }

    @Override
    protected List<String> conditionalKeywords() {
        return KEY_TYPES;
    }
}
