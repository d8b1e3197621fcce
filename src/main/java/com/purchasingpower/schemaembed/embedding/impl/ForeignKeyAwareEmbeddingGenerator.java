package com.purchasingpower.schemaembed.embedding.impl;

import com.purchasingpower.schemaembed.core.GeneratorType;
import com.purchasingpower.schemaembed.embedding.WeightTable;
import com.purchasingpower.schemaembed.text.SchemaTokenizer;

import java.util.List;

/**
 * Emphasizes relationships: foreign key columns, what they reference,
 * referential actions and join-column naming.
 *
 * @since 1.0.0
 */
public class ForeignKeyAwareEmbeddingGenerator extends AbstractWeightedEmbeddingGenerator {

    static final List<String> DOMAIN_KEYWORDS = List.of("foreign", "key", "references", "constraint");

    static final List<String> RELATIONSHIP_WORDS = List.of("on", "delete", "cascade", "set", "null", "update");

    static final List<String> JOIN_PATTERNS = List.of("_id", "_fk");

    public ForeignKeyAwareEmbeddingGenerator(int embeddingSize, WeightTable weights, SchemaTokenizer tokenizer) {
        super(embeddingSize, weights, tokenizer);
    }

    @Override
    public GeneratorType getType() {
        return GeneratorType.FOREIGN_KEY_AWARE;
    }

    @Override
    protected List<String> domainKeywords() {
        return DOMAIN_KEYWORDS;
    }

    @Override
    protected List<String> conditionalKeywords() {
        return RELATIONSHIP_WORDS;
    }

    @Override
    protected List<String> joinPatterns() {
        return JOIN_PATTERNS;
    }
}
