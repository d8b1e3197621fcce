package com.purchasingpower.schemaembed.service;

import com.purchasingpower.schemaembed.core.ColumnRecord;
import com.purchasingpower.schemaembed.core.EmbeddingVector;
import com.purchasingpower.schemaembed.core.GeneratorType;
import com.purchasingpower.schemaembed.core.SchemaDocument;
import com.purchasingpower.schemaembed.core.SchemaEmbedding;
import com.purchasingpower.schemaembed.core.SchemaMetadata;

import java.util.List;

/**
 * Entry point for turning a schema into its embedding.
 *
 * One call is one embedding request: it runs every generator with a positive
 * configured weight and combines their outputs.
 *
 * @since 1.0.0
 */
public interface SchemaEmbeddingService {

    /**
     * Embed rendered schema text with its metadata.
     *
     * @param schemaText concatenated CREATE TABLE statements
     * @param metadata entities, primary key and foreign keys
     * @return combined vector plus each generator's output
     */
    SchemaEmbedding embed(String schemaText, SchemaMetadata metadata);

    /**
     * Embed rendered schema text, deriving metadata from introspection column records.
     */
    SchemaEmbedding embed(String schemaText, List<ColumnRecord> columns);

    /**
     * Embed several schemas against one shared vocabulary.
     *
     * Word indices are assigned in first-seen order, so vectors are only
     * comparable when their words were registered in the same WordIndex.
     * Use this whenever the results will be compared with each other.
     *
     * @return one result per document, in input order
     */
    List<SchemaEmbedding> embedAll(List<SchemaDocument> documents);

    /**
     * Cosine similarity of two schemas, embedded as one batch.
     */
    double similarity(SchemaDocument left, SchemaDocument right);

    /**
     * Run a single generator with a private WordIndex.
     *
     * @throws IllegalArgumentException if the generator is not available
     */
    EmbeddingVector generate(GeneratorType type, String schemaText, SchemaMetadata metadata);
}
