package com.purchasingpower.schemaembed.embedding;

import com.purchasingpower.schemaembed.core.EmbeddingVector;
import com.purchasingpower.schemaembed.core.GeneratorType;
import com.purchasingpower.schemaembed.core.SchemaMetadata;
import com.purchasingpower.schemaembed.core.WordIndex;

/**
 * Produces one embedding variant from schema text and metadata.
 *
 * Implementations differ only in which tokens receive which extra weight.
 *
 * @since 1.0.0
 */
public interface EmbeddingGenerator {

    GeneratorType getType();

    int getEmbeddingSize();

    /**
     * Generate the normalized embedding, registering words in {@code wordIndex}.
     *
     * Pass the same WordIndex to every generator of one combination request
     * so identical words land on identical slots.
     *
     * @return unit-length vector, or the zero vector when the text has no tokens
     */
    EmbeddingVector generate(String schemaText, SchemaMetadata metadata, WordIndex wordIndex);

    /**
     * Generate with a fresh, private WordIndex.
     */
    default EmbeddingVector generate(String schemaText, SchemaMetadata metadata) {
        return generate(schemaText, metadata, new WordIndex());
    }

    /**
     * Raw weighted sums before normalization. Useful for inspecting how much
     * weight a particular slot received.
     */
    double[] accumulate(String schemaText, SchemaMetadata metadata, WordIndex wordIndex);
}
