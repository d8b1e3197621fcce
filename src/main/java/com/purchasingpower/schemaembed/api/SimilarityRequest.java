package com.purchasingpower.schemaembed.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Two schemas to compare.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SimilarityRequest {

    private SchemaEmbeddingRequest left;
    private SchemaEmbeddingRequest right;
}
