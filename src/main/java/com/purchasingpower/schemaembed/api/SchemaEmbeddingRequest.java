package com.purchasingpower.schemaembed.api;

import com.purchasingpower.schemaembed.core.ColumnRecord;
import com.purchasingpower.schemaembed.core.SchemaMetadata;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Schema embedding request. Supply either {@code metadata} directly or the
 * introspection {@code columns} it should be derived from.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaEmbeddingRequest {

    private String schemaText;
    private SchemaMetadata metadata;
    private List<ColumnRecord> columns;
}
