package com.purchasingpower.schemaembed.core;

import lombok.Value;

/**
 * Rendered schema text together with its metadata; the unit a generator embeds.
 */
@Value
public class SchemaDocument {
    String schemaText;
    SchemaMetadata metadata;

    public static SchemaDocument of(String schemaText, SchemaMetadata metadata) {
        return new SchemaDocument(schemaText, metadata != null ? metadata : SchemaMetadata.empty());
    }
}
