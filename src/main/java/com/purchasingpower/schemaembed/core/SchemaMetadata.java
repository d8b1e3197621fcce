package com.purchasingpower.schemaembed.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured facts about a schema that drive generator weighting.
 *
 * Supplied by the schema-introspection side, either directly or derived
 * from column records by {@code SchemaMetadataExtractor}.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SchemaMetadata {

    /**
     * Table and column names, in schema order.
     */
    @Builder.Default
    private List<String> entities = new ArrayList<>();

    /**
     * Primary key column. Empty or null when the schema has none.
     */
    @Builder.Default
    private String primaryKey = "";

    @Builder.Default
    private List<ForeignKey> foreignKeys = new ArrayList<>();

    public static SchemaMetadata empty() {
        return SchemaMetadata.builder().build();
    }

    public boolean hasPrimaryKey() {
        return primaryKey != null && !primaryKey.isBlank();
    }
}
