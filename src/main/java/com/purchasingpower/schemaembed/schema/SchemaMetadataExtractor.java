package com.purchasingpower.schemaembed.schema;

import com.purchasingpower.schemaembed.core.ColumnRecord;
import com.purchasingpower.schemaembed.core.ForeignKey;
import com.purchasingpower.schemaembed.core.SchemaMetadata;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Derives {@link SchemaMetadata} from schema-introspection column records.
 *
 * - entities: table and column names in first-seen order, no duplicates
 * - primary key: first column flagged as primary key, empty if none
 * - foreign keys: every column flagged as foreign key, with its reference
 */
@Slf4j
public class SchemaMetadataExtractor {

    public SchemaMetadata extract(List<ColumnRecord> columns) {
        if (columns == null || columns.isEmpty()) {
            return SchemaMetadata.empty();
        }

        Set<String> entities = new LinkedHashSet<>();
        String primaryKey = "";
        Map<String, ForeignKey> foreignKeys = new LinkedHashMap<>();

        for (ColumnRecord column : columns) {
            if (column == null) {
                continue;
            }
            if (notBlank(column.getTable())) {
                entities.add(column.getTable());
            }
            if (!notBlank(column.getColumn())) {
                continue;
            }
            entities.add(column.getColumn());

            if (column.isPrimaryKey() && primaryKey.isEmpty()) {
                primaryKey = column.getColumn();
            }
            if (column.isForeignKey()) {
                String key = column.getColumn() + "->" + column.getReferencedTable() + "." + column.getReferencedColumn();
                foreignKeys.putIfAbsent(key, ForeignKey.of(
                        column.getColumn(), column.getReferencedTable(), column.getReferencedColumn()));
            }
        }

        log.debug("Extracted {} entities, primary key '{}', {} foreign keys from {} columns",
                entities.size(), primaryKey, foreignKeys.size(), columns.size());

        return SchemaMetadata.builder()
                .entities(new ArrayList<>(entities))
                .primaryKey(primaryKey)
                .foreignKeys(new ArrayList<>(foreignKeys.values()))
                .build();
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
