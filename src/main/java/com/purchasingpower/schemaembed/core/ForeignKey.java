package com.purchasingpower.schemaembed.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A foreign key column, optionally annotated with what it references.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ForeignKey {

    /**
     * Column holding the key, e.g. "customer_id".
     */
    private String column;

    /**
     * Referenced table, or null when unknown.
     */
    private String referencedTable;

    /**
     * Referenced column, or null when unknown.
     */
    private String referencedColumn;

    public static ForeignKey of(String column) {
        return new ForeignKey(column, null, null);
    }

    public static ForeignKey of(String column, String referencedTable, String referencedColumn) {
        return new ForeignKey(column, referencedTable, referencedColumn);
    }

    public boolean hasReferencedTable() {
        return referencedTable != null && !referencedTable.isBlank();
    }

    public boolean hasReferencedColumn() {
        return referencedColumn != null && !referencedColumn.isBlank();
    }
}
