package com.purchasingpower.schemaembed.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One row of the schema-introspection result.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnRecord {

    private String table;
    private String column;
    private String dataType;
    private boolean nullable;
    private boolean identity;
    private boolean primaryKey;
    private boolean foreignKey;

    /**
     * Only meaningful when {@link #foreignKey} is set.
     */
    private String referencedTable;
    private String referencedColumn;
}
