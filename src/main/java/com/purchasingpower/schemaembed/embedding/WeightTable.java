package com.purchasingpower.schemaembed.embedding;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-generator weights. Bound from {@code app.embedding.weights.<generator>},
 * so every field can be overridden individually.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeightTable {

    /** Added for every token of the schema text. */
    private double base;

    /** Added to a token equal to the primary key. */
    private double primaryKeyToken;

    /** Added to a token equal to one of the foreign key columns. */
    private double foreignKeyToken;

    /** Added once at the primary key's slot. */
    private double primaryKeyExtra;

    /** Added once per foreign key at its slot. */
    private double foreignKeyExtra;

    /** Added at the referenced table/column slot of each foreign key. */
    private double referencedExtra;

    /** Added unconditionally for each domain keyword. */
    private double domainKeyword;

    /** Added for each conditional keyword present in the text. */
    private double conditional;

    /** Added once per foreign key whose name contains a join pattern. */
    private double joinPattern;

    /** Added for each entity name. */
    private double entity;

    public static WeightTable enhancedDefaults() {
        return WeightTable.builder()
                .base(1)
                .primaryKeyToken(3)
                .foreignKeyToken(2)
                .primaryKeyExtra(5)
                .foreignKeyExtra(3)
                .entity(4)
                .build();
    }

    public static WeightTable primaryKeyAwareDefaults() {
        return WeightTable.builder()
                .base(1)
                .primaryKeyToken(10)
                .foreignKeyToken(3)
                .primaryKeyExtra(15)
                .domainKeyword(5)
                .conditional(3)
                .entity(2)
                .build();
    }

    public static WeightTable foreignKeyAwareDefaults() {
        return WeightTable.builder()
                .base(1)
                .primaryKeyToken(3)
                .foreignKeyToken(10)
                .foreignKeyExtra(15)
                .referencedExtra(5)
                .domainKeyword(5)
                .conditional(3)
                .joinPattern(4)
                .entity(2)
                .build();
    }

    /**
     * Name of the first negative or non-finite weight, or null when all are valid.
     */
    public String findInvalidWeight() {
        double[] values = {base, primaryKeyToken, foreignKeyToken, primaryKeyExtra, foreignKeyExtra,
                referencedExtra, domainKeyword, conditional, joinPattern, entity};
        String[] names = {"base", "primary-key-token", "foreign-key-token", "primary-key-extra",
                "foreign-key-extra", "referenced-extra", "domain-keyword", "conditional",
                "join-pattern", "entity"};
        for (int i = 0; i < values.length; i++) {
            if (!Double.isFinite(values[i]) || values[i] < 0) {
                return names[i];
            }
        }
        return null;
    }
}
