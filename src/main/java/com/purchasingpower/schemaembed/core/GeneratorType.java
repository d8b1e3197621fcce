package com.purchasingpower.schemaembed.core;

import com.purchasingpower.schemaembed.exception.EmbeddingConfigurationException;

/**
 * Generator identifiers as they appear in {@code app.embedding.generator-weights}.
 *
 * @since 1.0.0
 */
public enum GeneratorType {
    ENHANCED("enhanced"),
    PRIMARY_KEY_AWARE("primary-key-aware"),
    FOREIGN_KEY_AWARE("foreign-key-aware"),
    LEARNED("learned");

    private final String id;

    GeneratorType(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    /**
     * Exact, case-sensitive lookup; ids are lowercase kebab-case.
     */
    public static GeneratorType fromId(String id) {
        for (GeneratorType type : values()) {
            if (type.id.equals(id)) {
                return type;
            }
        }
        throw new EmbeddingConfigurationException("app.embedding.generator-weights",
                "Unknown generator '" + id + "'");
    }
}
