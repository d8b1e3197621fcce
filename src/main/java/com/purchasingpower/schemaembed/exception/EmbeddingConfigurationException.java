package com.purchasingpower.schemaembed.exception;

import lombok.Getter;

/**
 * Invalid embedding configuration. Raised at startup, before any vector is generated.
 */
@Getter
public class EmbeddingConfigurationException extends RuntimeException {

    private final String property;

    public EmbeddingConfigurationException(String property, String message) {
        super(property + ": " + message);
        this.property = property;
    }
}
