package com.purchasingpower.schemaembed.exception;

import lombok.Getter;

/**
 * Thrown when a WordIndex is asked for an index it never assigned.
 */
@Getter
public class WordNotFoundException extends RuntimeException {

    private final int index;

    public WordNotFoundException(int index) {
        super("No word registered for index " + index);
        this.index = index;
    }
}
