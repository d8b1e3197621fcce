package com.purchasingpower.schemaembed.exception;

import lombok.Getter;

@Getter
public class DimensionMismatchException extends RuntimeException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(String message, int expected, int actual) {
        super(message + " (expected " + expected + ", got " + actual + ")");
        this.expected = expected;
        this.actual = actual;
    }
}
