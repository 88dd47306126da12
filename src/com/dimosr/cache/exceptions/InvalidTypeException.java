package com.dimosr.cache.exceptions;

/**
 * An exception denoting that a value is present, but it is not of the type the caller asked for
 */
public class InvalidTypeException extends RuntimeException {
    private final Class<?> expectedType;
    private final Class<?> actualType;

    public InvalidTypeException(final Class<?> expectedType, final Class<?> actualType) {
        super(String.format("Invalid Type: (Expected: %s) got %s", expectedType.getName(), actualType.getName()));
        this.expectedType = expectedType;
        this.actualType = actualType;
    }

    public Class<?> getExpectedType() {
        return expectedType;
    }

    public Class<?> getActualType() {
        return actualType;
    }
}
