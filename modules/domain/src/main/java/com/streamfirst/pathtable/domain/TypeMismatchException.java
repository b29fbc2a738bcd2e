package com.streamfirst.pathtable.domain;

import lombok.Getter;

/**
 * Raised when a bound value does not fit the declared type of its placeholder.
 */
@Getter
public class TypeMismatchException extends PathTableException {

    private final String placeholder;
    private final PlaceholderType expected;
    private final Object value;

    public TypeMismatchException(String placeholder, PlaceholderType expected, Object value) {
        this(placeholder, expected, value, "expected " + expected.label());
    }

    public TypeMismatchException(String placeholder, PlaceholderType expected, Object value, String detail) {
        super("Value " + describe(value) + " for placeholder '" + placeholder + "' is invalid: " + detail);
        this.placeholder = placeholder;
        this.expected = expected;
        this.value = value;
    }

    private static String describe(Object value) {
        if (value == null) {
            return "null";
        }
        return "'" + value + "' (" + value.getClass().getSimpleName() + ")";
    }
}
