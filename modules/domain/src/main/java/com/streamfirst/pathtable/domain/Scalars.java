package com.streamfirst.pathtable.domain;

/**
 * Normalization of the closed set of scalar values a record field may hold:
 * {@link String}, {@link Long}, {@link Double}, {@link Boolean} and {@code null}.
 */
public final class Scalars {

    private Scalars() {
    }

    /**
     * Widens integral and floating values to {@link Long} and {@link Double}.
     *
     * @throws IllegalArgumentException if the value is not a supported scalar
     */
    public static Object normalize(String field, Object value) {
        if (value == null || value instanceof String || value instanceof Boolean
                || value instanceof Long || value instanceof Double) {
            return value;
        }
        if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof Float f) {
            return f.doubleValue();
        }
        throw new IllegalArgumentException("Unsupported value type " + value.getClass().getName()
            + " for field '" + field + "'");
    }
}
