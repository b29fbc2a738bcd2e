package com.streamfirst.pathtable.domain;

import java.math.BigInteger;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Declared type of a path template placeholder. Each type knows the textual grammar it
 * matches inside a path, how to parse a matched run and how to render a bound value.
 */
public enum PlaceholderType {

    /** Any non-empty run of characters other than the path separator. */
    STRING("string", "[^/]+?"),

    /** Signed integer in decimal, or with a 0x, 0o or 0b radix prefix. */
    INTEGER("integer", "[-+]?(?:0[xX][0-9a-fA-F]+|0[oO][0-7]+|0[bB][01]+|[0-9]+)"),

    /**
     * General floating point literal, including exponents. {@code nan}, {@code inf} and
     * {@code infinity} are accepted in any letter case.
     */
    FLOAT("float", "[-+]?(?:(?:[0-9]+(?:\\.[0-9]*)?|\\.[0-9]+)(?:[eE][-+]?[0-9]+)?|(?i:nan|inf(?:inity)?))");

    private static final Map<String, PlaceholderType> ANNOTATIONS = Map.of(
        "", STRING, "string", STRING, "str", STRING, "s", STRING,
        "integer", INTEGER, "int", INTEGER, "d", INTEGER,
        "float", FLOAT, "g", FLOAT, "f", FLOAT
    );

    private final String label;
    private final String regex;

    PlaceholderType(String label, String regex) {
        this.label = label;
        this.regex = regex;
    }

    public String label() {
        return label;
    }

    /**
     * Regular expression, without capturing groups, matching the textual form of a value.
     */
    public String regex() {
        return regex;
    }

    /**
     * Resolves a type annotation as written after the colon of a placeholder.
     * An empty annotation means string.
     */
    public static Optional<PlaceholderType> fromAnnotation(String annotation) {
        return Optional.ofNullable(ANNOTATIONS.get(annotation.toLowerCase(Locale.ROOT)));
    }

    /**
     * Parses a run already matched by {@link #regex()}.
     *
     * @return the typed value, or empty if the run cannot be represented (integer overflow)
     */
    public Optional<Object> parse(String raw) {
        switch (this) {
            case STRING:
                return Optional.of(raw);
            case INTEGER:
                return parseInteger(raw);
            case FLOAT:
                return Optional.of(parseFloat(raw));
            default:
                throw new IllegalStateException("Unhandled placeholder type " + this);
        }
    }

    /**
     * Checks that {@code value} fits this type and returns its normalized form:
     * {@link String}, {@link Long} or {@link Double}.
     *
     * @throws TypeMismatchException if the runtime type disagrees with this type
     */
    public Object normalize(String placeholder, Object value) {
        switch (this) {
            case STRING:
                if (!(value instanceof String s)) {
                    throw new TypeMismatchException(placeholder, this, value);
                }
                if (s.isEmpty() || s.indexOf('/') >= 0) {
                    throw new TypeMismatchException(placeholder, this, value,
                        "string values must be non-empty and must not contain '/'");
                }
                return s;
            case INTEGER:
                if (value instanceof Long || value instanceof Integer
                        || value instanceof Short || value instanceof Byte) {
                    return ((Number) value).longValue();
                }
                throw new TypeMismatchException(placeholder, this, value);
            case FLOAT:
                if (value instanceof Double || value instanceof Float) {
                    return ((Number) value).doubleValue();
                }
                throw new TypeMismatchException(placeholder, this, value);
            default:
                throw new IllegalStateException("Unhandled placeholder type " + this);
        }
    }

    /**
     * Renders a normalized value in its canonical textual form.
     */
    public String format(Object normalized) {
        switch (this) {
            case STRING:
                return (String) normalized;
            case INTEGER:
                return Long.toString((Long) normalized);
            case FLOAT:
                return Double.toString((Double) normalized);
            default:
                throw new IllegalStateException("Unhandled placeholder type " + this);
        }
    }

    private static double parseFloat(String raw) {
        String unsigned = raw.startsWith("-") || raw.startsWith("+") ? raw.substring(1) : raw;
        switch (unsigned.toLowerCase(Locale.ROOT)) {
            case "nan":
                return Double.NaN;
            case "inf":
            case "infinity":
                return raw.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            default:
                return Double.parseDouble(raw);
        }
    }

    private static Optional<Object> parseInteger(String raw) {
        boolean negative = raw.startsWith("-");
        String digits = raw.startsWith("-") || raw.startsWith("+") ? raw.substring(1) : raw;
        int radix = 10;
        if (digits.length() > 2 && digits.charAt(0) == '0') {
            switch (Character.toLowerCase(digits.charAt(1))) {
                case 'x' -> radix = 16;
                case 'o' -> radix = 8;
                case 'b' -> radix = 2;
                default -> radix = 10;
            }
            if (radix != 10) {
                digits = digits.substring(2);
            }
        }
        BigInteger value = new BigInteger(digits, radix);
        if (negative) {
            value = value.negate();
        }
        if (value.bitLength() > 63) {
            return Optional.empty();
        }
        return Optional.of(value.longValue());
    }
}
