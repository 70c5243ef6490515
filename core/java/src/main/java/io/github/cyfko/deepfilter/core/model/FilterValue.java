package io.github.cyfko.deepfilter.core.model;

import io.github.cyfko.deepfilter.core.config.PatternConfig;

import java.math.BigInteger;
import java.util.Objects;

/**
 * Coerced value of a filter parameter: a boolean, an integer or a string.
 * <p>
 * Query strings only carry text, so the parser decides the kind from the literal form of the
 * value and the operator governing it. Consumers switch on {@link #kind()} instead of probing
 * {@code instanceof} on a raw {@code Object}.
 * </p>
 *
 * <h2>Integer Representation</h2>
 * <p>
 * Integers are unbounded. A value that fits in a {@code long} is held as a {@link Long}, any larger
 * value as a {@link BigInteger}, so that equal numbers always have equal representations.
 * </p>
 *
 * <pre>{@code
 * FilterValue.ofBoolean(true);         // BOOLEAN true
 * FilterValue.ofInteger(4000000000L);  // INTEGER 4000000000 (Long)
 * FilterValue.ofDigits("007");         // INTEGER 7 (Long)
 * FilterValue.ofString("clzero");      // STRING "clzero"
 * }</pre>
 *
 * @param kind  the kind of value
 * @param value the value: {@link Boolean}, {@link Long}, {@link BigInteger} or {@link String} according to {@code kind}
 * @author Frank KOSSI
 * @since 1.0
 */
public record FilterValue(Kind kind, Object value) {

    private static final BigInteger LONG_MIN = BigInteger.valueOf(Long.MIN_VALUE);
    private static final BigInteger LONG_MAX = BigInteger.valueOf(Long.MAX_VALUE);

    public enum Kind {
        BOOLEAN,
        INTEGER,
        STRING
    }

    public FilterValue {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(value, "value");
        boolean consistent = switch (kind) {
            case BOOLEAN -> value instanceof Boolean;
            case INTEGER -> value instanceof Long
                    || (value instanceof BigInteger big && (big.compareTo(LONG_MIN) < 0 || big.compareTo(LONG_MAX) > 0));
            case STRING -> value instanceof String;
        };
        if (!consistent) {
            throw new IllegalArgumentException(
                    String.format("Value of type %s is not a valid %s value", value.getClass().getSimpleName(), kind));
        }
    }

    public static FilterValue ofBoolean(boolean value) {
        return new FilterValue(Kind.BOOLEAN, value);
    }

    public static FilterValue ofInteger(long value) {
        return new FilterValue(Kind.INTEGER, value);
    }

    public static FilterValue ofInteger(BigInteger value) {
        Objects.requireNonNull(value, "value");
        if (value.compareTo(LONG_MIN) >= 0 && value.compareTo(LONG_MAX) <= 0) {
            return ofInteger(value.longValue());
        }
        return new FilterValue(Kind.INTEGER, value);
    }

    public static FilterValue ofString(String value) {
        return new FilterValue(Kind.STRING, value);
    }

    /**
     * Parses a run of decimal digits into an integer value.
     *
     * @param digits one or more ASCII digits
     * @return the integer value
     * @throws IllegalArgumentException if {@code digits} is not made of digits only
     */
    public static FilterValue ofDigits(String digits) {
        if (digits == null || !PatternConfig.DIGITS_PATTERN.matcher(digits).matches()) {
            throw new IllegalArgumentException("Expected decimal digits, got: " + digits);
        }
        return ofInteger(new BigInteger(digits));
    }

    public boolean isBoolean() {
        return kind == Kind.BOOLEAN;
    }

    public boolean isInteger() {
        return kind == Kind.INTEGER;
    }

    public boolean isString() {
        return kind == Kind.STRING;
    }

    public boolean asBoolean() {
        requireKind(Kind.BOOLEAN);
        return (Boolean) value;
    }

    public Number asNumber() {
        requireKind(Kind.INTEGER);
        return (Number) value;
    }

    public String asString() {
        requireKind(Kind.STRING);
        return (String) value;
    }

    private void requireKind(Kind expected) {
        if (kind != expected) {
            throw new IllegalStateException("Value is " + kind + ", not " + expected);
        }
    }

    /**
     * Renders the value as a literal: strings quoted, booleans and integers bare.
     */
    @Override
    public String toString() {
        return kind == Kind.STRING ? "'" + value + "'" : value.toString();
    }
}
