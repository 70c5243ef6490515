package io.github.cyfko.deepfilter.jpa.utils;

import io.github.cyfko.deepfilter.core.model.FilterValue;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Converts a coerced {@link FilterValue} to the Java type of the attribute it is compared with.
 * <p>
 * Query strings only produce booleans, integers and strings; JPA needs a value of the attribute's
 * own type for parameter binding. Supported targets:
 * </p>
 * <ul>
 *   <li>Numeric types (primitives and wrappers), {@link BigDecimal}, {@link BigInteger}</li>
 *   <li>Boolean, from a boolean value or the strings {@code true}, {@code false}, {@code 1}, {@code 0}</li>
 *   <li>Enums, by case-insensitive constant name</li>
 *   <li>{@link LocalDate}, {@link LocalDateTime}, {@link LocalTime}, {@link Instant} (ISO-8601 strings)</li>
 *   <li>{@link UUID}</li>
 *   <li>String</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class JpaValueConverter {

    private static final Map<Class<?>, Class<?>> PRIMITIVE_WRAPPERS = Map.of(
            int.class, Integer.class,
            long.class, Long.class,
            double.class, Double.class,
            float.class, Float.class,
            short.class, Short.class,
            byte.class, Byte.class,
            boolean.class, Boolean.class
    );

    private JpaValueConverter() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    /**
     * Converts a filter value to the target type.
     *
     * @param targetType the attribute's Java type
     * @param value      the coerced filter value
     * @return the converted value, an instance of {@code targetType} (or its wrapper)
     * @throws IllegalArgumentException if conversion is not possible
     */
    public static Object convertValue(Class<?> targetType, FilterValue value) {
        Class<?> type = PRIMITIVE_WRAPPERS.getOrDefault(targetType, targetType);
        Object raw = value.value();

        if (type.isInstance(raw)) {
            return raw;
        }

        try {
            if (type == BigDecimal.class) return new BigDecimal(raw.toString());
            if (type == BigInteger.class) return new BigInteger(raw.toString());
            if (Number.class.isAssignableFrom(type)) return convertToNumeric(type, raw);
            if (type.isEnum()) return convertToEnum(type, raw.toString());
            if (type == Boolean.class) return convertToBoolean(raw);
            if (type == LocalDate.class) return LocalDate.parse(raw.toString());
            if (type == LocalDateTime.class) return LocalDateTime.parse(raw.toString());
            if (type == LocalTime.class) return LocalTime.parse(raw.toString());
            if (type == Instant.class) return Instant.parse(raw.toString());
            if (type == UUID.class) return UUID.fromString(raw.toString());
            if (type == String.class) return raw.toString();
        } catch (RuntimeException e) {
            throw new IllegalArgumentException(
                    String.format("Error converting value %s to type %s: %s", value, type.getSimpleName(), e.getMessage()), e);
        }

        throw new IllegalArgumentException(
                String.format("Cannot convert value %s to type %s", value, type.getName()));
    }

    /**
     * Converts a value to a numeric wrapper type. Narrowing conversions must be exact.
     */
    private static Object convertToNumeric(Class<?> type, Object raw) {
        if (raw instanceof Boolean) {
            throw new IllegalArgumentException("Boolean is not a number");
        }
        String str = raw.toString();
        if (type == Integer.class) return Integer.valueOf(str);
        if (type == Long.class) return Long.valueOf(str);
        if (type == Short.class) return Short.valueOf(str);
        if (type == Byte.class) return Byte.valueOf(str);
        if (type == Double.class) return Double.valueOf(str);
        if (type == Float.class) return Float.valueOf(str);

        throw new IllegalArgumentException("Unsupported numeric type: " + type);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static Object convertToEnum(Class<?> type, String name) {
        for (Object constant : type.getEnumConstants()) {
            if (((Enum) constant).name().equalsIgnoreCase(name)) {
                return constant;
            }
        }
        throw new IllegalArgumentException(
                String.format("Invalid value '%s' for enum %s", name, type.getSimpleName()));
    }

    private static Boolean convertToBoolean(Object raw) {
        String normalized = raw.toString().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized) || "1".equals(normalized)) return Boolean.TRUE;
        if ("false".equals(normalized) || "0".equals(normalized)) return Boolean.FALSE;
        throw new IllegalArgumentException("Not a boolean: " + raw);
    }
}
