package io.github.cyfko.deepfilter.jpa.utils;

import io.github.cyfko.deepfilter.core.model.FilterValue;
import io.github.cyfko.deepfilter.jpa.entities.HostType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class JpaValueConverterTest {

    @Test
    @DisplayName("Integers are narrowed to the attribute's numeric type")
    void shouldConvertIntegers() {
        assertEquals(42, JpaValueConverter.convertValue(Integer.class, FilterValue.ofInteger(42)));
        assertEquals(42, JpaValueConverter.convertValue(int.class, FilterValue.ofInteger(42)));
        assertEquals((short) 7, JpaValueConverter.convertValue(Short.class, FilterValue.ofInteger(7)));
        assertEquals(4_000_000_000L, JpaValueConverter.convertValue(Long.class, FilterValue.ofInteger(4_000_000_000L)));
        assertEquals(2.0, JpaValueConverter.convertValue(Double.class, FilterValue.ofInteger(2)));
        assertEquals(new BigDecimal("12"), JpaValueConverter.convertValue(BigDecimal.class, FilterValue.ofInteger(12)));
        assertEquals(new BigInteger("99999999999999999999"),
                JpaValueConverter.convertValue(BigInteger.class, FilterValue.ofDigits("99999999999999999999")));
    }

    @Test
    @DisplayName("Strings are parsed into numeric types")
    void shouldParseNumericStrings() {
        assertEquals(1.5f, JpaValueConverter.convertValue(Float.class, FilterValue.ofString("1.5")));
        assertEquals(new BigDecimal("3.14"), JpaValueConverter.convertValue(BigDecimal.class, FilterValue.ofString("3.14")));
    }

    @Test
    @DisplayName("Out of range and non-numeric values are rejected")
    void shouldRejectInvalidNumbers() {
        assertThrows(IllegalArgumentException.class,
                () -> JpaValueConverter.convertValue(Integer.class, FilterValue.ofInteger(4_000_000_000L)));
        assertThrows(IllegalArgumentException.class,
                () -> JpaValueConverter.convertValue(Integer.class, FilterValue.ofString("many")));
        assertThrows(IllegalArgumentException.class,
                () -> JpaValueConverter.convertValue(Integer.class, FilterValue.ofBoolean(true)));
    }

    @Test
    @DisplayName("Booleans accept boolean values and 1/0")
    void shouldConvertBooleans() {
        assertEquals(Boolean.TRUE, JpaValueConverter.convertValue(Boolean.class, FilterValue.ofBoolean(true)));
        assertEquals(Boolean.FALSE, JpaValueConverter.convertValue(boolean.class, FilterValue.ofInteger(0)));
        assertEquals(Boolean.TRUE, JpaValueConverter.convertValue(Boolean.class, FilterValue.ofString("TRUE")));
        assertThrows(IllegalArgumentException.class,
                () -> JpaValueConverter.convertValue(Boolean.class, FilterValue.ofString("yes")));
    }

    @Test
    @DisplayName("Enums match constant names case-insensitively")
    void shouldConvertEnums() {
        assertEquals(HostType.CLOUD, JpaValueConverter.convertValue(HostType.class, FilterValue.ofString("cloud")));
        assertEquals(HostType.EDGE, JpaValueConverter.convertValue(HostType.class, FilterValue.ofString("EDGE")));
        assertThrows(IllegalArgumentException.class,
                () -> JpaValueConverter.convertValue(HostType.class, FilterValue.ofString("metal")));
    }

    @Test
    @DisplayName("Temporal and identifier types are parsed from ISO strings")
    void shouldConvertTemporalTypes() {
        assertEquals(LocalDate.of(2024, 1, 15),
                JpaValueConverter.convertValue(LocalDate.class, FilterValue.ofString("2024-01-15")));
        assertEquals(LocalDateTime.of(2024, 1, 15, 10, 30),
                JpaValueConverter.convertValue(LocalDateTime.class, FilterValue.ofString("2024-01-15T10:30")));
        assertEquals(Instant.parse("2024-01-15T10:30:00Z"),
                JpaValueConverter.convertValue(Instant.class, FilterValue.ofString("2024-01-15T10:30:00Z")));
        UUID id = UUID.randomUUID();
        assertEquals(id, JpaValueConverter.convertValue(UUID.class, FilterValue.ofString(id.toString())));
        assertThrows(IllegalArgumentException.class,
                () -> JpaValueConverter.convertValue(LocalDate.class, FilterValue.ofString("15/01/2024")));
    }

    @Test
    @DisplayName("Text attributes accept any value")
    void shouldConvertToString() {
        assertEquals("x86_64", JpaValueConverter.convertValue(String.class, FilterValue.ofString("x86_64")));
        assertEquals("12", JpaValueConverter.convertValue(String.class, FilterValue.ofInteger(12)));
        assertEquals("true", JpaValueConverter.convertValue(String.class, FilterValue.ofBoolean(true)));
    }

    @Test
    @DisplayName("Unsupported target types are rejected")
    void shouldRejectUnsupportedType() {
        assertThrows(IllegalArgumentException.class,
                () -> JpaValueConverter.convertValue(StringBuilder.class, FilterValue.ofString("x")));
    }
}
