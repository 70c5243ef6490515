package io.github.cyfko.deepfilter.core.api;

import io.github.cyfko.deepfilter.core.model.Conditions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Tests the convenience overloads of {@link FilterParamParser} and {@link FilterTarget}.
 */
class FilterParamParserTest {

    private FilterParamParser parser;
    private final Map<String, String> query = Map.of("filter[system_profile][arch]", "x86_64");

    @BeforeEach
    void setUp() {
        parser = mock(FilterParamParser.class, CALLS_REAL_METHODS);
        doReturn(Conditions.matchAll()).when(parser).parse(any(), any(FilterTarget.class));
    }

    @Test
    @DisplayName("Prefix overload delegates with default param name and no field prefix")
    void shouldDelegatePrefixOverload() {
        parser.parse(query, "system_profile");

        verify(parser).parse(eq(query), eq(new FilterTarget("system_profile", null, null)));
    }

    @Test
    @DisplayName("Field prefix overload delegates with the field prefix")
    void shouldDelegateFieldPrefixOverload() {
        parser.parse(query, "system_profile", "host");

        verify(parser).parse(eq(query), eq(new FilterTarget("system_profile", null, "host")));
    }

    @Test
    @DisplayName("Target wither methods keep other components")
    void shouldBuildTargets() {
        FilterTarget target = FilterTarget.of("system_profile").withParamName("where").withFieldPrefix("host");

        assertEquals(new FilterTarget("system_profile", "where", "host"), target);
        assertNull(target.withFieldPrefix(null).fieldPrefix());
        assertThrows(IllegalArgumentException.class, () -> target.withFieldPrefix(""));
        assertThrows(IllegalArgumentException.class, () -> target.withFieldPrefix(" "));
        assertThrows(IllegalArgumentException.class, () -> FilterTarget.of(null));
        assertThrows(IllegalArgumentException.class, () -> FilterTarget.of("system_profile").withParamName(" "));
    }
}
