package io.github.cyfko.deepfilter.spring.web;

import io.github.cyfko.deepfilter.core.api.Condition;
import io.github.cyfko.deepfilter.core.api.FilterTarget;
import io.github.cyfko.deepfilter.core.config.FilterParamPolicy;
import io.github.cyfko.deepfilter.core.exception.FilterValidationException;
import io.github.cyfko.deepfilter.core.impl.DeepObjectParamParser;
import io.github.cyfko.deepfilter.spring.DeepObjectFilter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DeepObjectFilterArgumentResolverTest {

    @RestController
    static class HostController {

        @GetMapping("/hosts")
        public String hosts(@DeepObjectFilter("system_profile") Condition condition) {
            return condition.toString();
        }

        @GetMapping("/deployments")
        public String deployments(@DeepObjectFilter(value = "system_profile", paramName = "where", fieldPrefix = "host") Condition condition) {
            return condition.toString();
        }

        @GetMapping("/unresolvable")
        public String unresolvable(@DeepObjectFilter("system_profile") Condition condition) {
            throw new FilterValidationException("Cannot resolve path 'system_profile.nope': unknown attribute 'nope'");
        }
    }

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new HostController())
                .setCustomArgumentResolvers(new DeepObjectFilterArgumentResolver(new DeepObjectParamParser()))
                .setControllerAdvice(new MalformedFilterExceptionHandler())
                .build();
    }

    @Nested
    @DisplayName("Binding")
    class Binding {

        @Test
        @DisplayName("Filter parameters are combined in request order")
        void shouldBindCondition() throws Exception {
            mockMvc.perform(get("/hosts")
                            .param("filter[system_profile][arch]", "x86_64")
                            .param("page", "2")
                            .param("filter[system_profile][system_memory_bytes][gt]", "4000000000"))
                    .andExpect(status().isOk())
                    .andExpect(content().string(
                            "(system_profile.arch = 'x86_64' AND system_profile.system_memory_bytes.gt = 4000000000)"));
        }

        @Test
        @DisplayName("Requests without filter parameters bind the identity condition")
        void shouldBindMatchAll() throws Exception {
            mockMvc.perform(get("/hosts").param("page", "1"))
                    .andExpect(status().isOk())
                    .andExpect(content().string("TRUE"));
        }

        @Test
        @DisplayName("The last value of a repeated parameter wins")
        void shouldKeepLastValue() throws Exception {
            mockMvc.perform(get("/hosts").param("filter[system_profile][arch][ne]", "aarch64", "x86_64"))
                    .andExpect(status().isOk())
                    .andExpect(content().string("NOT (system_profile.arch = 'x86_64')"));
        }

        @Test
        @DisplayName("Annotation attributes select the parameter name and field prefix")
        void shouldUseAnnotationAttributes() throws Exception {
            mockMvc.perform(get("/deployments")
                            .param("filter[system_profile][arch]", "ignored")
                            .param("where[system_profile][sap_system]", "True"))
                    .andExpect(status().isOk())
                    .andExpect(content().string("host.system_profile.sap_system = true"));
        }
    }

    @Nested
    @DisplayName("Bad requests")
    class BadRequests {

        @Test
        @DisplayName("Malformed key is reported with the parameter name")
        void shouldRejectMalformedKey() throws Exception {
            mockMvc.perform(get("/hosts").param("filter[system_profile][arch", "x86_64"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("The 'filter' parameter is incorrectly formatted"))
                    .andExpect(jsonPath("$.parameter").value("filter"));
        }

        @Test
        @DisplayName("Non-integer ordering operand is reported")
        void shouldRejectNonIntegerOperand() throws Exception {
            mockMvc.perform(get("/hosts").param("filter[system_profile][number_of_sockets][lt]", "four"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value(
                            "The 'filter' value expects an integer when given the 'gt', 'gte', 'lt' or 'lte' operators"))
                    .andExpect(jsonPath("$.parameter").value("filter"));
        }

        @Test
        @DisplayName("Validation errors from the data layer are reported without a parameter")
        void shouldRejectUnresolvablePath() throws Exception {
            mockMvc.perform(get("/unresolvable"))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.error").value("Cannot resolve path 'system_profile.nope': unknown attribute 'nope'"))
                    .andExpect(jsonPath("$.parameter").doesNotExist());
        }
    }

    @Test
    @DisplayName("Configured policy drives the default parameter name and separator")
    void shouldUseParserPolicy() throws Exception {
        FilterParamPolicy policy = FilterParamPolicy.builder().paramName("q").pathSeparator("__").build();
        MockMvc custom = MockMvcBuilders.standaloneSetup(new HostController())
                .setCustomArgumentResolvers(new DeepObjectFilterArgumentResolver(new DeepObjectParamParser(policy)))
                .build();

        custom.perform(get("/hosts").param("q[system_profile][cpu_flags][contains_i]", "clzero"))
                .andExpect(status().isOk())
                .andExpect(content().string("system_profile__cpu_flags__icontains = 'clzero'"));
    }

    @Test
    @DisplayName("Parameter map flattening keeps order and drops empty value arrays")
    void shouldFlattenParameterMap() {
        Map<String, String[]> parameterMap = new LinkedHashMap<>();
        parameterMap.put("b", new String[]{"1", "2"});
        parameterMap.put("a", new String[]{"3"});
        parameterMap.put("c", new String[0]);

        Map<String, String> flattened = DeepObjectFilterArgumentResolver.lastValues(parameterMap);

        assertEquals(List.of("b", "a"), List.copyOf(flattened.keySet()));
        assertEquals("2", flattened.get("b"));
        assertEquals("3", flattened.get("a"));
    }

    @Test
    @DisplayName("Empty annotation attributes map to defaults")
    void shouldBuildTarget() throws Exception {
        DeepObjectFilter defaults = HostController.class.getDeclaredMethod("hosts", Condition.class)
                .getParameters()[0].getAnnotation(DeepObjectFilter.class);
        DeepObjectFilter custom = HostController.class.getDeclaredMethod("deployments", Condition.class)
                .getParameters()[0].getAnnotation(DeepObjectFilter.class);

        assertEquals(new FilterTarget("system_profile", null, null), DeepObjectFilterArgumentResolver.toTarget(defaults));
        assertEquals(new FilterTarget("system_profile", "where", "host"), DeepObjectFilterArgumentResolver.toTarget(custom));
    }
}
