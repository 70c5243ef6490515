package io.github.cyfko.deepfilter.spring.autoconfigure;

import io.github.cyfko.deepfilter.core.api.FilterParamParser;
import io.github.cyfko.deepfilter.core.config.FilterParamPolicy;
import io.github.cyfko.deepfilter.core.impl.DeepObjectParamParser;
import io.github.cyfko.deepfilter.spring.web.DeepObjectFilterArgumentResolver;
import io.github.cyfko.deepfilter.spring.web.MalformedFilterExceptionHandler;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.boot.test.context.runner.WebApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import static org.assertj.core.api.Assertions.assertThat;

class DeepFilterAutoConfigurationTest {

    private final WebApplicationContextRunner contextRunner = new WebApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(DeepFilterAutoConfiguration.class));

    @Test
    @DisplayName("Registers parser, resolver and error handler with default settings")
    void shouldRegisterDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(FilterParamPolicy.class);
            assertThat(context).hasSingleBean(FilterParamParser.class);
            assertThat(context).hasSingleBean(DeepObjectFilterArgumentResolver.class);
            assertThat(context).hasSingleBean(MalformedFilterExceptionHandler.class);
            assertThat(context).hasSingleBean(WebMvcConfigurer.class);

            FilterParamPolicy policy = context.getBean(FilterParamPolicy.class);
            assertThat(policy.paramName()).isEqualTo("filter");
            assertThat(policy.pathSeparator()).isEqualTo(".");
        });
    }

    @Test
    @DisplayName("Binds deepfilter.* properties into the policy")
    void shouldBindProperties() {
        contextRunner
                .withPropertyValues("deepfilter.param-name=where", "deepfilter.path-separator=__")
                .run(context -> {
                    DeepObjectParamParser parser = (DeepObjectParamParser) context.getBean(FilterParamParser.class);
                    assertThat(parser.getPolicy().paramName()).isEqualTo("where");
                    assertThat(parser.getPolicy().pathSeparator()).isEqualTo("__");
                    assertThat(parser.getPolicy().policyName()).isEqualTo(FilterParamPolicy.PolicyName.CUSTOM_POLICY.name());
                });
    }

    @Test
    @DisplayName("Invalid parameter name fails the context")
    void shouldFailOnInvalidParamName() {
        contextRunner
                .withPropertyValues("deepfilter.param-name=not-a-word")
                .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("User-defined policy takes precedence")
    void shouldBackOffForUserPolicy() {
        contextRunner
                .withUserConfiguration(DjangoPolicyConfiguration.class)
                .run(context -> {
                    assertThat(context).hasSingleBean(FilterParamPolicy.class);
                    assertThat(context.getBean(FilterParamPolicy.class)).isEqualTo(FilterParamPolicy.djangoStyle());
                });
    }

    @Test
    @DisplayName("Does nothing outside a web application")
    void shouldSkipNonWebContext() {
        new ApplicationContextRunner()
                .withConfiguration(AutoConfigurations.of(DeepFilterAutoConfiguration.class))
                .run(context -> assertThat(context).doesNotHaveBean(FilterParamParser.class));
    }

    @Configuration(proxyBeanMethods = false)
    static class DjangoPolicyConfiguration {
        @Bean
        FilterParamPolicy filterParamPolicy() {
            return FilterParamPolicy.djangoStyle();
        }
    }
}
