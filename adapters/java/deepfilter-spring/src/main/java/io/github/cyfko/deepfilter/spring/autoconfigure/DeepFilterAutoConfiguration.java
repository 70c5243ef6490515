package io.github.cyfko.deepfilter.spring.autoconfigure;

import io.github.cyfko.deepfilter.core.api.FilterParamParser;
import io.github.cyfko.deepfilter.core.config.FilterParamPolicy;
import io.github.cyfko.deepfilter.core.impl.DeepObjectParamParser;
import io.github.cyfko.deepfilter.spring.web.DeepObjectFilterArgumentResolver;
import io.github.cyfko.deepfilter.spring.web.MalformedFilterExceptionHandler;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.util.List;

@AutoConfiguration
@ConditionalOnClass(WebMvcConfigurer.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@EnableConfigurationProperties(DeepFilterProperties.class)
public class DeepFilterAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public FilterParamPolicy filterParamPolicy(DeepFilterProperties properties) {
        return properties.toPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterParamParser filterParamParser(FilterParamPolicy policy) {
        return new DeepObjectParamParser(policy);
    }

    @Bean
    @ConditionalOnMissingBean
    public DeepObjectFilterArgumentResolver deepObjectFilterArgumentResolver(FilterParamParser parser) {
        return new DeepObjectFilterArgumentResolver(parser);
    }

    @Bean
    @ConditionalOnMissingBean
    public MalformedFilterExceptionHandler malformedFilterExceptionHandler() {
        return new MalformedFilterExceptionHandler();
    }

    @Bean
    public WebMvcConfigurer deepObjectFilterWebMvcConfigurer(DeepObjectFilterArgumentResolver resolver) {
        return new WebMvcConfigurer() {
            @Override
            public void addArgumentResolvers(List<HandlerMethodArgumentResolver> resolvers) {
                resolvers.add(resolver);
            }
        };
    }
}
