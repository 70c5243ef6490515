package io.github.cyfko.deepfilter.spring.web;

import io.github.cyfko.deepfilter.core.api.Condition;
import io.github.cyfko.deepfilter.core.api.FilterParamParser;
import io.github.cyfko.deepfilter.core.api.FilterTarget;
import io.github.cyfko.deepfilter.spring.DeepObjectFilter;
import org.springframework.core.MethodParameter;
import org.springframework.web.bind.support.WebDataBinderFactory;
import org.springframework.web.context.request.NativeWebRequest;
import org.springframework.web.method.support.HandlerMethodArgumentResolver;
import org.springframework.web.method.support.ModelAndViewContainer;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Resolves {@link DeepObjectFilter}-annotated {@link Condition} parameters.
 * <p>
 * The request's parameters are flattened to one value per key, keeping the last value of a
 * repeated key, and handed to the {@link FilterParamParser}.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class DeepObjectFilterArgumentResolver implements HandlerMethodArgumentResolver {

    private final FilterParamParser parser;

    public DeepObjectFilterArgumentResolver(FilterParamParser parser) {
        this.parser = Objects.requireNonNull(parser, "Filter parameter parser is required");
    }

    @Override
    public boolean supportsParameter(MethodParameter parameter) {
        return parameter.hasParameterAnnotation(DeepObjectFilter.class)
                && Condition.class.isAssignableFrom(parameter.getParameterType());
    }

    @Override
    public Condition resolveArgument(MethodParameter parameter,
                                     ModelAndViewContainer mavContainer,
                                     NativeWebRequest webRequest,
                                     WebDataBinderFactory binderFactory) {
        DeepObjectFilter annotation = parameter.getParameterAnnotation(DeepObjectFilter.class);
        if (annotation == null) {
            throw new IllegalStateException("Parameter is not annotated with @DeepObjectFilter: " + parameter);
        }
        return parser.parse(lastValues(webRequest.getParameterMap()), toTarget(annotation));
    }

    static FilterTarget toTarget(DeepObjectFilter annotation) {
        String paramName = annotation.paramName().isEmpty() ? null : annotation.paramName();
        String fieldPrefix = annotation.fieldPrefix().isEmpty() ? null : annotation.fieldPrefix();
        return new FilterTarget(annotation.value(), paramName, fieldPrefix);
    }

    static Map<String, String> lastValues(Map<String, String[]> parameterMap) {
        Map<String, String> params = new LinkedHashMap<>();
        parameterMap.forEach((key, values) -> {
            if (values != null && values.length > 0) {
                params.put(key, values[values.length - 1]);
            }
        });
        return params;
    }
}
