package io.github.cyfko.deepfilter.spring.autoconfigure;

import io.github.cyfko.deepfilter.core.config.FilterParamPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Deep-object filter settings, bound from {@code deepfilter.*}.
 *
 * <pre>{@code
 * deepfilter.param-name=filter
 * deepfilter.path-separator=__
 * }</pre>
 */
@ConfigurationProperties(prefix = "deepfilter")
public class DeepFilterProperties {
    /** Outer query parameter name. */
    private String paramName = FilterParamPolicy.DEFAULT_PARAM_NAME;
    /** Separator joining path segments of parsed conditions. */
    private String pathSeparator = FilterParamPolicy.DEFAULT_PATH_SEPARATOR;

    public String getParamName() {
        return paramName;
    }

    public void setParamName(String paramName) {
        this.paramName = paramName;
    }

    public String getPathSeparator() {
        return pathSeparator;
    }

    public void setPathSeparator(String pathSeparator) {
        this.pathSeparator = pathSeparator;
    }

    /**
     * Builds the parser policy from these settings.
     *
     * @throws IllegalArgumentException if a setting is invalid
     */
    public FilterParamPolicy toPolicy() {
        return FilterParamPolicy.builder()
                .paramName(paramName)
                .pathSeparator(pathSeparator)
                .build();
    }
}
