package io.github.cyfko.deepfilter.core.config;

/**
 * Configuration of the deep-object parameter parser.
 *
 * <h2>Configurable Settings</h2>
 * <ul>
 *   <li><strong>paramName</strong>: default root keyword of filter parameters (default: {@code filter})</li>
 *   <li><strong>pathSeparator</strong>: string joining path segments of produced conditions (default: {@code .})</li>
 * </ul>
 *
 * <h2>Preset Configurations</h2>
 * <pre>{@code
 * // Default: filter[system_profile][sap_system] -> "system_profile.sap_system"
 * FilterParamPolicy policy = FilterParamPolicy.defaults();
 *
 * // Django lookup style: filter[system_profile][sap_system] -> "system_profile__sap_system"
 * FilterParamPolicy policy = FilterParamPolicy.djangoStyle();
 *
 * // Custom
 * FilterParamPolicy policy = FilterParamPolicy.builder()
 *     .paramName("where")
 *     .pathSeparator("/")
 *     .build();
 * }</pre>
 *
 * @param policyName    name of the policy, for diagnostics
 * @param paramName     default root keyword, must be word characters only
 * @param pathSeparator non-empty separator joining path segments
 * @author Frank KOSSI
 * @since 1.0
 */
public record FilterParamPolicy(
    String policyName,
    String paramName,
    String pathSeparator
) {

    /**
     * Default root keyword of filter parameters.
     */
    public static final String DEFAULT_PARAM_NAME = "filter";

    /**
     * Default path separator.
     */
    public static final String DEFAULT_PATH_SEPARATOR = ".";

    /**
     * Canonical constructor with validation.
     *
     * @throws IllegalArgumentException if any setting is missing or invalid
     */
    public FilterParamPolicy {
        if (policyName == null || policyName.isBlank()) {
            throw new IllegalArgumentException("Policy name is required");
        }
        if (paramName == null || !PatternConfig.WORD_PATTERN.matcher(paramName).matches()) {
            throw new IllegalArgumentException("paramName must consist of word characters only, got: " + paramName);
        }
        if (pathSeparator == null || pathSeparator.isEmpty()) {
            throw new IllegalArgumentException("pathSeparator is required");
        }
    }

    /**
     * Default configuration: {@code filter} root keyword, dot-separated paths.
     *
     * @return default configuration
     */
    public static FilterParamPolicy defaults() {
        return new FilterParamPolicy(PolicyName.DEFAULT_POLICY.name(), DEFAULT_PARAM_NAME, DEFAULT_PATH_SEPARATOR);
    }

    /**
     * Configuration producing Django-style lookup paths joined with a double underscore.
     *
     * @return django-style configuration
     */
    public static FilterParamPolicy djangoStyle() {
        return new FilterParamPolicy(PolicyName.DJANGO_POLICY.name(), DEFAULT_PARAM_NAME, "__");
    }

    /**
     * Creates a custom configuration. Builder settings start from the default policy.
     *
     * @return the {@link Builder} instance
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String _policyName = PolicyName.CUSTOM_POLICY.name();
        private String _paramName = DEFAULT_PARAM_NAME;
        private String _pathSeparator = DEFAULT_PATH_SEPARATOR;

        private Builder(){}

        public FilterParamPolicy build(){
            return new FilterParamPolicy(_policyName, _paramName, _pathSeparator);
        }

        public Builder policyName(String policyName){ this._policyName = policyName; return this; }
        public Builder paramName(String paramName){ this._paramName = paramName; return this; }
        public Builder pathSeparator(String pathSeparator){ this._pathSeparator = pathSeparator; return this; }
    }

    public enum PolicyName {
        DEFAULT_POLICY,
        DJANGO_POLICY,
        CUSTOM_POLICY
    }
}
