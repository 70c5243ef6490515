package io.github.cyfko.deepfilter.core.api;

/**
 * Identifies the filter namespace to parse and where the produced paths should point.
 *
 * <pre>{@code
 * // filter[system_profile][...]
 * FilterTarget.of("system_profile");
 *
 * // where[system_profile][...], paths rooted at "host.system_profile"
 * FilterTarget.of("system_profile").withParamName("where").withFieldPrefix("host");
 * }</pre>
 *
 * @param filterPrefix first bracket segment every matched key must carry, e.g. {@code system_profile}
 * @param paramName    root keyword, or {@code null} for the parser's configured default
 * @param fieldPrefix  segment prepended to every produced path, or {@code null} for none
 * @author Frank KOSSI
 * @since 1.0
 */
public record FilterTarget(String filterPrefix, String paramName, String fieldPrefix) {

    public FilterTarget {
        if (filterPrefix == null || filterPrefix.isBlank()) {
            throw new IllegalArgumentException("Filter prefix is required");
        }
        if (paramName != null && paramName.isBlank()) {
            throw new IllegalArgumentException("Parameter name cannot be blank");
        }
        if (fieldPrefix != null && fieldPrefix.isBlank()) {
            throw new IllegalArgumentException("Field prefix cannot be blank");
        }
    }

    public static FilterTarget of(String filterPrefix) {
        return new FilterTarget(filterPrefix, null, null);
    }

    public FilterTarget withParamName(String paramName) {
        return new FilterTarget(filterPrefix, paramName, fieldPrefix);
    }

    public FilterTarget withFieldPrefix(String fieldPrefix) {
        return new FilterTarget(filterPrefix, paramName, fieldPrefix);
    }
}
