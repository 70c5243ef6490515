package io.github.cyfko.deepfilter.core.exception;

/**
 * Exception thrown when a parameter key claims the filter namespace but is not a valid
 * deep-object key.
 * <p>
 * A key is a candidate as soon as it starts with {@code <paramName>[<filterPrefix>][}; from then
 * on it must match {@code \w+(\[\w+\])+} exactly. Keys outside the namespace are never reported.
 * </p>
 *
 * <p><strong>Error Examples:</strong></p>
 * <pre>{@code
 * filter[system_profile][bogus]key=x     // trailing text after the last bracket
 * filter[system_profile][cpu-flags]=x    // '-' is not a word character
 * filter[system_profile][]=x             // empty bracket group
 * // -> "The 'filter' parameter is incorrectly formatted"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class FilterSyntaxException extends MalformedFilterException {

    /**
     * Creates the exception for a malformed key.
     *
     * @param paramName    root keyword of the filter namespace
     * @param parameterKey the malformed key
     */
    public FilterSyntaxException(String paramName, String parameterKey) {
        super("The '" + paramName + "' parameter is incorrectly formatted", paramName, parameterKey);
    }
}
