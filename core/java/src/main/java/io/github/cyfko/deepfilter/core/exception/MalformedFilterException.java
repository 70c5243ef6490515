package io.github.cyfko.deepfilter.core.exception;

/**
 * Base exception signalling that a request's filter parameters cannot be translated.
 * <p>
 * This is the "bad request" condition of the deep-object parameter parser. It aborts the whole
 * translation: no partial condition is ever returned. Request layers map it to an HTTP 400
 * response whose message identifies the offending parameter name.
 * </p>
 *
 * <p><strong>Subtypes:</strong></p>
 * <ul>
 *   <li>{@link FilterSyntaxException}: the key claims the filter namespace but breaks the bracket grammar</li>
 *   <li>{@link FilterOperandException}: an ordering operator was given a non-numeric value</li>
 * </ul>
 *
 * <p><strong>Handling Example:</strong></p>
 * <pre>{@code
 * try {
 *     Condition condition = parser.parse(queryParams, "system_profile");
 * } catch (MalformedFilterException e) {
 *     return ResponseEntity.badRequest()
 *         .body(Map.of("error", e.getMessage(), "parameter", e.getParamName()));
 * }
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see io.github.cyfko.deepfilter.core.api.FilterParamParser
 */
public abstract class MalformedFilterException extends RuntimeException {

    private final String paramName;
    private final String parameterKey;

    /**
     * Creates an exception for the given parameter.
     *
     * @param message      human-readable description naming the parameter
     * @param paramName    root keyword of the filter namespace, e.g. {@code filter}
     * @param parameterKey raw query-parameter key that caused the failure
     */
    protected MalformedFilterException(String message, String paramName, String parameterKey) {
        super(message);
        this.paramName = paramName;
        this.parameterKey = parameterKey;
    }

    /**
     * Returns the root keyword of the filter namespace being parsed.
     *
     * @return the parameter name, e.g. {@code filter}
     */
    public String getParamName() {
        return paramName;
    }

    /**
     * Returns the raw query-parameter key that was rejected.
     *
     * @return the offending key, e.g. {@code filter[system_profile][bogus]key}
     */
    public String getParameterKey() {
        return parameterKey;
    }
}
