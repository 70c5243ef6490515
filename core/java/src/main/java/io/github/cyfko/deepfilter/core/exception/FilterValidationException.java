package io.github.cyfko.deepfilter.core.exception;

/**
 * Exception thrown when a well-formed condition cannot be applied to a data layer.
 * <p>
 * The parser never checks that a path designates an existing field; evaluators do, and raise this
 * exception when a path segment cannot be resolved or a value cannot be converted to the type of
 * the targeted field.
 * </p>
 *
 * <p><strong>Validation Error Examples:</strong></p>
 * <pre>{@code
 * // Unknown attribute
 * filter[system_profile][no_such_field]=x
 * // -> "Cannot resolve path 'system_profile.no_such_field': unknown attribute 'noSuchField'"
 *
 * // Value incompatible with the attribute type
 * filter[system_profile][number_of_sockets]=many
 * // -> "Value 'many' of path 'system_profile.number_of_sockets' is not compatible with type Integer"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class FilterValidationException extends RuntimeException {

    /**
     * Creates an exception with an explanatory message.
     *
     * @param message the description of the cause of the exception
     */
    public FilterValidationException(String message) {
        super(message);
    }

    /**
     * Creates an exception with an explanatory message and an underlying cause.
     *
     * @param message the description of the cause of the exception
     * @param cause   the original cause (e.g. a conversion or attribute lookup failure)
     */
    public FilterValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
