package io.github.cyfko.deepfilter.core.exception;

/**
 * Exception thrown when an ordering operator ({@code gt}, {@code gte}, {@code lt}, {@code lte})
 * is given a value that is not made of decimal digits only.
 *
 * <pre>{@code
 * filter[system_profile][system_memory_bytes][gt]=abc
 * filter[system_profile][system_memory_bytes][gt]=-5
 * // -> "The 'filter' value expects an integer when given the 'gt', 'gte', 'lt' or 'lte' operators"
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class FilterOperandException extends MalformedFilterException {

    private final String rejectedValue;

    /**
     * Creates the exception for a non-integer operand.
     *
     * @param paramName     root keyword of the filter namespace
     * @param parameterKey  the key carrying the ordering operator
     * @param rejectedValue the raw value that is not all-digit
     */
    public FilterOperandException(String paramName, String parameterKey, String rejectedValue) {
        super("The '" + paramName + "' value expects an integer when given the 'gt', 'gte', 'lt' or 'lte' operators",
                paramName, parameterKey);
        this.rejectedValue = rejectedValue;
    }

    public String getRejectedValue() {
        return rejectedValue;
    }
}
