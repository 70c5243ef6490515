package io.github.cyfko.deepfilter.core.api;

import java.util.Objects;
import java.util.Optional;

/**
 * Enumeration of the reserved trailing keywords of a deep-object filter parameter.
 * <p>
 * The last bracket segment of a parameter key may be one of these keywords, in which case it
 * changes the comparison instead of naming a field. The set is deliberately closed and small:
 * any other trailing segment is data and flows through unchanged as a path segment, which lets
 * callers address native lookups of the data layer ({@code contains}, {@code regex},
 * {@code icontains}, ...) and nested keys that merely look like operators.
 * </p>
 *
 * <p><strong>Keyword categories:</strong></p>
 * <pre>{@code
 * filter[system_profile][number_of_sockets][eq]=1     -> EQ      (dropped, integer coercion)
 * filter[system_profile][started][ne]=true            -> NE      (dropped, negated)
 * filter[system_profile][system_memory_bytes][gt]=4   -> GT      (integer required)
 * filter[system_profile][registered][nil]             -> NIL     (rewritten to isnull)
 * filter[system_profile][host_type][eq_i]=Edge        -> EQ_I    (rewritten to iexact)
 * }</pre>
 *
 * <p><strong>Keyword translations:</strong></p>
 * <ul>
 *     <li>eq_i / iexact</li>
 *     <li>contains_i / icontains</li>
 *     <li>starts_with_i / istartswith</li>
 *     <li>ends_with_i / iendswith</li>
 *     <li>starts_with / startswith</li>
 *     <li>ends_with / endswith</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum FilterOperator {

    /** Implicit equality, removed from the path. */
    EQ("eq", null),

    /** Inequality, removed from the path and expressed as a negation. */
    NE("ne", null),

    /** Greater than, integer operand. */
    GT("gt", null),

    /** Greater than or equal, integer operand. */
    GTE("gte", null),

    /** Less than, integer operand. */
    LT("lt", null),

    /** Less than or equal, integer operand. */
    LTE("lte", null),

    /** Null check, rewritten to {@value #ISNULL_KEYWORD}. */
    NIL("nil", null),

    /** Inverted null check, rewritten to {@value #ISNULL_KEYWORD} with the value inverted. */
    NOT_NIL("not_nil", null),

    /** Case-insensitive equality. */
    EQ_I("eq_i", "iexact"),

    /** Case-insensitive containment. */
    CONTAINS_I("contains_i", "icontains"),

    /** Case-insensitive prefix match. */
    STARTS_WITH_I("starts_with_i", "istartswith"),

    /** Case-insensitive suffix match. */
    ENDS_WITH_I("ends_with_i", "iendswith"),

    /** Prefix match. */
    STARTS_WITH("starts_with", "startswith"),

    /** Suffix match. */
    ENDS_WITH("ends_with", "endswith");

    /**
     * Native keyword that replaces {@link #NIL} and {@link #NOT_NIL} in the produced path.
     */
    public static final String ISNULL_KEYWORD = "isnull";

    private final String keyword;
    private final String translation;

    FilterOperator(String keyword, String translation) {
        this.keyword = keyword;
        this.translation = translation;
    }

    /**
     * Returns the keyword as it appears in a parameter key.
     *
     * @return the lower-case keyword, e.g. {@code "not_nil"}
     */
    public String getKeyword() {
        return keyword;
    }

    /**
     * Returns the native keyword this operator is rewritten to, if any.
     *
     * @return the translated keyword, or empty when the operator is not rewritten by the translation table
     */
    public Optional<String> translation() {
        return Optional.ofNullable(translation);
    }

    /**
     * Indicates whether this operator only accepts an all-digit operand.
     *
     * @return {@code true} for {@link #GT}, {@link #GTE}, {@link #LT} and {@link #LTE}
     */
    public boolean requiresInteger() {
        return this == GT || this == GTE || this == LT || this == LTE;
    }

    /**
     * Indicates whether this operator is an equality test that coerces all-digit operands.
     *
     * @return {@code true} for {@link #EQ} and {@link #NE}
     */
    public boolean isEquality() {
        return this == EQ || this == NE;
    }

    /**
     * Indicates whether this operator is a null check.
     *
     * @return {@code true} for {@link #NIL} and {@link #NOT_NIL}
     */
    public boolean isNullCheck() {
        return this == NIL || this == NOT_NIL;
    }

    /**
     * Finds an operator by its exact keyword. Matching is case-sensitive: {@code "GT"} is a field name.
     *
     * @param segment the trailing path segment
     * @return the matching operator, or empty when the segment is not reserved
     * @throws NullPointerException if {@code segment} is {@code null}
     */
    public static Optional<FilterOperator> fromKeyword(String segment) {
        Objects.requireNonNull(segment, "segment");
        for (FilterOperator operator : values()) {
            if (operator.keyword.equals(segment)) return Optional.of(operator);
        }
        return Optional.empty();
    }
}
