package io.github.cyfko.deepfilter.core.model;

import io.github.cyfko.deepfilter.core.api.Condition;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Static factories for the built-in {@link Condition} implementations.
 *
 * <pre>{@code
 * Condition c = Conditions.matchAll()
 *     .and(Conditions.field("system_profile.sap_system", FilterValue.ofBoolean(true)))
 *     .and(Conditions.field("system_profile.started", FilterValue.ofBoolean(true)).not());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public final class Conditions {

    private Conditions() {
        throw new UnsupportedOperationException("Utility class - cannot be instantiated");
    }

    public static Condition matchAll() {
        return MatchAllCondition.INSTANCE;
    }

    public static FieldCondition field(String path, FilterValue value) {
        return new FieldCondition(path, value);
    }

    /**
     * Conjoins two conditions, dropping the identity and flattening nested conjunctions.
     *
     * @param left  left operand
     * @param right right operand
     * @return {@code left AND right}
     * @throws NullPointerException if either operand is {@code null}
     */
    static Condition conjunction(Condition left, Condition right) {
        Objects.requireNonNull(left, "Left condition cannot be null");
        Objects.requireNonNull(right, "Other condition cannot be null");

        if (left == MatchAllCondition.INSTANCE) return right;
        if (right == MatchAllCondition.INSTANCE) return left;

        List<Condition> operands = new ArrayList<>();
        appendOperands(operands, left);
        appendOperands(operands, right);
        return new AndCondition(operands);
    }

    private static void appendOperands(List<Condition> operands, Condition condition) {
        if (condition instanceof AndCondition and) {
            operands.addAll(and.operands());
        } else {
            operands.add(condition);
        }
    }
}
