package io.github.cyfko.deepfilter.core.model;

import io.github.cyfko.deepfilter.core.api.Condition;
import io.github.cyfko.deepfilter.core.spi.ConditionVisitor;

import java.util.Objects;

/**
 * Negation of a condition.
 *
 * @param operand the negated condition
 * @author Frank KOSSI
 * @since 1.0
 */
public record NotCondition(Condition operand) implements Condition {

    public NotCondition {
        Objects.requireNonNull(operand, "Negated condition cannot be null");
    }

    @Override
    public Condition and(Condition other) {
        return Conditions.conjunction(this, other);
    }

    @Override
    public Condition not() {
        return new NotCondition(this);
    }

    @Override
    public <R> R accept(ConditionVisitor<R> visitor) {
        return visitor.visitNot(this);
    }

    @Override
    public String toString() {
        return "NOT (" + operand + ")";
    }
}
