package io.github.cyfko.deepfilter.core.model;

import io.github.cyfko.deepfilter.core.api.Condition;
import io.github.cyfko.deepfilter.core.spi.ConditionVisitor;

/**
 * The always-true condition, identity element of {@link Condition#and(Condition)}.
 * <p>
 * Returned by the parser when no parameter belongs to the requested filter namespace.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public enum MatchAllCondition implements Condition {
    INSTANCE;

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
        return visitor.visitMatchAll();
    }

    @Override
    public String toString() {
        return "TRUE";
    }
}
