package io.github.cyfko.deepfilter.core.model;

import io.github.cyfko.deepfilter.core.api.Condition;
import io.github.cyfko.deepfilter.core.spi.ConditionVisitor;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Conjunction of two or more conditions, in composition order.
 *
 * @param operands the conjoined conditions, at least two, none of them a conjunction itself
 *                 when built through {@link Condition#and(Condition)}
 * @author Frank KOSSI
 * @since 1.0
 */
public record AndCondition(List<Condition> operands) implements Condition {

    public AndCondition {
        operands = List.copyOf(operands);
        if (operands.size() < 2) {
            throw new IllegalArgumentException("A conjunction requires at least two operands, got " + operands.size());
        }
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
        return visitor.visitAnd(this);
    }

    @Override
    public String toString() {
        return operands.stream().map(Condition::toString).collect(Collectors.joining(" AND ", "(", ")"));
    }
}
