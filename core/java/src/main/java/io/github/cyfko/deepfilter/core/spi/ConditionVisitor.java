package io.github.cyfko.deepfilter.core.spi;

import io.github.cyfko.deepfilter.core.model.AndCondition;
import io.github.cyfko.deepfilter.core.model.FieldCondition;
import io.github.cyfko.deepfilter.core.model.NotCondition;

/**
 * Service provider interface implemented by data layers that evaluate or translate a
 * {@link io.github.cyfko.deepfilter.core.api.Condition} tree.
 * <p>
 * The parser never evaluates conditions itself; it only guarantees the shape of the tree.
 * Whether a {@link FieldCondition#path()} designates an existing field is the visitor's concern.
 * </p>
 *
 * @param <R> the result type produced for each node (a JPA predicate, a boolean, a query fragment...)
 * @author Frank KOSSI
 * @since 1.0
 */
public interface ConditionVisitor<R> {

    /**
     * Visits the always-true identity condition.
     *
     * @return the result for a condition matching everything
     */
    R visitMatchAll();

    /**
     * Visits a leaf condition.
     *
     * @param condition the {@code (path, value)} leaf
     * @return the result for the leaf
     */
    R visitField(FieldCondition condition);

    /**
     * Visits a conjunction. Implementations usually visit each operand in order.
     *
     * @param condition the conjunction
     * @return the result for the conjunction
     */
    R visitAnd(AndCondition condition);

    /**
     * Visits a negation.
     *
     * @param condition the negation
     * @return the result for the negation
     */
    R visitNot(NotCondition condition);
}
