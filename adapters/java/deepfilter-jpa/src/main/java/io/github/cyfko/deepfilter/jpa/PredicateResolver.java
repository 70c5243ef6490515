package io.github.cyfko.deepfilter.jpa;

import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

/**
 * Functional interface for converting a filter condition into a JPA Criteria {@link Predicate}.
 * <p>
 * A {@code PredicateResolver} defers predicate construction until the query is built, so the same
 * resolver can be applied to several queries (a page query and its count query, for instance).
 * </p>
 *
 * <pre>{@code
 * PredicateResolver<Host> resolver = new JpaConditionResolver().toResolver(condition);
 *
 * CriteriaBuilder cb = em.getCriteriaBuilder();
 * CriteriaQuery<Host> query = cb.createQuery(Host.class);
 * Root<Host> root = query.from(Host.class);
 * query.where(resolver.resolve(root, query, cb));
 * }</pre>
 *
 * @param <E> the entity type the predicate applies to
 * @author Frank KOSSI
 * @since 1.0
 */
@FunctionalInterface
public interface PredicateResolver<E> {

    /**
     * Resolves the condition into a query predicate.
     *
     * @param root  the root entity in the criteria query
     * @param query the criteria query being constructed
     * @param cb    the criteria builder for creating predicates and expressions
     * @return a predicate representing the condition
     * @throws io.github.cyfko.deepfilter.core.exception.FilterValidationException if a path cannot be
     *         resolved on the entity or a value does not fit the targeted attribute
     */
    Predicate resolve(Root<E> root, CriteriaQuery<?> query, CriteriaBuilder cb);
}
