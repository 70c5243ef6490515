package io.github.cyfko.deepfilter.core.api;

import io.github.cyfko.deepfilter.core.spi.ConditionVisitor;

/**
 * Framework-agnostic interface representing a composable filter condition.
 * <p>
 * A {@code Condition} is what the deep-object parameter parser emits: a boolean expression over
 * {@code (path, value)} pairs that a data layer evaluates later. It follows the
 * <strong>Composite pattern</strong>, so conditions nest freely through {@link #and(Condition)}
 * and {@link #not()}.
 * </p>
 *
 * <h2>Core Concepts</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All operations return new {@code Condition} instances,
 *       leaving the original unchanged</li>
 *   <li><strong>Identity:</strong> The always-true condition is neutral for {@code and()}:
 *       {@code matchAll().and(c)} is equal to {@code c}</li>
 *   <li><strong>Structural Equality:</strong> Two conditions are equal when their paths, values,
 *       polarity and operand order are equal</li>
 *   <li><strong>Backend-Agnostic:</strong> Evaluation is delegated to a {@link ConditionVisitor}
 *       supplied by the data layer (JPA, in-memory, search engine, ...)</li>
 * </ul>
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * Condition sap = Conditions.field("system_profile.sap_system", FilterValue.ofBoolean(true));
 * Condition started = Conditions.field("system_profile.started", FilterValue.ofBoolean(true));
 *
 * // sap_system = true AND NOT(started = true)
 * Condition result = Conditions.matchAll().and(sap).and(started.not());
 * }</pre>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * Implementations must be <strong>immutable</strong> and therefore inherently thread-safe.
 * </p>
 *
 * @see ConditionVisitor
 * @author Frank KOSSI
 * @since 1.0
 */
public interface Condition {

    /**
     * Creates a new condition representing the logical AND of this condition and another.
     * <p>
     * Conjunctions are flattened: {@code a.and(b).and(c)} yields a single conjunction of
     * {@code [a, b, c]}. The identity condition is dropped from either side.
     * </p>
     *
     * @param other The other condition to combine with this one
     * @return A new condition representing (this AND other)
     * @throws NullPointerException if {@code other} is {@code null}
     */
    Condition and(Condition other);

    /**
     * Creates a new condition representing the logical negation of this condition.
     *
     * @return A new condition representing NOT(this)
     */
    Condition not();

    /**
     * Dispatches this condition to the matching method of the given visitor.
     *
     * @param visitor the visitor evaluating or translating the condition
     * @param <R>     the visitor's result type
     * @return the visitor's result for this condition
     */
    <R> R accept(ConditionVisitor<R> visitor);
}
