package io.github.cyfko.deepfilter.core.model;

import io.github.cyfko.deepfilter.core.api.Condition;
import io.github.cyfko.deepfilter.core.spi.ConditionVisitor;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Leaf condition: the field addressed by {@code path} compares to {@code value}.
 * <p>
 * The path is the joined list of segments, operator keywords included
 * (e.g. {@code system_profile.system_memory_bytes.gt}). Interpreting the trailing keyword is left
 * to the evaluator.
 * </p>
 *
 * @param path  joined path, never blank
 * @param value coerced value
 * @author Frank KOSSI
 * @since 1.0
 */
public record FieldCondition(String path, FilterValue value) implements Condition {

    public FieldCondition {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Condition path cannot be null or blank");
        }
        Objects.requireNonNull(value, "Condition value cannot be null");
    }

    /**
     * Splits the path back into its segments.
     *
     * @param separator the separator the path was joined with
     * @return the segments, in order
     */
    public List<String> segments(String separator) {
        if (separator == null || separator.isEmpty()) {
            throw new IllegalArgumentException("Separator cannot be null or empty");
        }
        return List.copyOf(Arrays.asList(path.split(Pattern.quote(separator), -1)));
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
        return visitor.visitField(this);
    }

    @Override
    public String toString() {
        return path + " = " + value;
    }
}
