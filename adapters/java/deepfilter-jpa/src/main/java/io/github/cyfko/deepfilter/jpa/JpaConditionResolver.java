package io.github.cyfko.deepfilter.jpa;

import io.github.cyfko.deepfilter.core.api.Condition;
import io.github.cyfko.deepfilter.core.config.FilterParamPolicy;
import io.github.cyfko.deepfilter.core.exception.FilterValidationException;
import io.github.cyfko.deepfilter.core.model.AndCondition;
import io.github.cyfko.deepfilter.core.model.FieldCondition;
import io.github.cyfko.deepfilter.core.model.FilterValue;
import io.github.cyfko.deepfilter.core.model.NotCondition;
import io.github.cyfko.deepfilter.core.spi.ConditionVisitor;
import io.github.cyfko.deepfilter.jpa.utils.JpaValueConverter;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.Expression;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Translates a parsed {@link Condition} into a JPA Criteria predicate.
 * <p>
 * Each {@link FieldCondition} path is split on the policy's separator. When the last segment is a
 * {@link LookupType} keyword preceded by at least one attribute segment, it selects the comparison;
 * otherwise the comparison is an exact match. Attribute segments are mapped through
 * {@link AttributeNaming} and navigated with {@link Path#get(String)}, so embeddables and to-one
 * associations can be traversed.
 * </p>
 *
 * <pre>{@code
 * Condition condition = parser.parse(params, "system_profile");
 * PredicateResolver<Host> resolver = new JpaConditionResolver().toResolver(condition);
 *
 * CriteriaQuery<Host> query = cb.createQuery(Host.class);
 * Root<Host> root = query.from(Host.class);
 * query.where(resolver.resolve(root, query, cb));
 * }</pre>
 *
 * <p>Instances are immutable and can be shared between threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class JpaConditionResolver {

    private static final Logger log = Logger.getLogger(JpaConditionResolver.class.getName());

    private static final char LIKE_ESCAPE = '\\';

    private final String separator;
    private final AttributeNaming naming;

    /**
     * Creates a resolver for paths produced with {@link FilterParamPolicy#defaults()}, mapping
     * snake_case segments to camelCase attributes.
     */
    public JpaConditionResolver() {
        this(FilterParamPolicy.defaults(), AttributeNaming.SNAKE_TO_CAMEL);
    }

    /**
     * Creates a resolver for paths produced with the given policy.
     *
     * @param policy the policy the conditions were parsed with
     * @param naming the segment to attribute name mapping
     */
    public JpaConditionResolver(FilterParamPolicy policy, AttributeNaming naming) {
        Objects.requireNonNull(policy, "Filter parameter policy is required");
        Objects.requireNonNull(naming, "Attribute naming strategy is required");
        this.separator = policy.pathSeparator();
        this.naming = naming;
    }

    /**
     * Creates a deferred predicate for the condition.
     *
     * @param condition the condition to translate
     * @param <E>       the entity type
     * @return a resolver building the predicate against a query root
     */
    public <E> PredicateResolver<E> toResolver(Condition condition) {
        Objects.requireNonNull(condition, "Condition cannot be null");
        return (root, query, cb) -> condition.accept(new PredicateBuilder(root, cb));
    }

    private final class PredicateBuilder implements ConditionVisitor<Predicate> {
        private final Root<?> root;
        private final CriteriaBuilder cb;

        PredicateBuilder(Root<?> root, CriteriaBuilder cb) {
            this.root = root;
            this.cb = cb;
        }

        @Override
        public Predicate visitMatchAll() {
            return cb.conjunction();
        }

        @Override
        public Predicate visitAnd(AndCondition condition) {
            Predicate[] operands = condition.operands().stream()
                    .map(operand -> operand.accept(this))
                    .toArray(Predicate[]::new);
            return cb.and(operands);
        }

        /**
         * A negated comparison leaf also accepts a NULL attribute, so {@code P} and {@code NOT P}
         * partition the rows. Negated null checks stay plain {@code NOT}.
         */
        @Override
        public Predicate visitNot(NotCondition condition) {
            if (condition.operand() instanceof FieldCondition field) {
                Leaf leaf = resolveLeaf(field);
                Predicate negated = cb.not(leaf.predicate());
                return leaf.lookup() == LookupType.ISNULL ? negated : cb.or(negated, cb.isNull(leaf.path()));
            }
            return cb.not(condition.operand().accept(this));
        }

        @Override
        public Predicate visitField(FieldCondition condition) {
            return resolveLeaf(condition).predicate();
        }

        private Leaf resolveLeaf(FieldCondition condition) {
            List<String> segments = condition.segments(separator);

            Optional<LookupType> trailing = segments.size() > 1
                    ? LookupType.fromKeyword(segments.get(segments.size() - 1))
                    : Optional.empty();
            LookupType lookup = trailing.orElse(LookupType.EXACT);
            List<String> attributes = trailing.isPresent() ? segments.subList(0, segments.size() - 1) : segments;

            Path<?> path = navigate(condition.path(), attributes);
            log.fine(() -> String.format("Resolving %s as %s on %s", condition, lookup, attributes));
            return new Leaf(path, lookup, buildPredicate(condition, path, lookup));
        }

        private Path<?> navigate(String fullPath, List<String> attributes) {
            Path<?> path = root;
            for (String segment : attributes) {
                String attribute = naming.toAttributeName(segment);
                try {
                    path = path.get(attribute);
                } catch (RuntimeException e) {
                    throw new FilterValidationException(
                            String.format("Cannot resolve path '%s': unknown attribute '%s'", fullPath, attribute), e);
                }
            }
            return path;
        }

        @SuppressWarnings({"unchecked", "rawtypes"})
        private Predicate buildPredicate(FieldCondition condition, Path<?> path, LookupType lookup) {
            FilterValue value = condition.value();

            if (lookup == LookupType.ISNULL) {
                if (!value.isBoolean()) {
                    throw new FilterValidationException(String.format(
                            "Value '%s' of path '%s' must be a boolean for the 'isnull' lookup", value.value(), condition.path()));
                }
                return value.asBoolean() ? cb.isNull(path) : cb.isNotNull(path);
            }

            if (lookup.isPattern() || lookup == LookupType.IEXACT) {
                Expression<String> text = stringExpression(condition, path);
                String operand = value.value().toString();
                if (lookup.isCaseInsensitive()) {
                    text = cb.lower(text);
                    operand = operand.toLowerCase(Locale.ROOT);
                }
                return switch (lookup) {
                    case IEXACT -> cb.equal(text, operand);
                    case CONTAINS, ICONTAINS -> cb.like(text, "%" + escapeLike(operand) + "%", LIKE_ESCAPE);
                    case STARTSWITH, ISTARTSWITH -> cb.like(text, escapeLike(operand) + "%", LIKE_ESCAPE);
                    case ENDSWITH, IENDSWITH -> cb.like(text, "%" + escapeLike(operand), LIKE_ESCAPE);
                    default -> throw new IllegalStateException("Unexpected lookup: " + lookup);
                };
            }

            Object converted = convert(condition, path);
            if (lookup.isOrdering()) {
                if (!(converted instanceof Comparable)) {
                    throw new FilterValidationException(String.format(
                            "Path '%s' is not comparable with the '%s' lookup", condition.path(), lookup.getKeyword()));
                }
                Expression<Comparable> comparable = (Expression<Comparable>) path;
                Comparable bound = (Comparable) converted;
                return switch (lookup) {
                    case GT -> cb.greaterThan(comparable, bound);
                    case GTE -> cb.greaterThanOrEqualTo(comparable, bound);
                    case LT -> cb.lessThan(comparable, bound);
                    case LTE -> cb.lessThanOrEqualTo(comparable, bound);
                    default -> throw new IllegalStateException("Unexpected lookup: " + lookup);
                };
            }

            return cb.equal(path, converted);
        }

        @SuppressWarnings("unchecked")
        private Expression<String> stringExpression(FieldCondition condition, Path<?> path) {
            if (path.getJavaType() != String.class) {
                throw new FilterValidationException(String.format(
                        "Path '%s' is not a text attribute", condition.path()));
            }
            return (Expression<String>) path;
        }

        private Object convert(FieldCondition condition, Path<?> path) {
            Class<?> type = path.getJavaType();
            try {
                return JpaValueConverter.convertValue(type, condition.value());
            } catch (IllegalArgumentException e) {
                throw new FilterValidationException(String.format(
                        "Value '%s' of path '%s' is not compatible with type %s",
                        condition.value().value(), condition.path(), type.getSimpleName()), e);
            }
        }
    }

    /** A resolved field condition: the attribute path, its lookup and the comparison built on it. */
    private record Leaf(Path<?> path, LookupType lookup, Predicate predicate) {
    }

    /**
     * Escapes LIKE wildcards so that the operand is matched literally.
     */
    static String escapeLike(String operand) {
        StringBuilder escaped = new StringBuilder(operand.length());
        for (char c : operand.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
