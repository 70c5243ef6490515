package io.github.cyfko.deepfilter.core.impl;

import io.github.cyfko.deepfilter.core.api.Condition;
import io.github.cyfko.deepfilter.core.api.FilterOperator;
import io.github.cyfko.deepfilter.core.api.FilterParamParser;
import io.github.cyfko.deepfilter.core.api.FilterTarget;
import io.github.cyfko.deepfilter.core.config.FilterParamPolicy;
import io.github.cyfko.deepfilter.core.config.PatternConfig;
import io.github.cyfko.deepfilter.core.exception.FilterOperandException;
import io.github.cyfko.deepfilter.core.exception.FilterSyntaxException;
import io.github.cyfko.deepfilter.core.model.Conditions;
import io.github.cyfko.deepfilter.core.model.FilterValue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default {@link FilterParamParser}: translates {@code filter[prefix][...]=value} parameters into
 * a conjunction of {@link io.github.cyfko.deepfilter.core.model.FieldCondition}s.
 * <p>
 * Each parameter goes through a single linear pass:
 * </p>
 * <ol>
 *   <li><strong>Candidate selection</strong>: the key must start with {@code paramName[filterPrefix][};
 *       anything else is ignored, so unrelated parameters never raise errors</li>
 *   <li><strong>Syntax validation</strong>: the key must match {@link PatternConfig#DEEP_OBJECT_KEY_PATTERN};
 *       the bracket contents become the path segments</li>
 *   <li><strong>Value coercion</strong>: {@code true/True/false/False} become booleans; for
 *       {@code gt/gte/lt/lte} the value must be all-digit and becomes an integer; for {@code eq/ne}
 *       an all-digit value becomes an integer; everything else stays a string</li>
 *   <li><strong>Operator normalization</strong>: {@code eq} is dropped, {@code ne} is dropped and
 *       negates, {@code nil/not_nil} become {@code isnull} with a boolean value, and the
 *       {@link FilterOperator#translation() translation table} is applied to the last segment</li>
 *   <li><strong>Path assembly</strong>: the optional field prefix is prepended and the segments are
 *       joined with the policy's separator</li>
 *   <li><strong>Composition</strong>: the condition is ANDed into the running result, starting from
 *       the identity condition</li>
 * </ol>
 * <p>
 * The first malformed key aborts the translation with a
 * {@link io.github.cyfko.deepfilter.core.exception.MalformedFilterException}.
 * </p>
 *
 * <h2>Usage examples</h2>
 * <pre>{@code
 * FilterParamParser parser = new DeepObjectParamParser();
 *
 * Map<String, String> params = new LinkedHashMap<>();
 * params.put("filter[system_profile][sap_system]", "true");
 * params.put("filter[system_profile][system_memory_bytes][gt]", "4000000000");
 * params.put("page", "2");
 *
 * Condition condition = parser.parse(params, "system_profile");
 * // (system_profile.sap_system = true AND system_profile.system_memory_bytes.gt = 4000000000)
 *
 * // Django-style paths
 * FilterParamParser django = new DeepObjectParamParser(FilterParamPolicy.djangoStyle());
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
public class DeepObjectParamParser implements FilterParamParser {

    private static final Logger log = Logger.getLogger(DeepObjectParamParser.class.getName());

    private final FilterParamPolicy policy;

    /**
     * Default constructor using {@link FilterParamPolicy#defaults()}.
     */
    public DeepObjectParamParser() {
        this(FilterParamPolicy.defaults());
    }

    /**
     * Constructor with custom configuration.
     *
     * @param policy the parser configuration
     * @throws IllegalArgumentException if policy is null
     */
    public DeepObjectParamParser(FilterParamPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("Filter parameter policy is required");
        }
        this.policy = policy;
    }

    public FilterParamPolicy getPolicy() {
        return policy;
    }

    @Override
    public Condition parse(Map<String, String> queryParams, FilterTarget target) {
        Objects.requireNonNull(queryParams, "Query parameters cannot be null");
        Objects.requireNonNull(target, "Filter target cannot be null");

        String paramName = target.paramName() != null ? target.paramName() : policy.paramName();
        String namespacePrefix = paramName + "[" + target.filterPrefix() + "][";

        Condition result = Conditions.matchAll();
        for (Map.Entry<String, String> entry : queryParams.entrySet()) {
            String key = entry.getKey();
            if (key == null || !key.startsWith(namespacePrefix)) {
                log.finer(() -> String.format("Ignoring parameter '%s' outside namespace '%s'", key, namespacePrefix));
                continue;
            }
            result = result.and(toCondition(key, entry.getValue(), paramName, target.fieldPrefix()));
        }

        Condition parsed = result;
        log.fine(() -> String.format("Parsed filter namespace '%s' into: %s", namespacePrefix, parsed));
        return parsed;
    }

    private Condition toCondition(String key, String rawValue, String paramName, String fieldPrefix) {
        List<String> segments = splitSegments(key, paramName);
        String trailing = segments.get(segments.size() - 1);
        FilterValue value = coerce(rawValue == null ? "" : rawValue, trailing, paramName, key);

        boolean negate = false;
        Optional<FilterOperator> operator = FilterOperator.fromKeyword(trailing);
        if (operator.isPresent() && operator.get().isEquality()) {
            negate = operator.get() == FilterOperator.NE;
            segments.remove(segments.size() - 1);
            operator = segments.isEmpty()
                    ? Optional.empty()
                    : FilterOperator.fromKeyword(segments.get(segments.size() - 1));
        }

        if (operator.isPresent() && operator.get().isNullCheck()) {
            boolean isNull = !value.isBoolean() || value.asBoolean();
            if (operator.get() == FilterOperator.NOT_NIL) {
                isNull = !isNull;
            }
            value = FilterValue.ofBoolean(isNull);
            segments.set(segments.size() - 1, FilterOperator.ISNULL_KEYWORD);
        } else if (operator.isPresent() && operator.get().translation().isPresent()) {
            segments.set(segments.size() - 1, operator.get().translation().get());
        }

        if (fieldPrefix != null) {
            segments.add(0, fieldPrefix);
        }

        Condition condition = Conditions.field(String.join(policy.pathSeparator(), segments), value);
        log.fine(() -> String.format("Accepted parameter '%s' as: %s", key, condition));
        return negate ? condition.not() : condition;
    }

    /**
     * Validates the key against the full grammar and returns the bracket contents, in order.
     * The list always has at least one element and is mutable.
     */
    private static List<String> splitSegments(String key, String paramName) {
        Matcher matcher = PatternConfig.DEEP_OBJECT_KEY_PATTERN.matcher(key);
        if (!matcher.matches()) {
            log.fine(() -> String.format("Rejecting malformed parameter '%s'", key));
            throw new FilterSyntaxException(paramName, key);
        }
        String brackets = matcher.group(2);
        String inner = brackets.substring(1, brackets.length() - 1);
        return new ArrayList<>(Arrays.asList(inner.split(Pattern.quote(PatternConfig.BRACKET_SEPARATOR))));
    }

    /**
     * Coerces the raw value from its literal form and the trailing segment, before any operator
     * is removed. Boolean literals win over the integer rules.
     */
    private static FilterValue coerce(String rawValue, String trailing, String paramName, String key) {
        if (PatternConfig.TRUE_LITERALS.contains(rawValue)) return FilterValue.ofBoolean(true);
        if (PatternConfig.FALSE_LITERALS.contains(rawValue)) return FilterValue.ofBoolean(false);

        boolean digits = PatternConfig.DIGITS_PATTERN.matcher(rawValue).matches();
        Optional<FilterOperator> operator = FilterOperator.fromKeyword(trailing);
        if (operator.isPresent() && operator.get().requiresInteger()) {
            if (!digits) {
                log.fine(() -> String.format("Rejecting non-integer value '%s' of parameter '%s'", rawValue, key));
                throw new FilterOperandException(paramName, key, rawValue);
            }
            return FilterValue.ofDigits(rawValue);
        }
        if (operator.isPresent() && operator.get().isEquality() && digits) {
            return FilterValue.ofDigits(rawValue);
        }
        return FilterValue.ofString(rawValue);
    }
}
