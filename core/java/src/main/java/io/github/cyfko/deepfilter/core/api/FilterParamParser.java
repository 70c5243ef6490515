package io.github.cyfko.deepfilter.core.api;

import io.github.cyfko.deepfilter.core.exception.FilterOperandException;
import io.github.cyfko.deepfilter.core.exception.FilterSyntaxException;

import java.util.Map;

/**
 * Interface for translating "deep object" query parameters into a {@link Condition}.
 * <p>
 * Implementations scan the query parameters of one request, keep those whose key claims the
 * requested filter namespace ({@code <paramName>[<filterPrefix>][...]}), and AND together one
 * condition per kept parameter. Parameters outside the namespace are ignored.
 * </p>
 *
 * <h2>Syntax</h2>
 * <pre>{@code
 * <paramName>[<filterPrefix>]([<word>])+ = <value>
 *
 * filter[system_profile][sap_system]=true                  -> system_profile.sap_system = true
 * filter[system_profile][cpu_flags][contains]=clzero       -> system_profile.cpu_flags.contains = 'clzero'
 * filter[system_profile][system_memory_bytes][gt]=4000     -> system_profile.system_memory_bytes.gt = 4000
 * filter[system_profile][started][ne]=true                 -> NOT (system_profile.started = true)
 * }</pre>
 *
 * <h2>Ordering</h2>
 * <p>
 * Parameters are visited in the iteration order of the supplied map, which decides the order of
 * the conjunction and which malformed key is reported first. Pass an ordered map
 * (e.g. {@link java.util.LinkedHashMap}) built from the request.
 * </p>
 *
 * <p><strong>Thread Safety:</strong> implementations are stateless between calls and safe to share
 * across request threads.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 * @see FilterOperator
 */
public interface FilterParamParser {

    /**
     * Parses the given namespace using the default parameter name and no field prefix.
     *
     * @param queryParams  ordered query parameters of the request
     * @param filterPrefix first bracket segment, e.g. {@code system_profile}
     * @return the conjunction of all matched parameters, or the identity condition when none match
     * @throws FilterSyntaxException  if a key claims the namespace but is malformed
     * @throws FilterOperandException if an ordering operator has a non-integer value
     */
    default Condition parse(Map<String, String> queryParams, String filterPrefix) {
        return parse(queryParams, FilterTarget.of(filterPrefix));
    }

    /**
     * Parses the given namespace using the default parameter name, rooting every path at
     * {@code fieldPrefix}.
     *
     * @param queryParams  ordered query parameters of the request
     * @param filterPrefix first bracket segment, e.g. {@code system_profile}
     * @param fieldPrefix  segment prepended to every produced path, or {@code null}
     * @return the conjunction of all matched parameters, or the identity condition when none match
     * @throws FilterSyntaxException  if a key claims the namespace but is malformed
     * @throws FilterOperandException if an ordering operator has a non-integer value
     * @throws IllegalArgumentException if {@code fieldPrefix} is blank
     */
    default Condition parse(Map<String, String> queryParams, String filterPrefix, String fieldPrefix) {
        return parse(queryParams, FilterTarget.of(filterPrefix).withFieldPrefix(fieldPrefix));
    }

    /**
     * Parses the namespace described by {@code target}.
     *
     * @param queryParams ordered query parameters of the request
     * @param target      namespace and path rooting
     * @return the conjunction of all matched parameters, or the identity condition when none match
     * @throws FilterSyntaxException  if a key claims the namespace but is malformed
     * @throws FilterOperandException if an ordering operator has a non-integer value
     * @throws NullPointerException   if an argument is {@code null}
     */
    Condition parse(Map<String, String> queryParams, FilterTarget target);
}
