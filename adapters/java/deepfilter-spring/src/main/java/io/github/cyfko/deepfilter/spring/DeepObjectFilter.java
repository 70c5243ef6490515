package io.github.cyfko.deepfilter.spring;

import java.lang.annotation.*;

/**
 * Binds a {@link io.github.cyfko.deepfilter.core.api.Condition} controller parameter to the
 * deep-object filter parameters of the current request.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * @GetMapping("/hosts")
 * public List<Host> hosts(@DeepObjectFilter("system_profile") Condition condition) {
 *     // GET /hosts?filter[system_profile][arch]=x86_64&filter[system_profile][sap_system]=true
 *     return hostRepository.findAll(condition);
 * }
 * }</pre>
 *
 * <p>Malformed parameters are reported as HTTP 400 by
 * {@link io.github.cyfko.deepfilter.spring.web.MalformedFilterExceptionHandler}.</p>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
@Target(ElementType.PARAMETER)
@Retention(RetentionPolicy.RUNTIME)
@Documented
public @interface DeepObjectFilter {

    /**
     * The filter prefix, i.e. the first bracketed segment ({@code system_profile} in
     * {@code filter[system_profile][arch]}).
     */
    String value();

    /**
     * The outer parameter name. Empty means the configured {@code deepfilter.param-name}.
     */
    String paramName() default "";

    /**
     * Segment prepended to every resulting path, e.g. the association leading to the filtered object.
     * Empty means none.
     */
    String fieldPrefix() default "";
}
