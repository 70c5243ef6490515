package io.github.cyfko.deepfilter.spring.web;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Body of a 400 response for a rejected filter.
 *
 * @param error     the human-readable reason
 * @param parameter the outer parameter name, absent when the error is not tied to one
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FilterErrorResponse(String error, String parameter) {
}
