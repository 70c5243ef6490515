package io.github.cyfko.deepfilter.spring.web;

import io.github.cyfko.deepfilter.core.exception.FilterValidationException;
import io.github.cyfko.deepfilter.core.exception.MalformedFilterException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.logging.Logger;

/**
 * Maps filter errors to {@code 400 Bad Request}.
 * <p>
 * Messages of these exceptions only quote the client's own input, so they are returned as-is:
 * </p>
 * <pre>{@code
 * {"error": "The 'filter' parameter is incorrectly formatted", "parameter": "filter"}
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0
 */
@RestControllerAdvice
public class MalformedFilterExceptionHandler {

    private static final Logger log = Logger.getLogger(MalformedFilterExceptionHandler.class.getName());

    @ExceptionHandler(MalformedFilterException.class)
    public ResponseEntity<FilterErrorResponse> handleMalformedFilter(MalformedFilterException ex) {
        log.info(() -> String.format("Rejected filter parameter '%s': %s", ex.getParameterKey(), ex.getMessage()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new FilterErrorResponse(ex.getMessage(), ex.getParamName()));
    }

    @ExceptionHandler(FilterValidationException.class)
    public ResponseEntity<FilterErrorResponse> handleFilterValidation(FilterValidationException ex) {
        log.info(() -> String.format("Rejected filter condition: %s", ex.getMessage()));
        return ResponseEntity.status(HttpStatus.BAD_REQUEST)
                .body(new FilterErrorResponse(ex.getMessage(), null));
    }
}
