package com.rostrum.debate.web;

import com.rostrum.debate.controller.DebateController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Renders rejected debate requests as a {@link DebateRequestError}.
 *
 * <p>Field errors are keyed by property path, {@code judges[3].apiKey} for a nested judge entry.
 * A field that fails several constraints reports all of their messages.
 */
@RestControllerAdvice(assignableTypes = DebateController.class)
public class DebateRequestExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(DebateRequestExceptionHandler.class);

    static final String INVALID_BODY = "Debate request body is missing or malformed";

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<DebateRequestError> handleInvalidRequest(MethodArgumentNotValidException ex) {
        SortedMap<String, String> fieldErrors = new TreeMap<>();
        for (FieldError fieldError : ex.getBindingResult().getFieldErrors()) {
            String message = fieldError.getDefaultMessage() == null ? "is invalid" : fieldError.getDefaultMessage();
            fieldErrors.merge(fieldError.getField(), message, (first, second) ->
                    first.equals(second) ? first : first + "; " + second);
        }

        log.debug("Rejected debate request with invalid fields {}", fieldErrors.keySet());
        String detail = fieldErrors.isEmpty()
                ? "Debate request is invalid"
                : "Debate request has " + fieldErrors.size() + " invalid field"
                        + (fieldErrors.size() == 1 ? "" : "s") + ": " + String.join(", ", fieldErrors.keySet());
        return ResponseEntity.badRequest().body(new DebateRequestError(detail, fieldErrors));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<DebateRequestError> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.debug("Rejected unreadable debate request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest().body(new DebateRequestError(INVALID_BODY, Map.of()));
    }

    public record DebateRequestError(String detail, Map<String, String> fieldErrors) {
    }
}
