package com.lmspush.api;

import com.lmspush.content.ContentValidationException;
import com.lmspush.destination.DuplicateDestinationException;
import com.lmspush.filter.UnknownFilterRuleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Unified error responses:
 * {
 *   "error_code": "VALIDATION_ERROR",
 *   "message": "...",
 *   "timestamp": "2026-..."
 * }
 *
 * Delivery failures never reach this handler; they are recorded on the push.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ContentValidationException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleValidation(ContentValidationException ex) {
        log.warn("Validation error: {}", ex.getMessage());
        return errorResponse("VALIDATION_ERROR", ex.getMessage());
    }

    @ExceptionHandler(PushNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handlePushNotFound(PushNotFoundException ex) {
        return errorResponse("PUSH_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(UnknownFilterRuleException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Map<String, Object> handleUnknownRule(UnknownFilterRuleException ex) {
        return errorResponse("RULE_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(DuplicateDestinationException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Map<String, Object> handleDuplicateDestination(DuplicateDestinationException ex) {
        log.warn("Duplicate destination: {}", ex.getMessage());
        return errorResponse("DUPLICATE_DESTINATION", ex.getMessage());
    }

    @ExceptionHandler({
        MethodArgumentTypeMismatchException.class,
        HttpMessageNotReadableException.class
    })
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleParseErrors(Exception ex) {
        return errorResponse("BAD_REQUEST", "request format is invalid: " + ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Map<String, Object> handleIllegalArgument(IllegalArgumentException ex) {
        return errorResponse("INVALID_ARGUMENT", ex.getMessage());
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Map<String, Object> handleUnexpected(Exception ex) {
        log.error("Unexpected error", ex);
        return errorResponse("INTERNAL_ERROR", "an unexpected error occurred");
    }

    private Map<String, Object> errorResponse(String errorCode, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error_code", errorCode);
        body.put("message", message);
        body.put("timestamp", Instant.now().toString());
        return body;
    }
}
