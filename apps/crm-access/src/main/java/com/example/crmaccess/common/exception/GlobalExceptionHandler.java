package com.example.crmaccess.common.exception;

import com.example.crmaccess.access.exception.AccessConfigurationException;
import com.example.crmaccess.access.exception.RecordNotFoundException;
import com.example.crmaccess.common.util.StringSanitizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.util.stream.Collectors;

/**
 * Global exception handler for REST controllers.
 *
 * <p>Maps resolution failures onto HTTP statuses: not found to 404, directory
 * misconfiguration to 422, bad input to 400 and everything else to 500.
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger LOG = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    private static final int MAX_LOG_MESSAGE_LENGTH = 200;
    private static final int MAX_RESPONSE_MESSAGE_LENGTH = 200;

    /**
     * Handles records missing from both identifier spaces.
     *
     * @param ex      the exception
     * @param request the current request
     * @return 404 error response
     */
    @ExceptionHandler(RecordNotFoundException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleNotFound(
            @NonNull RecordNotFoundException ex,
            @NonNull ServerHttpRequest request) {
        LOG.info("Record not found: module={}, recordId={}",
                StringSanitizer.forLog(ex.getModuleName()), StringSanitizer.forLog(ex.getRecordId()));
        return respond(HttpStatus.NOT_FOUND, "not_found", ex.getMessage(), request);
    }

    /**
     * Handles directory setup problems such as a missing sharing rule.
     *
     * @param ex      the exception
     * @param request the current request
     * @return 422 error response
     */
    @ExceptionHandler(AccessConfigurationException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleConfiguration(
            @NonNull AccessConfigurationException ex,
            @NonNull ServerHttpRequest request) {
        LOG.warn("Access configuration error: reason={}, message={}",
                ex.getReason(), StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH));
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, "configuration_error", ex.getMessage(), request);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleValidationErrors(
            @NonNull WebExchangeBindException ex,
            @NonNull ServerHttpRequest request) {
        String fieldErrors = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));

        LOG.warn("Validation failed: {}", StringSanitizer.forLog(fieldErrors, MAX_LOG_MESSAGE_LENGTH));
        return respond(HttpStatus.BAD_REQUEST, "validation_error", "Validation failed: " + fieldErrors, request);
    }

    @ExceptionHandler(ServerWebInputException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleInputException(
            @NonNull ServerWebInputException ex,
            @NonNull ServerHttpRequest request) {
        LOG.warn("Input error: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH));
        return respond(HttpStatus.BAD_REQUEST, "invalid_request", "Invalid request format", request);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleIllegalArgument(
            @NonNull IllegalArgumentException ex,
            @NonNull ServerHttpRequest request) {
        LOG.warn("Illegal argument: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH));
        return respond(HttpStatus.BAD_REQUEST, "invalid_argument", ex.getMessage(), request);
    }

    /**
     * Handles all unhandled exceptions, including directory read failures.
     *
     * @param ex      the exception
     * @param request the current request
     * @return generic error response
     */
    @ExceptionHandler(Exception.class)
    @NonNull
    public ResponseEntity<ErrorResponse> handleGeneral(
            @NonNull Exception ex,
            @NonNull ServerHttpRequest request) {
        LOG.error("Unhandled exception: {}", StringSanitizer.forLog(ex.getMessage(), MAX_LOG_MESSAGE_LENGTH), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "internal_error", "An unexpected error occurred", request);
    }

    @NonNull
    private ResponseEntity<ErrorResponse> respond(
            HttpStatus status,
            String error,
            String message,
            ServerHttpRequest request) {
        ErrorResponse body = ErrorResponse.of(
                status.value(),
                error,
                StringSanitizer.forResponse(message, MAX_RESPONSE_MESSAGE_LENGTH),
                request.getPath().value());
        return ResponseEntity.status(status).body(body);
    }
}
