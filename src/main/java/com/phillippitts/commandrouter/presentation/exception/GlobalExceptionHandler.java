package com.phillippitts.commandrouter.presentation.exception;

import com.phillippitts.commandrouter.exception.CommandTimeoutException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Collectors;

/**
 * Global exception handler for the stateless API.
 *
 * Only request-level problems surface here. Command failures are ordinary outcomes with
 * {@code success=false} and HTTP 200.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - blank command, unknown intent (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleInvalidRequest(IllegalArgumentException ex) {
        LOG.warn("Invalid request: {}", ex.getMessage());
        return badRequest(ex.getClass().getSimpleName(), ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining("; "));
        LOG.warn("Request validation failed: {}", details);
        return badRequest("ValidationError", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMessage());
        return badRequest("MalformedRequest", "Request body must be a JSON object");
    }

    /**
     * Overall budget exceeded (HTTP 504).
     */
    @ExceptionHandler(CommandTimeoutException.class)
    ResponseEntity<ApiError> handleTimeout(CommandTimeoutException ex) {
        LOG.warn("Command timed out: correlation={}, timeoutMs={}", ex.getCorrelationId(), ex.getTimeoutMs());
        return ResponseEntity
            .status(HttpStatus.GATEWAY_TIMEOUT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "The command took too long to complete",
                "correlation_id=" + ex.getCorrelationId(),
                Instant.now()
            ));
    }

    /**
     * Command pool saturated - retry possible (HTTP 503).
     */
    @ExceptionHandler(RejectedExecutionException.class)
    ResponseEntity<ApiError> handleSaturation(RejectedExecutionException ex) {
        LOG.warn("Command pool saturated: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                "ServiceBusy",
                "Command service temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                "InternalServerError",
                "An unexpected error occurred",
                "Please contact support with request ID",
                Instant.now()
            ));
    }

    private static ResponseEntity<ApiError> badRequest(String code, String details) {
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(code, "Invalid command request", details, Instant.now()));
    }

    /**
     * Standardized error response for API clients.
     */
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
