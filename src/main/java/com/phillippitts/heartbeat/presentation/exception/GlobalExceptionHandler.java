package com.phillippitts.heartbeat.presentation.exception;

import com.phillippitts.heartbeat.exception.DuplicateServiceException;
import com.phillippitts.heartbeat.exception.InvalidStatusException;
import com.phillippitts.heartbeat.exception.ServiceNotFoundException;
import com.phillippitts.heartbeat.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts registry exceptions to HTTP responses with appropriate status codes.
 * Unexpected errors are logged with their stack trace but never exposed to clients.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);
    private static final int MAX_LOGGED_VALUE = 120;

    /**
     * Unknown service id (HTTP 404).
     */
    @ExceptionHandler(ServiceNotFoundException.class)
    ResponseEntity<ApiError> handleServiceNotFound(ServiceNotFoundException ex) {
        LOG.debug("Service not found: {}", LogSanitizer.truncate(ex.getServiceId(), MAX_LOGGED_VALUE));
        return error(HttpStatus.NOT_FOUND, ex.getClass().getSimpleName(), "Service not found", ex.getMessage());
    }

    /**
     * Explicit id already registered (HTTP 409).
     */
    @ExceptionHandler(DuplicateServiceException.class)
    ResponseEntity<ApiError> handleDuplicate(DuplicateServiceException ex) {
        LOG.info("Duplicate registration rejected: {}", LogSanitizer.truncate(ex.getServiceId(), MAX_LOGGED_VALUE));
        return error(HttpStatus.CONFLICT, ex.getClass().getSimpleName(), "Service already registered",
                ex.getMessage());
    }

    /**
     * Client error - unknown status value (HTTP 400). Nothing was recorded.
     */
    @ExceptionHandler(InvalidStatusException.class)
    ResponseEntity<ApiError> handleInvalidStatus(InvalidStatusException ex) {
        LOG.warn("Invalid status rejected: {}", LogSanitizer.truncate(ex.getValue(), MAX_LOGGED_VALUE));
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Invalid heartbeat status",
                ex.getMessage());
    }

    /**
     * Client error - bad arguments or an unreadable/invalid body (HTTP 400).
     */
    @ExceptionHandler(IllegalArgumentException.class)
    ResponseEntity<ApiError> handleIllegalArgument(IllegalArgumentException ex) {
        LOG.warn("Bad request: {}", ex.getMessage());
        return error(HttpStatus.BAD_REQUEST, ex.getClass().getSimpleName(), "Invalid request", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleValidation(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining(", "));
        LOG.warn("Request validation failed: {}", details);
        return error(HttpStatus.BAD_REQUEST, "ValidationFailed", "Invalid request", details);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    ResponseEntity<ApiError> handleUnreadable(HttpMessageNotReadableException ex) {
        LOG.warn("Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return error(HttpStatus.BAD_REQUEST, "MalformedRequest", "Invalid request",
                "Request body is missing or malformed");
    }

    /**
     * Catch-all for unexpected errors (HTTP 500).
     */
    @ExceptionHandler(Exception.class)
    ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        LOG.error("Unexpected error", ex);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "InternalServerError",
                "An unexpected error occurred", "Please contact support with request ID");
    }

    private static ResponseEntity<ApiError> error(HttpStatus status, String code, String message, String details) {
        return ResponseEntity.status(status).body(new ApiError(code, message, details, Instant.now()));
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
