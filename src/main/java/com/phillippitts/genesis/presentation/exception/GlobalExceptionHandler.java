package com.phillippitts.genesis.presentation.exception;

import com.phillippitts.genesis.exception.GenesisException;
import com.phillippitts.genesis.exception.HardwareLinkException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Logs errors for monitoring while keeping utterance text out of client responses.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - missing or oversized utterance (HTTP 400).
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    ResponseEntity<ApiError> handleInvalidRequest(MethodArgumentNotValidException ex) {
        String details = ex.getBindingResult().getFieldErrors().stream()
                .map(e -> e.getField() + " " + e.getDefaultMessage())
                .findFirst()
                .orElse("Invalid request");
        LOG.warn("Rejected operator request: {}", details);
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "InvalidRequest",
                "Invalid request body",
                details,
                Instant.now()
            ));
    }

    /**
     * Transient error - robot unreachable, retry possible (HTTP 503).
     */
    @ExceptionHandler(HardwareLinkException.class)
    ResponseEntity<ApiError> handleHardwareLink(HardwareLinkException ex) {
        LOG.error("Hardware link failure: host={}", ex.getHost(), ex);
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Robot temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Dialogue not accepting turns, e.g. during shutdown (HTTP 503).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleUnavailable(IllegalStateException ex) {
        LOG.warn("Dialogue unavailable: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                "DialogueUnavailable",
                "Dialogue is not accepting turns",
                ex.getMessage(),
                Instant.now()
            ));
    }

    /**
     * Other domain failures (HTTP 500).
     */
    @ExceptionHandler(GenesisException.class)
    ResponseEntity<ApiError> handleDomainFailure(GenesisException ex) {
        LOG.error("Domain failure", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "The robot brain could not complete the request",
                "See server logs for details",
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

    /**
     * Standardized error response for API clients.
     */
    private record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
