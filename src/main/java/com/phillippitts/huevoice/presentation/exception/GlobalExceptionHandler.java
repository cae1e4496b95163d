package com.phillippitts.huevoice.presentation.exception;

import com.phillippitts.huevoice.exception.CommandRejectedException;
import com.phillippitts.huevoice.exception.DeviceBridgeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 * Command text is never echoed back in error bodies.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Client error - missing or blank command text (HTTP 400).
     */
    @ExceptionHandler({MethodArgumentNotValidException.class, HttpMessageNotReadableException.class})
    ResponseEntity<ApiError> handleInvalidRequest(Exception ex) {
        LOG.warn("Rejected request: {}", ex.getClass().getSimpleName());
        return ResponseEntity
            .status(HttpStatus.BAD_REQUEST)
            .body(new ApiError(
                "InvalidRequest",
                "Command text must not be blank",
                "Send a JSON body like {\"text\": \"turn on\"}",
                Instant.now()
            ));
    }

    /**
     * Back-pressure - the command channel is full (HTTP 503).
     */
    @ExceptionHandler(CommandRejectedException.class)
    ResponseEntity<ApiError> handleRejected(CommandRejectedException ex) {
        LOG.warn("Command rejected: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Command queue is full",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Bridge unreachable (HTTP 502).
     */
    @ExceptionHandler(DeviceBridgeException.class)
    ResponseEntity<ApiError> handleBridge(DeviceBridgeException ex) {
        LOG.error("Bridge error: device={}", ex.getDeviceName(), ex);
        return ResponseEntity
            .status(HttpStatus.BAD_GATEWAY)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Hue bridge request failed",
                "Check that the bridge is reachable",
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
    record ApiError(
        String errorCode,
        String message,
        String details,
        Instant timestamp
    ) {}
}
