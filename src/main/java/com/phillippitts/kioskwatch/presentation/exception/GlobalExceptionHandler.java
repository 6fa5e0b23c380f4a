package com.phillippitts.kioskwatch.presentation.exception;

import com.phillippitts.kioskwatch.exception.EmergencyRecoveryDisabledException;
import com.phillippitts.kioskwatch.exception.KioskWatchException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;

import java.time.Instant;

/**
 * Global exception handler for the REST API boundary.
 *
 * Converts domain exceptions to HTTP responses with appropriate status codes.
 */
@ControllerAdvice
class GlobalExceptionHandler {

    private static final Logger LOG = LogManager.getLogger(GlobalExceptionHandler.class);

    /**
     * Feature switched off by configuration (HTTP 409).
     */
    @ExceptionHandler(EmergencyRecoveryDisabledException.class)
    ResponseEntity<ApiError> handleRecoveryDisabled(EmergencyRecoveryDisabledException ex) {
        LOG.info("Rejected emergency recovery request: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.CONFLICT)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Emergency recovery is disabled",
                "Set monitor.enable-emergency-recovery=true to allow it",
                Instant.now()
            ));
    }

    /**
     * Monitor loop busy or shut down (HTTP 503).
     */
    @ExceptionHandler(IllegalStateException.class)
    ResponseEntity<ApiError> handleMonitorUnavailable(IllegalStateException ex) {
        LOG.warn("Monitor unavailable: {}", ex.getMessage());
        return ResponseEntity
            .status(HttpStatus.SERVICE_UNAVAILABLE)
            .body(new ApiError(
                "MonitorUnavailable",
                "Monitor temporarily unavailable",
                "Please retry in a few seconds",
                Instant.now()
            ));
    }

    /**
     * Any other application error (HTTP 500).
     */
    @ExceptionHandler(KioskWatchException.class)
    ResponseEntity<ApiError> handleApplicationError(KioskWatchException ex) {
        LOG.error("Application error", ex);
        return ResponseEntity
            .status(HttpStatus.INTERNAL_SERVER_ERROR)
            .body(new ApiError(
                ex.getClass().getSimpleName(),
                "Monitor operation failed",
                ex.getMessage(),
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
                "See server logs for details",
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
