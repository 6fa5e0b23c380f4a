package com.phillippitts.kioskwatch.exception;

/**
 * Base exception for all KioskWatch application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class KioskWatchException extends RuntimeException {

    public KioskWatchException(String message) {
        super(message);
    }

    public KioskWatchException(String message, Throwable cause) {
        super(message, cause);
    }

    public KioskWatchException(Throwable cause) {
        super(cause);
    }
}
