package com.phillippitts.kioskwatch.service.detect;

import com.phillippitts.kioskwatch.domain.DetectedError;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a detected error is handed to the remediator.
 *
 * <ul>
 *   <li>critical, high: always</li>
 *   <li>medium: when at least {@value #REPEAT_THRESHOLD} errors of the same kind are in the
 *       history within {@link #REPEAT_WINDOW} (the error itself already recorded)</li>
 *   <li>low: never</li>
 * </ul>
 */
final class EscalationPolicy {

    static final int REPEAT_THRESHOLD = 3;
    static final Duration REPEAT_WINDOW = Duration.ofMinutes(10);

    private EscalationPolicy() {
    }

    static boolean shouldEscalate(DetectedError error, ErrorHistory history, Instant now) {
        return switch (error.severity()) {
            case CRITICAL, HIGH -> true;
            case MEDIUM -> history.countRecent(error.kind(), REPEAT_WINDOW, now) >= REPEAT_THRESHOLD;
            case LOW -> false;
        };
    }
}
