package com.phillippitts.kioskwatch.util;

import java.time.Duration;
import java.time.Instant;

/**
 * Time conversions used for process timing and sliding-window queries.
 */
public final class TimeUtils {

    public static final long NANOS_PER_MILLI = 1_000_000L;

    private TimeUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Calculates elapsed milliseconds since a {@link System#nanoTime()} timestamp.
     *
     * @param startNanos start time from {@link System#nanoTime()}
     * @return elapsed milliseconds since startNanos
     */
    public static long elapsedMillis(long startNanos) {
        return (System.nanoTime() - startNanos) / NANOS_PER_MILLI;
    }

    /**
     * Returns true when {@code timestamp} lies within {@code window} before {@code now}
     * (inclusive of the cutoff).
     */
    public static boolean within(Instant timestamp, Duration window, Instant now) {
        return !timestamp.isBefore(now.minus(window));
    }
}
