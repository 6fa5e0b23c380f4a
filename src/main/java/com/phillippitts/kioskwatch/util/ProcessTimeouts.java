package com.phillippitts.kioskwatch.util;

import java.time.Duration;

/**
 * Standard timeout values for adb subprocess and reader-thread management.
 *
 * @see com.phillippitts.kioskwatch.service.device.AdbCommandRunner
 * @see com.phillippitts.kioskwatch.service.device.AdbLogStream
 */
public final class ProcessTimeouts {

    /** Time for stream gobblers to flush buffered output after the process exits. */
    public static final Duration GOBBLER_FLUSH_TIMEOUT = Duration.ofMillis(500);

    /** Best-effort join of gobbler and reader threads during cleanup. */
    public static final Duration GOBBLER_CLEANUP_TIMEOUT = Duration.ofMillis(100);

    /** Wait after {@link Process#destroy()} before escalating. */
    public static final Duration GRACEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(500);

    /** Wait after {@link Process#destroyForcibly()}. */
    public static final Duration FORCEFUL_SHUTDOWN_TIMEOUT = Duration.ofMillis(1000);

    /** Max stdout captured from a single adb command; UI dumps are the largest output. */
    public static final int STDOUT_MAX_BYTES = 2 * 1024 * 1024;

    /** Max stderr captured for diagnostics. */
    public static final int STDERR_MAX_BYTES = 16 * 1024;

    /** Max stderr characters included in an exception message. */
    public static final int ERROR_SNIPPET_MAX_CHARS = 400;

    private ProcessTimeouts() {
        // Utility class - prevent instantiation
    }
}
