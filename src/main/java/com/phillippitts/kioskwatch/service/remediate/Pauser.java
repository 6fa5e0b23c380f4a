package com.phillippitts.kioskwatch.service.remediate;

import java.time.Duration;

/**
 * Waits between device actions so the UI can settle. Tests substitute a no-op.
 */
@FunctionalInterface
public interface Pauser {

    /**
     * Pauses the calling thread.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    void pause(Duration duration) throws InterruptedException;

    /** Production pauser backed by {@link Thread#sleep(long)}. */
    static Pauser sleeping() {
        return duration -> Thread.sleep(duration.toMillis());
    }
}
