package com.phillippitts.kioskwatch.service.device;

import java.time.Duration;
import java.util.Optional;

/**
 * Line-oriented device log stream.
 *
 * <p>{@link #poll(Duration)} is safe to call from a thread other than the one filling the
 * stream. {@link #close()} is idempotent and terminates the underlying process.
 */
public interface LogStream extends AutoCloseable {

    /**
     * Waits up to {@code timeout} for the next line.
     *
     * @param timeout maximum wait; {@link Duration#ZERO} does not block
     * @return next line, or empty if none arrived in time
     */
    Optional<String> poll(Duration timeout);

    /** True when the source has ended and every buffered line has been consumed. */
    boolean isFinished();

    @Override
    void close();
}
