package com.phillippitts.kioskwatch.service.detect;

import com.phillippitts.kioskwatch.domain.DetectedError;
import com.phillippitts.kioskwatch.domain.ErrorKind;
import com.phillippitts.kioskwatch.util.TimeUtils;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded, newest-last history of detected errors. Appending past the cap drops the oldest.
 *
 * <p>Not thread-safe; owned by the monitor loop.
 */
public final class ErrorHistory {

    private final int capacity;
    private final Deque<DetectedError> errors = new ArrayDeque<>();

    public ErrorHistory(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void add(DetectedError error) {
        errors.addLast(error);
        while (errors.size() > capacity) {
            errors.removeFirst();
        }
    }

    public int size() {
        return errors.size();
    }

    public int capacity() {
        return capacity;
    }

    /** Oldest-first copy of the history. */
    public List<DetectedError> snapshot() {
        return List.copyOf(errors);
    }

    /** Errors whose timestamp is within {@code window} of {@code now}, oldest first. */
    public List<DetectedError> recent(Duration window, Instant now) {
        return errors.stream()
                .filter(e -> TimeUtils.within(e.timestamp(), window, now))
                .toList();
    }

    long countRecent(ErrorKind kind, Duration window, Instant now) {
        return errors.stream()
                .filter(e -> e.kind() == kind)
                .filter(e -> TimeUtils.within(e.timestamp(), window, now))
                .count();
    }

    /** Keeps only the newest {@code retained} entries. */
    public void trimTo(int retained) {
        while (errors.size() > Math.max(0, retained)) {
            errors.removeFirst();
        }
    }
}
