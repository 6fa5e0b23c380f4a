package com.phillippitts.kioskwatch.service.orchestration;

import com.phillippitts.kioskwatch.domain.MonitorStatus;

import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe holder for the monitor lifecycle status.
 *
 * <p><b>State Transitions:</b>
 * <pre>
 * INITIALIZING → STARTING → MONITORING → STOPPING → STOPPED
 * </pre>
 * Steps may be skipped (for example {@code STARTING → STOPPING} when startup fails) but the
 * status never moves backwards.
 */
public final class MonitorStateMachine {

    private final Lock lock = new ReentrantLock();
    private MonitorStatus status = MonitorStatus.INITIALIZING;

    /**
     * Moves to {@code target} if it lies ahead of the current status.
     *
     * @return {@code true} if the transition happened
     */
    public boolean advanceTo(MonitorStatus target) {
        if (target == null) {
            throw new NullPointerException("target cannot be null");
        }
        lock.lock();
        try {
            if (target.ordinal() <= status.ordinal()) {
                return false;
            }
            status = target;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Moves {@code expected → target} only if the current status is exactly {@code expected}.
     */
    public boolean transition(MonitorStatus expected, MonitorStatus target) {
        lock.lock();
        try {
            if (status != expected || target.ordinal() <= status.ordinal()) {
                return false;
            }
            status = target;
            return true;
        } finally {
            lock.unlock();
        }
    }

    public MonitorStatus current() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public boolean is(MonitorStatus expected) {
        return current() == expected;
    }

    /** {@code true} once shutdown has begun or finished. */
    public boolean isShuttingDown() {
        return current().ordinal() >= MonitorStatus.STOPPING.ordinal();
    }
}
