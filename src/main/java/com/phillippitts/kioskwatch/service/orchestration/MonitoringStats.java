package com.phillippitts.kioskwatch.service.orchestration;

import com.phillippitts.kioskwatch.domain.MonitorStatus;
import org.json.JSONObject;

import java.time.Instant;

/**
 * Counters kept by the orchestrator. Not thread-safe: only the monitor loop writes them,
 * everything else reads a {@link Snapshot}.
 */
public final class MonitoringStats {

    private Instant startTime;
    private long errorsDetected;
    private long fixesAttempted;
    private long fixesSuccessful;
    private long fixesFailed;
    private Instant lastErrorTime;
    private Instant lastFixTime;

    void markStarted(Instant now) {
        startTime = now;
    }

    void errorDetected(Instant at) {
        errorsDetected++;
        lastErrorTime = at;
    }

    void fixAttempted(Instant at) {
        fixesAttempted++;
        lastFixTime = at;
    }

    void fixSucceeded() {
        fixesSuccessful++;
    }

    void fixFailed() {
        fixesFailed++;
    }

    Instant startTime() {
        return startTime;
    }

    Snapshot snapshot(MonitorStatus status) {
        return new Snapshot(startTime, errorsDetected, fixesAttempted, fixesSuccessful, fixesFailed,
                lastErrorTime, lastFixTime, status);
    }

    /**
     * Immutable copy of the counters.
     */
    public record Snapshot(
            Instant startTime,
            long errorsDetected,
            long fixesAttempted,
            long fixesSuccessful,
            long fixesFailed,
            Instant lastErrorTime,
            Instant lastFixTime,
            MonitorStatus currentStatus
    ) {

        public JSONObject toJson() {
            JSONObject json = new JSONObject();
            json.put("start_time", instantOrNull(startTime));
            json.put("errors_detected", errorsDetected);
            json.put("fixes_attempted", fixesAttempted);
            json.put("fixes_successful", fixesSuccessful);
            json.put("fixes_failed", fixesFailed);
            json.put("last_error_time", instantOrNull(lastErrorTime));
            json.put("last_fix_time", instantOrNull(lastFixTime));
            json.put("current_status", currentStatus.tag());
            return json;
        }

        private static Object instantOrNull(Instant instant) {
            return instant == null ? JSONObject.NULL : instant.toString();
        }
    }
}
