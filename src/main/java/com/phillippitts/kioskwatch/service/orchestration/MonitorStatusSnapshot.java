package com.phillippitts.kioskwatch.service.orchestration;

import org.json.JSONObject;

/**
 * Point-in-time view returned by {@link MonitorOrchestrator#status()}.
 *
 * @param running        true while the monitor is in the monitoring state
 * @param stats          counter snapshot
 * @param uptimeSeconds  seconds since start, 0 if never started
 * @param recentErrors   errors detected in the last five minutes
 * @param logBufferSize  lines currently held in the rolling log buffer
 */
public record MonitorStatusSnapshot(
        boolean running,
        MonitoringStats.Snapshot stats,
        long uptimeSeconds,
        int recentErrors,
        int logBufferSize
) {

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("running", running);
        json.put("stats", stats.toJson());
        json.put("uptime_seconds", uptimeSeconds);
        json.put("recent_errors", recentErrors);
        json.put("log_buffer_size", logBufferSize);
        return json;
    }
}
