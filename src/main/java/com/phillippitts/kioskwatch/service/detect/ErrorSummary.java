package com.phillippitts.kioskwatch.service.detect;

import org.json.JSONObject;

import java.util.Map;

/**
 * Error counts for the status report. {@code errorTypes} and {@code severityCounts} cover the
 * last hour; every severity is present, zero-filled.
 */
public record ErrorSummary(
        int totalErrors,
        int recentErrors,
        Map<String, Integer> errorTypes,
        Map<String, Integer> severityCounts
) {

    public ErrorSummary {
        errorTypes = Map.copyOf(errorTypes);
        severityCounts = Map.copyOf(severityCounts);
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("total_errors", totalErrors);
        json.put("recent_errors", recentErrors);
        json.put("error_types", new JSONObject(errorTypes));
        json.put("severity_counts", new JSONObject(severityCounts));
        return json;
    }
}
