package com.phillippitts.kioskwatch.service.remediate;

import org.json.JSONObject;

import java.util.Map;

/**
 * Aggregate view of the remediation history.
 *
 * @param totalFixes  outcomes in the retained history
 * @param successRate successful outcomes as a percentage of all outcomes (0 when empty)
 * @param fixTypes    per action: total attempts and successful attempts
 * @param recentFixes outcomes in the last hour
 */
public record RemediationStatistics(
        int totalFixes,
        double successRate,
        Map<String, ActionCounts> fixTypes,
        int recentFixes
) {

    public RemediationStatistics {
        fixTypes = Map.copyOf(fixTypes);
    }

    public record ActionCounts(int total, int successful) {
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("total_fixes", totalFixes);
        json.put("success_rate", successRate);
        JSONObject types = new JSONObject();
        fixTypes.forEach((action, counts) -> types.put(action, new JSONObject()
                .put("total", counts.total())
                .put("successful", counts.successful())));
        json.put("fix_types", types);
        json.put("recent_fixes", recentFixes);
        return json;
    }
}
