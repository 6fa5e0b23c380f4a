package com.phillippitts.kioskwatch.domain;

import org.json.JSONObject;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of a single remediation attempt.
 *
 * @param action    action name derived from the error kind ({@code fix_<kind>})
 * @param result    outcome of the attempt
 * @param message   short description
 * @param details   context; always contains the originating error under {@link #ORIGINAL_ERROR}
 * @param timestamp when the attempt started (never before the triggering error)
 * @param duration  how long the attempt took
 */
public record RemediationOutcome(
        String action,
        RemediationResult result,
        String message,
        Map<String, Object> details,
        Instant timestamp,
        Duration duration
) {

    public static final String ORIGINAL_ERROR = "original_error";

    public RemediationOutcome {
        Objects.requireNonNull(action, "action");
        Objects.requireNonNull(result, "result");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(duration, "duration");
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
        if (!(details.get(ORIGINAL_ERROR) instanceof DetectedError)) {
            throw new IllegalArgumentException("details must embed the originating DetectedError");
        }
    }

    /** The error that triggered this attempt. */
    public DetectedError originalError() {
        return (DetectedError) details.get(ORIGINAL_ERROR);
    }

    public boolean isSuccess() {
        return result == RemediationResult.SUCCESS;
    }

    public static String actionFor(ErrorKind kind) {
        return "fix_" + kind.tag();
    }

    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("action_name", action);
        json.put("result", result.tag());
        json.put("message", message);
        JSONObject detailJson = new JSONObject();
        details.forEach((k, v) -> {
            if (v instanceof DetectedError error) {
                detailJson.put(k, error.toJson());
            } else {
                detailJson.put(k, v == null ? JSONObject.NULL : JSONObject.wrap(v));
            }
        });
        json.put("details", detailJson);
        json.put("timestamp", timestamp.toString());
        json.put("duration_ms", duration.toMillis());
        return json;
    }
}
