package com.phillippitts.kioskwatch.domain;

import org.json.JSONObject;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable record of an anomaly found by the classifier.
 *
 * <p>Only the classifier creates these. {@code details} is kind-specific (for example a
 * crash carries {@code crash_trace} and {@code exception_type}) and may hold null values.
 *
 * @param kind      what went wrong
 * @param severity  how urgent it is; drives escalation
 * @param message   one-line human readable description
 * @param details   structured, kind-specific context
 * @param timestamp when the error was detected
 * @param source    which signal produced it
 */
public record DetectedError(
        ErrorKind kind,
        Severity severity,
        String message,
        Map<String, Object> details,
        Instant timestamp,
        ErrorSource source
) {

    public DetectedError {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(timestamp, "timestamp");
        Objects.requireNonNull(source, "source");
        // LinkedHashMap keeps insertion order and tolerates null values (e.g. unknown exception type)
        details = details == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    /**
     * Convenience accessor for a string-valued detail.
     *
     * @param key detail key
     * @return the value's string form, or null if absent
     */
    public String detail(String key) {
        Object value = details.get(key);
        return value == null ? null : value.toString();
    }

    /**
     * JSON form used in remediation outcomes and the persisted report.
     */
    public JSONObject toJson() {
        JSONObject json = new JSONObject();
        json.put("error_type", kind.tag());
        json.put("severity", severity.tag());
        json.put("message", message);
        JSONObject detailJson = new JSONObject();
        details.forEach((k, v) -> detailJson.put(k, v == null ? JSONObject.NULL : JSONObject.wrap(v)));
        json.put("details", detailJson);
        json.put("timestamp", timestamp.toString());
        json.put("source", source.tag());
        return json;
    }
}
