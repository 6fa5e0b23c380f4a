package com.phillippitts.kioskwatch.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Closed vocabulary of error kinds the classifier can emit.
 *
 * <p>Each kind carries a stable snake_case tag used in log lines, remediation action names
 * ({@code fix_<tag>}) and the persisted status report.
 */
public enum ErrorKind {
    APP_CRASH("app_crash"),
    ANR("anr"),
    OUT_OF_MEMORY("out_of_memory"),
    NETWORK_ERROR("network_error"),
    WEBVIEW_ERROR("webview_error"),
    PROFILE_ERROR("profile_error"),
    PREFERENCES_ERROR("preferences_error"),
    FOCUS_ERROR("focus_error"),
    LIFECYCLE_ERROR("lifecycle_error"),
    PERMISSION_ERROR("permission_error"),
    RESOURCE_ERROR("resource_error"),
    APP_NOT_RUNNING("app_not_running"),
    HIGH_MEMORY_USAGE("high_memory_usage"),
    POTENTIAL_MEMORY_LEAK("potential_memory_leak"),
    MISSING_UI_ELEMENT("missing_ui_element"),
    NO_FOCUSED_ELEMENT("no_focused_element"),
    UNEXPECTED_ACTIVITY("unexpected_activity");

    private final String tag;

    ErrorKind(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    /**
     * Human-readable title, e.g. {@code "App Crash"} for {@code app_crash}.
     *
     * @return title-cased tag with underscores replaced by spaces
     */
    public String title() {
        StringBuilder sb = new StringBuilder(tag.length());
        for (String word : tag.split("_")) {
            if (word.isEmpty()) {
                continue;
            }
            if (!sb.isEmpty()) {
                sb.append(' ');
            }
            sb.append(word.substring(0, 1).toUpperCase(Locale.ROOT)).append(word.substring(1));
        }
        return sb.toString();
    }

    /**
     * Resolves a kind from its tag.
     *
     * @param tag snake_case tag (case-insensitive)
     * @return matching kind, or empty if the tag is unknown
     */
    public static Optional<ErrorKind> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(k -> k.tag.equalsIgnoreCase(tag.trim()))
                .findFirst();
    }
}
