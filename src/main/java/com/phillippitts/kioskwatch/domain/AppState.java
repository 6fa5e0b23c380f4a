package com.phillippitts.kioskwatch.domain;

import java.util.Arrays;
import java.util.Optional;

/**
 * Coarse screen state of the monitored app, inferred from a UI-hierarchy dump.
 */
public enum AppState {
    SETTINGS("settings"),
    LOADING("loading"),
    ERROR_WELCOME("error_welcome"),
    BROWSING("browsing"),
    UNKNOWN("unknown");

    private final String tag;

    AppState(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }

    public static Optional<AppState> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(s -> s.tag.equalsIgnoreCase(tag.trim()))
                .findFirst();
    }
}
