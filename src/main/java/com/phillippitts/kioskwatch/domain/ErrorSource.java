package com.phillippitts.kioskwatch.domain;

/**
 * Signal a {@link DetectedError} was derived from.
 */
public enum ErrorSource {
    LOG("log"),
    MEMORY("memory"),
    UI("ui"),
    APP_STATE("app_state");

    private final String tag;

    ErrorSource(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
