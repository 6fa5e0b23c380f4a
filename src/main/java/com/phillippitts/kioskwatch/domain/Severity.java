package com.phillippitts.kioskwatch.domain;

/**
 * Severity of a {@link DetectedError}, ordered from least to most urgent.
 */
public enum Severity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String tag;

    Severity(String tag) {
        this.tag = tag;
    }

    /** Lower-case tag used in logs and the persisted report. */
    public String tag() {
        return tag;
    }
}
