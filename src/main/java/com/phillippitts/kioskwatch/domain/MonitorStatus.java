package com.phillippitts.kioskwatch.domain;

/**
 * Lifecycle of the monitor. Transitions only move forward:
 * {@code INITIALIZING -> STARTING -> MONITORING -> STOPPING -> STOPPED}.
 */
public enum MonitorStatus {
    INITIALIZING("initializing"),
    STARTING("starting"),
    MONITORING("monitoring"),
    STOPPING("stopping"),
    STOPPED("stopped");

    private final String tag;

    MonitorStatus(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
