package com.phillippitts.kioskwatch.domain;

/**
 * Result of one remediation attempt.
 *
 * <p>{@code PARTIAL} means corrective input was sent but nothing confirmed the problem is gone.
 */
public enum RemediationResult {
    SUCCESS("success"),
    FAILED("failed"),
    PARTIAL("partial"),
    SKIPPED("skipped");

    private final String tag;

    RemediationResult(String tag) {
        this.tag = tag;
    }

    public String tag() {
        return tag;
    }
}
