package com.phillippitts.kioskwatch.config.properties;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * UI-dump checks (prefix {@code monitor.ui}).
 *
 * <p>State keys are app-state tags: {@code settings}, {@code loading}, {@code error_welcome},
 * {@code browsing}, {@code unknown}. Keys containing {@code _} must be bracketed in
 * properties files, otherwise relaxed binding drops the underscore:
 * <pre>
 * monitor.ui.expected-elements-by-state[error_welcome]=errorPanel
 * </pre>
 */
@ConfigurationProperties(prefix = "monitor.ui")
@Validated
public class UiMonitoringProperties {

    /** When false, always expect the three core elements regardless of state. */
    private boolean stateAwareChecking = true;

    /** When true, {@code browsing} always expects the three core elements. */
    private boolean strictElementChecking = false;

    /** Expected element ids per app state; states not listed expect nothing. */
    private Map<String, List<String>> expectedElementsByState = new LinkedHashMap<>();

    /** States in which the missing-element check is skipped entirely. */
    private List<String> ignoreMissingElementsInStates = new ArrayList<>();

    private FocusMonitoring focusMonitoring = new FocusMonitoring();

    public boolean isStateAwareChecking() {
        return stateAwareChecking;
    }

    public void setStateAwareChecking(boolean stateAwareChecking) {
        this.stateAwareChecking = stateAwareChecking;
    }

    public boolean isStrictElementChecking() {
        return strictElementChecking;
    }

    public void setStrictElementChecking(boolean strictElementChecking) {
        this.strictElementChecking = strictElementChecking;
    }

    public Map<String, List<String>> getExpectedElementsByState() {
        return expectedElementsByState;
    }

    public void setExpectedElementsByState(Map<String, List<String>> expectedElementsByState) {
        this.expectedElementsByState = expectedElementsByState;
    }

    public List<String> getIgnoreMissingElementsInStates() {
        return ignoreMissingElementsInStates;
    }

    public void setIgnoreMissingElementsInStates(List<String> ignoreMissingElementsInStates) {
        this.ignoreMissingElementsInStates = ignoreMissingElementsInStates;
    }

    public FocusMonitoring getFocusMonitoring() {
        return focusMonitoring;
    }

    public void setFocusMonitoring(FocusMonitoring focusMonitoring) {
        this.focusMonitoring = focusMonitoring;
    }

    /**
     * Focused-element check configuration.
     */
    public static class FocusMonitoring {
        private boolean enabled = true;
        private List<String> ignoreInStates = new ArrayList<>();

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getIgnoreInStates() {
            return ignoreInStates;
        }

        public void setIgnoreInStates(List<String> ignoreInStates) {
            this.ignoreInStates = ignoreInStates;
        }
    }
}
