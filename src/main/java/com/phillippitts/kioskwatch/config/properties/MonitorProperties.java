package com.phillippitts.kioskwatch.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Top-level monitor configuration (prefix {@code monitor}).
 *
 * <p>Every key has a default here; unknown keys in {@code application.properties} are ignored.
 */
@ConfigurationProperties(prefix = "monitor")
@Validated
public class MonitorProperties {

    /** Start monitoring automatically when the application context starts. */
    private boolean autoStart = true;

    /** Delay between the end of one health check and the start of the next. */
    @NotNull
    private Duration healthCheckInterval = Duration.ofSeconds(30);

    /** Interval between maintenance runs (cache trim, report, history trim). */
    @NotNull
    private Duration maintenanceInterval = Duration.ofSeconds(3600);

    /** Rolling buffer of raw log lines. */
    @Positive(message = "Log buffer size must be positive")
    private int logBufferSize = 1000;

    /** Hard cap of the detected-error history. */
    @Positive(message = "Error history size must be positive")
    private int errorHistorySize = 1000;

    /** Size the error history is trimmed to during maintenance. */
    @Positive(message = "Error history retained size must be positive")
    private int errorHistoryRetained = 500;

    /** Cap of the remediation outcome history. */
    @Positive(message = "Remediation history size must be positive")
    private int remediationHistorySize = 200;

    /** Global ceiling on remediation attempts in the trailing hour. */
    @Positive(message = "Max fix attempts per hour must be positive")
    private int maxFixAttemptsPerHour = 10;

    private boolean enableAutoFix = true;

    /** Allows the explicit emergency recovery endpoint. */
    private boolean enableEmergencyRecovery = true;

    @NotBlank
    private String reportFile = "monitor_report.json";

    /** How long a tailer poll waits for the next log line before yielding. */
    @NotNull
    private Duration logPollTimeout = Duration.ofMillis(100);

    /** Delay before reopening the log stream after it ended. */
    @NotNull
    private Duration logReopenDelay = Duration.ofSeconds(5);

    /** Upper bound on waiting for the final report and disconnect during stop. */
    @NotNull
    private Duration shutdownTimeout = Duration.ofSeconds(15);

    public boolean isAutoStart() {
        return autoStart;
    }

    public void setAutoStart(boolean autoStart) {
        this.autoStart = autoStart;
    }

    public Duration getHealthCheckInterval() {
        return healthCheckInterval;
    }

    public void setHealthCheckInterval(Duration healthCheckInterval) {
        this.healthCheckInterval = healthCheckInterval;
    }

    public Duration getMaintenanceInterval() {
        return maintenanceInterval;
    }

    public void setMaintenanceInterval(Duration maintenanceInterval) {
        this.maintenanceInterval = maintenanceInterval;
    }

    public int getLogBufferSize() {
        return logBufferSize;
    }

    public void setLogBufferSize(int logBufferSize) {
        this.logBufferSize = logBufferSize;
    }

    public int getErrorHistorySize() {
        return errorHistorySize;
    }

    public void setErrorHistorySize(int errorHistorySize) {
        this.errorHistorySize = errorHistorySize;
    }

    public int getErrorHistoryRetained() {
        return errorHistoryRetained;
    }

    public void setErrorHistoryRetained(int errorHistoryRetained) {
        this.errorHistoryRetained = errorHistoryRetained;
    }

    public int getRemediationHistorySize() {
        return remediationHistorySize;
    }

    public void setRemediationHistorySize(int remediationHistorySize) {
        this.remediationHistorySize = remediationHistorySize;
    }

    public int getMaxFixAttemptsPerHour() {
        return maxFixAttemptsPerHour;
    }

    public void setMaxFixAttemptsPerHour(int maxFixAttemptsPerHour) {
        this.maxFixAttemptsPerHour = maxFixAttemptsPerHour;
    }

    public boolean isEnableAutoFix() {
        return enableAutoFix;
    }

    public void setEnableAutoFix(boolean enableAutoFix) {
        this.enableAutoFix = enableAutoFix;
    }

    public boolean isEnableEmergencyRecovery() {
        return enableEmergencyRecovery;
    }

    public void setEnableEmergencyRecovery(boolean enableEmergencyRecovery) {
        this.enableEmergencyRecovery = enableEmergencyRecovery;
    }

    public String getReportFile() {
        return reportFile;
    }

    public void setReportFile(String reportFile) {
        this.reportFile = reportFile;
    }

    public Duration getLogPollTimeout() {
        return logPollTimeout;
    }

    public void setLogPollTimeout(Duration logPollTimeout) {
        this.logPollTimeout = logPollTimeout;
    }

    public Duration getLogReopenDelay() {
        return logReopenDelay;
    }

    public void setLogReopenDelay(Duration logReopenDelay) {
        this.logReopenDelay = logReopenDelay;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }
}
