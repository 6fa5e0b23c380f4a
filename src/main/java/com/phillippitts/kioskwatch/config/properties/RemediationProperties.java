package com.phillippitts.kioskwatch.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Remediation tuning (prefix {@code monitor.remediation}).
 */
@ConfigurationProperties(prefix = "monitor.remediation")
@Validated
public class RemediationProperties {

    /** Minimum time between two attempts for the same error kind. */
    @NotNull
    private Duration cooldown = Duration.ofSeconds(60);

    /** {@code pm trim-caches} budget used when restarting for memory pressure. */
    @NotBlank
    private String memoryTrimBudget = "1000M";

    /** {@code pm trim-caches} budget used by emergency recovery. */
    @NotBlank
    private String emergencyTrimBudget = "500M";

    /** {@code pm trim-caches} budget used by scheduled maintenance. */
    @NotBlank
    private String maintenanceTrimBudget = "200M";

    public Duration getCooldown() {
        return cooldown;
    }

    public void setCooldown(Duration cooldown) {
        this.cooldown = cooldown;
    }

    public String getMemoryTrimBudget() {
        return memoryTrimBudget;
    }

    public void setMemoryTrimBudget(String memoryTrimBudget) {
        this.memoryTrimBudget = memoryTrimBudget;
    }

    public String getEmergencyTrimBudget() {
        return emergencyTrimBudget;
    }

    public void setEmergencyTrimBudget(String emergencyTrimBudget) {
        this.emergencyTrimBudget = emergencyTrimBudget;
    }

    public String getMaintenanceTrimBudget() {
        return maintenanceTrimBudget;
    }

    public void setMaintenanceTrimBudget(String maintenanceTrimBudget) {
        this.maintenanceTrimBudget = maintenanceTrimBudget;
    }
}
