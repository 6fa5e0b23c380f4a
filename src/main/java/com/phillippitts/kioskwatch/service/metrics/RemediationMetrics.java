package com.phillippitts.kioskwatch.service.metrics;

import com.phillippitts.kioskwatch.domain.DetectedError;
import com.phillippitts.kioskwatch.domain.RemediationOutcome;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

/**
 * Micrometer instrumentation for detection and remediation.
 *
 * <p>Provides:
 * <ul>
 *   <li>Detected errors per kind and severity</li>
 *   <li>Remediation attempts, outcomes and latency per action</li>
 *   <li>Skipped remediations per reason (cooldown, rate limit, ...)</li>
 * </ul>
 *
 * <p>All metrics are available at /actuator/prometheus.
 */
@Component
public class RemediationMetrics {

    private static final String ERRORS_PREFIX = "kioskwatch.errors";
    private static final String REMEDIATION_PREFIX = "kioskwatch.remediation";

    private final MeterRegistry registry;

    public RemediationMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordDetected(DetectedError error) {
        Counter.builder(ERRORS_PREFIX + ".detected")
                .description("Number of errors detected on the device")
                .tag("kind", error.kind().tag())
                .tag("severity", error.severity().tag())
                .register(registry)
                .increment();
    }

    public void recordAttempt(String action) {
        Counter.builder(REMEDIATION_PREFIX + ".attempts")
                .description("Number of remediation attempts dispatched")
                .tag("action", action)
                .register(registry)
                .increment();
    }

    /**
     * Records the outcome counter and the latency timer for a finished attempt.
     */
    public void recordOutcome(RemediationOutcome outcome) {
        Counter.builder(REMEDIATION_PREFIX + ".outcome")
                .description("Number of remediation attempts by result")
                .tag("action", outcome.action())
                .tag("result", outcome.result().tag())
                .register(registry)
                .increment();
        Timer.builder(REMEDIATION_PREFIX + ".latency")
                .description("Time taken by a remediation script")
                .tag("action", outcome.action())
                .register(registry)
                .record(outcome.duration());
    }

    /**
     * @param reason why nothing was dispatched: {@code disabled}, {@code not_escalated},
     *               {@code rate_limited} or {@code cooldown}
     */
    public void recordSkipped(String reason) {
        Counter.builder(REMEDIATION_PREFIX + ".skipped")
                .description("Number of errors not remediated")
                .tag("reason", reason)
                .register(registry)
                .increment();
    }
}
