package com.phillippitts.kioskwatch.service.remediate;

import com.phillippitts.kioskwatch.domain.DetectedError;

import java.time.Instant;
import java.util.Objects;

/**
 * An admitted remediation attempt: the cooldown has been stamped and the script is ready to
 * run on the device pool.
 *
 * @param error     triggering error
 * @param plan      script to run, never {@link RemediationPlan#NONE}
 * @param startedAt attempt timestamp, never before {@code error.timestamp()}
 */
public record PendingFix(DetectedError error, RemediationPlan plan, Instant startedAt) {

    public PendingFix {
        Objects.requireNonNull(error, "error");
        Objects.requireNonNull(plan, "plan");
        Objects.requireNonNull(startedAt, "startedAt");
    }
}
