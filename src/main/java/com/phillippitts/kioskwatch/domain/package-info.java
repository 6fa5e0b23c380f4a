/**
 * Immutable domain model of the monitor.
 *
 * <p>Key concepts:
 * <ul>
 *   <li>{@link com.phillippitts.kioskwatch.domain.DetectedError} - a classified anomaly,
 *       tagged with an {@link com.phillippitts.kioskwatch.domain.ErrorKind},
 *       {@link com.phillippitts.kioskwatch.domain.Severity} and
 *       {@link com.phillippitts.kioskwatch.domain.ErrorSource}</li>
 *   <li>{@link com.phillippitts.kioskwatch.domain.RemediationOutcome} - the result of one
 *       corrective attempt, always embedding the error that triggered it</li>
 *   <li>{@link com.phillippitts.kioskwatch.domain.MonitorStatus} - monitor lifecycle</li>
 *   <li>{@link com.phillippitts.kioskwatch.domain.AppState} - inferred screen state of the app</li>
 * </ul>
 *
 * <p>Enums expose a lower-case {@code tag()} which is the form used in logs and in the
 * persisted JSON report.
 *
 * @since 1.0
 */
package com.phillippitts.kioskwatch.domain;
