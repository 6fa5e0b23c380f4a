/**
 * Monitor lifecycle and the three monitoring activities.
 *
 * <p>Key Components:
 * <ul>
 *   <li>{@link com.phillippitts.kioskwatch.service.orchestration.MonitorOrchestrator} -
 *       owns the monitor loop, runs the stream tailer, health loop and maintenance loop,
 *       and gates remediation behind escalation, the hourly rate limit and cooldowns</li>
 *   <li>{@link com.phillippitts.kioskwatch.service.orchestration.MonitorStateMachine} -
 *       forward-only lifecycle status</li>
 *   <li>{@link com.phillippitts.kioskwatch.service.orchestration.StatusReportWriter} -
 *       atomic JSON report persistence</li>
 * </ul>
 *
 * <p>Design Patterns:
 * <ul>
 *   <li><b>Single writer:</b> all mutable monitoring state lives on one scheduler thread</li>
 *   <li><b>Bulkhead:</b> blocking device calls run on the bounded {@code deviceExecutor}</li>
 * </ul>
 *
 * @see com.phillippitts.kioskwatch.service.detect
 * @see com.phillippitts.kioskwatch.service.remediate
 */
package com.phillippitts.kioskwatch.service.orchestration;
