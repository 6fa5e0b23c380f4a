/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.kioskwatch.exception.KioskWatchException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.kioskwatch.exception.DeviceCommandException} - Thrown inside
 *       the adb transport when a command cannot run, times out or exits non-zero</li>
 *   <li>{@link com.phillippitts.kioskwatch.exception.MonitorStartupException} - Thrown when
 *       the monitor cannot reach the device at startup</li>
 *   <li>{@link com.phillippitts.kioskwatch.exception.EmergencyRecoveryDisabledException} -
 *       Thrown when emergency recovery is requested while switched off</li>
 * </ul>
 *
 * <p>All exceptions are unchecked, support chaining via {@code cause}, and are mapped to
 * HTTP responses by {@code GlobalExceptionHandler} when they reach the REST boundary.
 *
 * @see com.phillippitts.kioskwatch.presentation.exception.GlobalExceptionHandler
 * @since 1.0
 */
package com.phillippitts.kioskwatch.exception;
