package com.phillippitts.kioskwatch.exception;

/**
 * Thrown when emergency recovery is requested but {@code monitor.enable-emergency-recovery}
 * is false.
 */
public class EmergencyRecoveryDisabledException extends KioskWatchException {

    public EmergencyRecoveryDisabledException() {
        super("Emergency recovery is disabled");
    }
}
