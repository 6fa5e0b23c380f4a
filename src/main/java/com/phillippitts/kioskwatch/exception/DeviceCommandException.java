package com.phillippitts.kioskwatch.exception;

/**
 * Thrown when an adb invocation fails: the binary cannot be started, the command times out
 * or it exits non-zero. The transport layer catches this and reports failure to callers as
 * {@code false} or an empty result.
 */
public class DeviceCommandException extends KioskWatchException {

    private final String deviceId;
    private final boolean timedOut;

    public DeviceCommandException(String message, String deviceId) {
        this(message, deviceId, false, null);
    }

    public DeviceCommandException(String message, String deviceId, boolean timedOut, Throwable cause) {
        super(message + " (device: " + deviceId + ")", cause);
        this.deviceId = deviceId;
        this.timedOut = timedOut;
    }

    public String getDeviceId() {
        return deviceId;
    }

    public boolean isTimedOut() {
        return timedOut;
    }
}
