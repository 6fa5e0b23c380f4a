package com.phillippitts.kioskwatch.exception;

/**
 * Thrown when the monitor cannot start: the initial device connection could not be
 * established or the monitored app is not installed. This is the only fatal condition;
 * everything after startup is recovered locally.
 */
public class MonitorStartupException extends KioskWatchException {

    private final String deviceId;

    public MonitorStartupException(String message, String deviceId) {
        super(message + " (device: " + deviceId + ")");
        this.deviceId = deviceId;
    }

    public MonitorStartupException(String message, String deviceId, Throwable cause) {
        super(message + " (device: " + deviceId + ")", cause);
        this.deviceId = deviceId;
    }

    public String getDeviceId() {
        return deviceId;
    }
}
