package com.phillippitts.kioskwatch.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link DeviceCommandException} with process diagnostics.
 *
 * <p><b>Usage:</b>
 * <pre>
 * throw DeviceCommandExceptionBuilder.create("Non-zero exit: 1")
 *         .device("192.168.4.94:5555")
 *         .exitCode(1)
 *         .durationMs(420)
 *         .metadata("command", "shell am force-stop com.webviewer.firetv")
 *         .metadata("stderr", stderrSnippet)
 *         .build();
 * </pre>
 */
public final class DeviceCommandExceptionBuilder {

    private final String message;
    private String deviceId;
    private Throwable cause;
    private Integer exitCode;
    private Long durationMs;
    private boolean timedOut;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private DeviceCommandExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null or empty)
     * @return new builder instance
     */
    public static DeviceCommandExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new DeviceCommandExceptionBuilder(message);
    }

    public DeviceCommandExceptionBuilder device(String deviceId) {
        this.deviceId = deviceId;
        return this;
    }

    public DeviceCommandExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public DeviceCommandExceptionBuilder exitCode(int exitCode) {
        this.exitCode = exitCode;
        return this;
    }

    public DeviceCommandExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /** Marks the failure as a timeout (the process was killed by us). */
    public DeviceCommandExceptionBuilder timedOut() {
        this.timedOut = true;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * @param key metadata key
     * @param value metadata value
     * @return this builder for chaining
     */
    public DeviceCommandExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (exitCode={code}, durationMs={ms}, {key1}={val1}, ...) (device: {device})
     * </pre>
     *
     * @return constructed DeviceCommandException
     */
    public DeviceCommandException build() {
        String device = deviceId != null ? deviceId : "unknown";
        return new DeviceCommandException(buildDetailedMessage(), device, timedOut, cause);
    }

    private String buildDetailedMessage() {
        boolean hasDetails = exitCode != null || durationMs != null || !metadata.isEmpty();
        if (!hasDetails) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (exitCode != null) {
            sb.append("exitCode=").append(exitCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
