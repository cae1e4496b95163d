package com.phillippitts.huevoice.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link DeviceBridgeException} with contextual details.
 *
 * <pre>
 * throw DeviceBridgeExceptionBuilder.create("State update rejected")
 *         .device("Desk lamp")
 *         .operation("PUT /lights/3/state")
 *         .statusCode(503)
 *         .cause(ex)
 *         .build();
 * </pre>
 *
 * <p>The final message format is
 * {@code {message} (device={name}, operation={op}, status={code}, {key}={value}, ...)}.
 */
public final class DeviceBridgeExceptionBuilder {

    private final String message;
    private String deviceName;
    private String operation;
    private Integer statusCode;
    private Throwable cause;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private DeviceBridgeExceptionBuilder(String message) {
        this.message = message;
    }

    public static DeviceBridgeExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new DeviceBridgeExceptionBuilder(message);
    }

    public DeviceBridgeExceptionBuilder device(String deviceName) {
        this.deviceName = deviceName;
        return this;
    }

    public DeviceBridgeExceptionBuilder operation(String operation) {
        this.operation = operation;
        return this;
    }

    public DeviceBridgeExceptionBuilder statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public DeviceBridgeExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Adds a metadata pair to the message. Null keys or values are skipped.
     */
    public DeviceBridgeExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    public DeviceBridgeException build() {
        return new DeviceBridgeException(buildDetailedMessage(), deviceName, cause);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (deviceName != null) {
            details.put("device", deviceName);
        }
        if (operation != null) {
            details.put("operation", operation);
        }
        if (statusCode != null) {
            details.put("status", String.valueOf(statusCode));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
