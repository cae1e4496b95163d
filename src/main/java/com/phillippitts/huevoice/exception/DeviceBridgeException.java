package com.phillippitts.huevoice.exception;

/**
 * Thrown when the device bridge cannot list, read or mutate a light.
 * Prefer {@link DeviceBridgeExceptionBuilder} for messages carrying request context.
 */
public class DeviceBridgeException extends HueVoiceException {

    private final String deviceName;

    public DeviceBridgeException(String message) {
        super(message);
        this.deviceName = null;
    }

    public DeviceBridgeException(String message, Throwable cause) {
        super(message, cause);
        this.deviceName = null;
    }

    public DeviceBridgeException(String message, String deviceName, Throwable cause) {
        super(message, cause);
        this.deviceName = deviceName;
    }

    /** @return affected device name, or null when the failure was not device specific */
    public String getDeviceName() {
        return deviceName;
    }
}
