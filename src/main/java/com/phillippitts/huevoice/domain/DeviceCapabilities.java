package com.phillippitts.huevoice.domain;

/**
 * What a light reports it can do. Callers consult this instead of probing the device.
 */
public record DeviceCapabilities(boolean supportsColor, boolean supportsBrightness) {

    public static final DeviceCapabilities ON_OFF = new DeviceCapabilities(false, false);
    public static final DeviceCapabilities DIMMABLE = new DeviceCapabilities(false, true);
    public static final DeviceCapabilities COLOR = new DeviceCapabilities(true, true);
}
