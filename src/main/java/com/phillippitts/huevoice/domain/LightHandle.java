package com.phillippitts.huevoice.domain;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * Live handle to one controllable light. Setters write through to the bridge and may throw
 * {@link com.phillippitts.huevoice.exception.DeviceBridgeException}.
 */
public interface LightHandle {

    int MIN_BRIGHTNESS = 1;
    int MAX_BRIGHTNESS = 254;

    String id();

    String name();

    DeviceCapabilities capabilities();

    boolean isOn();

    void setOn(boolean on);

    /** @return current brightness, empty when the light does not report one */
    OptionalInt brightness();

    /**
     * @param brightness value in [{@value #MIN_BRIGHTNESS}, {@value #MAX_BRIGHTNESS}]
     */
    void setBrightness(int brightness);

    /** @return current colour, empty for lights without colour capability */
    Optional<ColorPoint> colorPoint();

    void setColorPoint(ColorPoint colorPoint);

    static int clampBrightness(int value) {
        return Math.max(MIN_BRIGHTNESS, Math.min(MAX_BRIGHTNESS, value));
    }
}
