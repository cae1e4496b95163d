package com.phillippitts.huevoice.domain;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Point-in-time state of one light, used for undo.
 *
 * <p>Brightness and colour are captured only when the light supports them and reports a value;
 * absent fields stay empty and are never replaced with defaults.
 */
public record LightSnapshot(boolean on, OptionalInt brightness, Optional<ColorPoint> colorPoint) {

    public LightSnapshot {
        Objects.requireNonNull(brightness, "brightness must not be null");
        Objects.requireNonNull(colorPoint, "colorPoint must not be null");
    }

    public static LightSnapshot of(LightHandle light) {
        DeviceCapabilities caps = light.capabilities();
        OptionalInt brightness = caps.supportsBrightness() ? light.brightness() : OptionalInt.empty();
        Optional<ColorPoint> color = caps.supportsColor() ? light.colorPoint() : Optional.empty();
        return new LightSnapshot(light.isOn(), brightness, color);
    }

    /**
     * Writes this snapshot back to the light. A light that should end up off gets its
     * brightness and colour first, so the restore does not flash it on.
     */
    public void restoreTo(LightHandle light) {
        if (on) {
            light.setOn(true);
            applyLevels(light);
        } else {
            if (light.isOn()) {
                applyLevels(light);
            }
            light.setOn(false);
        }
    }

    private void applyLevels(LightHandle light) {
        if (brightness.isPresent() && light.capabilities().supportsBrightness()) {
            light.setBrightness(brightness.getAsInt());
        }
        if (colorPoint.isPresent() && light.capabilities().supportsColor()) {
            light.setColorPoint(colorPoint.get());
        }
    }
}
