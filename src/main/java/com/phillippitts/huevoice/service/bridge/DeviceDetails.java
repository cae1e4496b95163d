package com.phillippitts.huevoice.service.bridge;

import com.phillippitts.huevoice.domain.ColorPoint;
import com.phillippitts.huevoice.domain.DeviceCapabilities;

import java.util.Optional;
import java.util.OptionalInt;

/**
 * State and capabilities of one light as reported by the bridge.
 */
public record DeviceDetails(
        String id,
        String name,
        boolean on,
        OptionalInt brightness,
        Optional<ColorPoint> colorPoint,
        DeviceCapabilities capabilities,
        boolean reachable
) {
}
