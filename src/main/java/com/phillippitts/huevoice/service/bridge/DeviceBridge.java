package com.phillippitts.huevoice.service.bridge;

import com.phillippitts.huevoice.domain.LightHandle;

import java.util.Map;

/**
 * Boundary to the light bridge. Implementations throw
 * {@link com.phillippitts.huevoice.exception.DeviceBridgeException} on any I/O or protocol failure.
 */
public interface DeviceBridge {

    /**
     * @return live handles keyed by light name, in bridge order
     */
    Map<String, LightHandle> listDevices();

    /**
     * @param id bridge-assigned light id
     * @return current details of that light
     */
    DeviceDetails getDevice(String id);
}
