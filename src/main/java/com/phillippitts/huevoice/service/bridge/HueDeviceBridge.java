package com.phillippitts.huevoice.service.bridge;

import com.phillippitts.huevoice.domain.LightHandle;
import com.phillippitts.huevoice.exception.DeviceBridgeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link DeviceBridge} for a Philips Hue bridge. Usable once {@link #attach(BridgeCredentials)} has
 * been called by the {@link BridgeConnector}.
 */
@Component
public class HueDeviceBridge implements DeviceBridge {

    private static final Logger LOG = LogManager.getLogger(HueDeviceBridge.class);

    private final HueBridgeClient client;
    private final AtomicReference<BridgeCredentials> credentials = new AtomicReference<>();

    public HueDeviceBridge(HueBridgeClient client) {
        this.client = Objects.requireNonNull(client, "client");
    }

    public void attach(BridgeCredentials credentials) {
        this.credentials.set(Objects.requireNonNull(credentials, "credentials"));
        LOG.info("Attached to bridge at {}", credentials.bridgeAddress());
    }

    public boolean isAttached() {
        return credentials.get() != null;
    }

    @Override
    public Map<String, LightHandle> listDevices() {
        BridgeCredentials creds = requireCredentials();
        Map<String, LightHandle> lights = new LinkedHashMap<>();
        for (DeviceDetails details : client.fetchLights(creds)) {
            String key = details.name();
            if (lights.containsKey(key)) {
                // Names are user-editable and not unique on the bridge
                key = details.name() + " (" + details.id() + ")";
                LOG.warn("Duplicate light name '{}'; registering light {} as '{}'", details.name(), details.id(), key);
            }
            if (!details.reachable()) {
                LOG.debug("Light {} ({}) reported unreachable", details.id(), details.name());
            }
            lights.put(key, new HueLightHandle(client, creds, details));
        }
        return Collections.unmodifiableMap(lights);
    }

    @Override
    public DeviceDetails getDevice(String id) {
        return client.fetchLight(requireCredentials(), id);
    }

    private BridgeCredentials requireCredentials() {
        BridgeCredentials creds = credentials.get();
        if (creds == null) {
            throw new DeviceBridgeException("Bridge not connected");
        }
        return creds;
    }
}
