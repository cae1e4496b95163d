package com.phillippitts.huevoice.service.bridge;

import com.phillippitts.huevoice.domain.ColorPoint;
import com.phillippitts.huevoice.domain.DeviceCapabilities;
import com.phillippitts.huevoice.domain.LightHandle;
import com.phillippitts.huevoice.exception.DeviceBridgeExceptionBuilder;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * {@link LightHandle} backed by the Hue REST API.
 *
 * <p>Reads are served from the state fetched with the handle; each successful write updates it,
 * so a dispatcher working through a chain sees its own changes without refetching.
 */
final class HueLightHandle implements LightHandle {

    private final HueBridgeClient client;
    private final BridgeCredentials credentials;
    private final String id;
    private final String name;
    private final DeviceCapabilities capabilities;

    private volatile boolean on;
    private volatile OptionalInt brightness;
    private volatile Optional<ColorPoint> colorPoint;

    HueLightHandle(HueBridgeClient client, BridgeCredentials credentials, DeviceDetails details) {
        this.client = Objects.requireNonNull(client, "client");
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        this.id = details.id();
        this.name = details.name();
        this.capabilities = details.capabilities();
        this.on = details.on();
        this.brightness = details.brightness();
        this.colorPoint = details.colorPoint();
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public DeviceCapabilities capabilities() {
        return capabilities;
    }

    @Override
    public boolean isOn() {
        return on;
    }

    @Override
    public void setOn(boolean on) {
        client.updateState(credentials, id, name, new JSONObject().put("on", on));
        this.on = on;
    }

    @Override
    public OptionalInt brightness() {
        return brightness;
    }

    @Override
    public void setBrightness(int value) {
        if (!capabilities.supportsBrightness()) {
            throw DeviceBridgeExceptionBuilder.create("Light does not support brightness")
                    .device(name)
                    .build();
        }
        if (value < MIN_BRIGHTNESS || value > MAX_BRIGHTNESS) {
            throw new IllegalArgumentException("Brightness out of range: " + value);
        }
        client.updateState(credentials, id, name, new JSONObject().put("bri", value));
        this.brightness = OptionalInt.of(value);
    }

    @Override
    public Optional<ColorPoint> colorPoint() {
        return colorPoint;
    }

    @Override
    public void setColorPoint(ColorPoint point) {
        if (!capabilities.supportsColor()) {
            throw DeviceBridgeExceptionBuilder.create("Light does not support colour")
                    .device(name)
                    .build();
        }
        JSONArray xy = new JSONArray().put(point.x()).put(point.y());
        client.updateState(credentials, id, name, new JSONObject().put("xy", xy));
        this.colorPoint = Optional.of(point);
    }

    @Override
    public String toString() {
        return "HueLight[" + id + ", " + name + "]";
    }
}
