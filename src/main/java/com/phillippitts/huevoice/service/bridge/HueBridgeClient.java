package com.phillippitts.huevoice.service.bridge;

import com.phillippitts.huevoice.exception.BridgePairingException;
import com.phillippitts.huevoice.exception.DeviceBridgeExceptionBuilder;
import com.phillippitts.huevoice.domain.ColorPoint;
import com.phillippitts.huevoice.domain.DeviceCapabilities;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Thin client for the Hue bridge REST API (v1).
 *
 * <p>Endpoints used:
 * <ul>
 *   <li>{@code POST /api} - register an application key (needs the link button)</li>
 *   <li>{@code GET /api/{key}/lights} - all lights with state</li>
 *   <li>{@code GET /api/{key}/lights/{id}} - one light</li>
 *   <li>{@code PUT /api/{key}/lights/{id}/state} - change on/bri/xy</li>
 * </ul>
 *
 * <p>The bridge answers errors with HTTP 200 and a JSON array of {@code {"error": {...}}} objects,
 * so every response body is inspected.
 */
@Component
public class HueBridgeClient {

    private static final Logger LOG = LogManager.getLogger(HueBridgeClient.class);

    /** Error type returned when the link button has not been pressed. */
    static final int ERROR_LINK_BUTTON = 101;
    /** Error type returned for an unknown application key. */
    static final int ERROR_UNAUTHORIZED = 1;

    private final RestTemplate restTemplate;

    public HueBridgeClient(@Qualifier("hueRestTemplate") RestTemplate hueRestTemplate) {
        this.restTemplate = Objects.requireNonNull(hueRestTemplate, "hueRestTemplate");
    }

    /**
     * Registers this application with the bridge.
     *
     * @return the issued application key
     * @throws BridgePairingException with {@code linkButtonRequired} set when the button was not pressed
     */
    public String createUser(String address, String deviceType) {
        String url = baseUrl(address);
        JSONObject body = new JSONObject().put("devicetype", deviceType);
        String response;
        try {
            response = restTemplate.postForObject(url, jsonEntity(body), String.class);
        } catch (RestClientException e) {
            throw new BridgePairingException("Bridge unreachable during pairing", address, false, e);
        }
        try {
            JSONObject first = new JSONArray(requireBody(response)).getJSONObject(0);
            if (first.has("success")) {
                return first.getJSONObject("success").getString("username");
            }
            JSONObject error = first.getJSONObject("error");
            int type = error.optInt("type", -1);
            if (type == ERROR_LINK_BUTTON) {
                throw new BridgePairingException("Link button not pressed", address, true, null);
            }
            throw new BridgePairingException(
                    "Pairing refused: " + error.optString("description") + " (type " + type + ")", address);
        } catch (JSONException e) {
            throw new BridgePairingException("Malformed pairing response", address, false, e);
        }
    }

    /**
     * @return false when the bridge rejects the key as unknown
     */
    public boolean isAuthorized(BridgeCredentials credentials) {
        String body = get(lightsUrl(credentials), "GET /lights");
        if (isErrorArray(body)) {
            JSONObject error = new JSONArray(body).getJSONObject(0).getJSONObject("error");
            if (error.optInt("type", -1) == ERROR_UNAUTHORIZED) {
                return false;
            }
            throw DeviceBridgeExceptionBuilder.create("Bridge rejected light listing")
                    .operation("GET /lights")
                    .metadata("bridgeError", error.optString("description"))
                    .build();
        }
        return true;
    }

    /**
     * @return details of every light, ordered by numeric id
     */
    public List<DeviceDetails> fetchLights(BridgeCredentials credentials) {
        String body = get(lightsUrl(credentials), "GET /lights");
        JSONObject lights = parseObject(body, "GET /lights");
        List<DeviceDetails> result = new ArrayList<>();
        for (String id : lights.keySet()) {
            try {
                result.add(parseLight(id, lights.getJSONObject(id)));
            } catch (JSONException | IllegalArgumentException e) {
                throw DeviceBridgeExceptionBuilder.create("Malformed light entry")
                        .operation("GET /lights")
                        .metadata("lightId", id)
                        .cause(e)
                        .build();
            }
        }
        result.sort(Comparator.comparing(DeviceDetails::id, HueBridgeClient::compareIds));
        return result;
    }

    public DeviceDetails fetchLight(BridgeCredentials credentials, String id) {
        String operation = "GET /lights/" + id;
        String body = get(lightsUrl(credentials) + "/" + id, operation);
        try {
            return parseLight(id, parseObject(body, operation));
        } catch (JSONException | IllegalArgumentException e) {
            throw DeviceBridgeExceptionBuilder.create("Malformed light entry")
                    .operation(operation)
                    .cause(e)
                    .build();
        }
    }

    /**
     * Applies a partial state change (any of {@code on}, {@code bri}, {@code xy}).
     */
    public void updateState(BridgeCredentials credentials, String id, String name, JSONObject state) {
        String operation = "PUT /lights/" + id + "/state";
        String body;
        try {
            body = restTemplate.exchange(lightsUrl(credentials) + "/" + id + "/state",
                    HttpMethod.PUT, jsonEntity(state), String.class).getBody();
        } catch (RestClientResponseException e) {
            throw DeviceBridgeExceptionBuilder.create("State update rejected")
                    .device(name)
                    .operation(operation)
                    .statusCode(e.getStatusCode().value())
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw DeviceBridgeExceptionBuilder.create("Bridge unreachable")
                    .device(name)
                    .operation(operation)
                    .cause(e)
                    .build();
        }
        try {
            JSONArray results = new JSONArray(requireBody(body));
            for (int i = 0; i < results.length(); i++) {
                JSONObject result = results.getJSONObject(i);
                if (result.has("error")) {
                    throw DeviceBridgeExceptionBuilder.create("State update rejected")
                            .device(name)
                            .operation(operation)
                            .metadata("bridgeError", result.getJSONObject("error").optString("description"))
                            .build();
                }
            }
        } catch (JSONException e) {
            throw DeviceBridgeExceptionBuilder.create("Malformed state update response")
                    .device(name)
                    .operation(operation)
                    .cause(e)
                    .build();
        }
        LOG.debug("Updated light {} ({}) with {}", id, name, state);
    }

    /**
     * Parses one entry of the {@code /lights} map. Capabilities follow the reported state keys:
     * a light reporting {@code bri} is dimmable, one reporting {@code xy} takes colour.
     */
    static DeviceDetails parseLight(String id, JSONObject light) {
        JSONObject state = light.getJSONObject("state");
        boolean supportsBrightness = state.has("bri");
        boolean supportsColor = state.has("xy");
        OptionalInt brightness = supportsBrightness
                ? OptionalInt.of(state.getInt("bri"))
                : OptionalInt.empty();
        Optional<ColorPoint> color = Optional.empty();
        if (supportsColor) {
            JSONArray xy = state.getJSONArray("xy");
            color = Optional.of(new ColorPoint(xy.getDouble(0), xy.getDouble(1)));
        }
        return new DeviceDetails(
                id,
                light.optString("name", "Light " + id),
                state.optBoolean("on", false),
                brightness,
                color,
                new DeviceCapabilities(supportsColor, supportsBrightness),
                state.optBoolean("reachable", true)
        );
    }

    private String get(String url, String operation) {
        String body;
        try {
            body = restTemplate.getForObject(url, String.class);
        } catch (RestClientResponseException e) {
            throw DeviceBridgeExceptionBuilder.create("Bridge request failed")
                    .operation(operation)
                    .statusCode(e.getStatusCode().value())
                    .cause(e)
                    .build();
        } catch (RestClientException e) {
            throw DeviceBridgeExceptionBuilder.create("Bridge unreachable")
                    .operation(operation)
                    .cause(e)
                    .build();
        }
        if (body == null || body.isBlank()) {
            throw DeviceBridgeExceptionBuilder.create("Empty bridge response")
                    .operation(operation)
                    .build();
        }
        return body;
    }

    private static JSONObject parseObject(String body, String operation) {
        if (isErrorArray(body)) {
            JSONObject error = new JSONArray(body).getJSONObject(0).getJSONObject("error");
            throw DeviceBridgeExceptionBuilder.create("Bridge returned an error")
                    .operation(operation)
                    .metadata("bridgeErrorType", error.optInt("type", -1))
                    .metadata("bridgeError", error.optString("description"))
                    .build();
        }
        try {
            return new JSONObject(body);
        } catch (JSONException e) {
            throw DeviceBridgeExceptionBuilder.create("Malformed bridge response")
                    .operation(operation)
                    .cause(e)
                    .build();
        }
    }

    private static boolean isErrorArray(String body) {
        String trimmed = body.trim();
        if (!trimmed.startsWith("[")) {
            return false;
        }
        try {
            JSONArray array = new JSONArray(trimmed);
            return !array.isEmpty() && array.optJSONObject(0) != null && array.getJSONObject(0).has("error");
        } catch (JSONException e) {
            return false;
        }
    }

    private static String requireBody(String body) {
        if (body == null || body.isBlank()) {
            throw new JSONException("Empty response body");
        }
        return body;
    }

    private static HttpEntity<String> jsonEntity(JSONObject body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body.toString(), headers);
    }

    private static String baseUrl(String address) {
        return "http://" + address + "/api";
    }

    private static String lightsUrl(BridgeCredentials credentials) {
        return baseUrl(credentials.bridgeAddress()) + "/" + credentials.authToken() + "/lights";
    }

    private static int compareIds(String a, String b) {
        if (a.length() != b.length()) {
            return Integer.compare(a.length(), b.length());
        }
        return a.compareTo(b);
    }
}
