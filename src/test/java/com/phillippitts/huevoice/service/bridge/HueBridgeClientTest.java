package com.phillippitts.huevoice.service.bridge;

import com.phillippitts.huevoice.domain.ColorPoint;
import com.phillippitts.huevoice.exception.BridgePairingException;
import com.phillippitts.huevoice.exception.DeviceBridgeException;
import org.json.JSONObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class HueBridgeClientTest {

    private static final BridgeCredentials CREDS = new BridgeCredentials("10.0.0.2", "tok");
    private static final String LIGHTS_URL = "http://10.0.0.2/api/tok/lights";

    private MockRestServiceServer server;
    private HueBridgeClient client;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new HueBridgeClient(restTemplate);
    }

    @Test
    void shouldReturnUsernameWhenPairingSucceeds() {
        server.expect(requestTo("http://10.0.0.2/api"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(content().json("{\"devicetype\":\"app#test\"}"))
                .andRespond(withSuccess("[{\"success\":{\"username\":\"abc123\"}}]", MediaType.APPLICATION_JSON));

        assertThat(client.createUser("10.0.0.2", "app#test")).isEqualTo("abc123");
        server.verify();
    }

    @Test
    void shouldFlagLinkButtonError() {
        server.expect(requestTo("http://10.0.0.2/api"))
                .andRespond(withSuccess("[{\"error\":{\"type\":101,\"address\":\"\","
                        + "\"description\":\"link button not pressed\"}}]", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.createUser("10.0.0.2", "app#test"))
                .isInstanceOfSatisfying(BridgePairingException.class, e -> {
                    assertThat(e.isLinkButtonRequired()).isTrue();
                    assertThat(e.getBridgeAddress()).isEqualTo("10.0.0.2");
                });
    }

    @Test
    void shouldNotFlagOtherPairingErrors() {
        server.expect(requestTo("http://10.0.0.2/api"))
                .andRespond(withSuccess("[{\"error\":{\"type\":7,\"description\":\"invalid value\"}}]",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.createUser("10.0.0.2", "app#test"))
                .isInstanceOfSatisfying(BridgePairingException.class,
                        e -> assertThat(e.isLinkButtonRequired()).isFalse())
                .hasMessageContaining("invalid value");
    }

    @Test
    void shouldListLightsInNumericIdOrderWithCapabilities() {
        // Arrange
        String body = "{"
                + "\"10\":{\"name\":\"Porch\",\"state\":{\"on\":false,\"reachable\":true}},"
                + "\"2\":{\"name\":\"Desk\",\"state\":{\"on\":true,\"bri\":200,\"reachable\":true}},"
                + "\"1\":{\"name\":\"Lamp\",\"state\":{\"on\":true,\"bri\":80,\"xy\":[0.45,0.41],\"reachable\":false}}"
                + "}";
        server.expect(requestTo(LIGHTS_URL))
                .andExpect(method(HttpMethod.GET))
                .andRespond(withSuccess(body, MediaType.APPLICATION_JSON));

        // Act
        List<DeviceDetails> lights = client.fetchLights(CREDS);

        // Assert
        assertThat(lights).extracting(DeviceDetails::id).containsExactly("1", "2", "10");
        DeviceDetails lamp = lights.get(0);
        assertThat(lamp.capabilities().supportsColor()).isTrue();
        assertThat(lamp.colorPoint()).contains(new ColorPoint(0.45, 0.41));
        assertThat(lamp.reachable()).isFalse();
        DeviceDetails desk = lights.get(1);
        assertThat(desk.capabilities().supportsBrightness()).isTrue();
        assertThat(desk.capabilities().supportsColor()).isFalse();
        assertThat(desk.brightness()).hasValue(200);
        DeviceDetails porch = lights.get(2);
        assertThat(porch.capabilities().supportsBrightness()).isFalse();
        assertThat(porch.brightness()).isEmpty();
        assertThat(porch.on()).isFalse();
    }

    @Test
    void shouldReportUnauthorizedKey() {
        server.expect(requestTo(LIGHTS_URL))
                .andRespond(withSuccess("[{\"error\":{\"type\":1,\"description\":\"unauthorized user\"}}]",
                        MediaType.APPLICATION_JSON));

        assertThat(client.isAuthorized(CREDS)).isFalse();
    }

    @Test
    void shouldAcceptKeyWhenLightsAreReturned() {
        server.expect(requestTo(LIGHTS_URL)).andRespond(withSuccess("{}", MediaType.APPLICATION_JSON));

        assertThat(client.isAuthorized(CREDS)).isTrue();
    }

    @Test
    void shouldWrapHttpFailures() {
        server.expect(requestTo(LIGHTS_URL)).andRespond(withServerError());

        assertThatThrownBy(() -> client.fetchLights(CREDS))
                .isInstanceOf(DeviceBridgeException.class)
                .hasMessageContaining("status=500");
    }

    @Test
    void shouldPutPartialState() {
        server.expect(requestTo(LIGHTS_URL + "/3/state"))
                .andExpect(method(HttpMethod.PUT))
                .andExpect(content().json("{\"bri\":127}"))
                .andRespond(withSuccess("[{\"success\":{\"/lights/3/state/bri\":127}}]",
                        MediaType.APPLICATION_JSON));

        client.updateState(CREDS, "3", "Desk", new JSONObject().put("bri", 127));

        server.verify();
    }

    @Test
    void shouldRaiseBridgeErrorFromStateUpdate() {
        server.expect(requestTo(LIGHTS_URL + "/3/state"))
                .andRespond(withSuccess("[{\"error\":{\"type\":201,"
                        + "\"description\":\"parameter, bri, is not modifiable. Device is set to off.\"}}]",
                        MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.updateState(CREDS, "3", "Desk", new JSONObject().put("bri", 127)))
                .isInstanceOfSatisfying(DeviceBridgeException.class,
                        e -> assertThat(e.getDeviceName()).isEqualTo("Desk"))
                .hasMessageContaining("not modifiable");
    }

    @Test
    void shouldReportRejectedStateUpdateStatus() {
        server.expect(requestTo(LIGHTS_URL + "/3/state")).andRespond(withStatus(HttpStatus.NOT_FOUND));

        assertThatThrownBy(() -> client.updateState(CREDS, "3", "Desk", new JSONObject().put("on", true)))
                .isInstanceOf(DeviceBridgeException.class)
                .hasMessageContaining("status=404");
    }

    @Test
    void shouldDefaultNameWhenMissing() {
        DeviceDetails details = HueBridgeClient.parseLight("4", new JSONObject("{\"state\":{\"on\":true}}"));

        assertThat(details.name()).isEqualTo("Light 4");
        assertThat(details.reachable()).isTrue();
    }
}
