package com.phillippitts.huevoice.exception;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void shouldRootEveryDomainExceptionInHueVoiceException() {
        assertThat(new RecognitionException("x", RecognitionException.Reason.UNAVAILABLE))
                .isInstanceOf(HueVoiceException.class);
        assertThat(new DeviceBridgeException("x")).isInstanceOf(HueVoiceException.class);
        assertThat(new WakeWordUnavailableException(List.of("philips"), null)).isInstanceOf(HueVoiceException.class);
        assertThat(new BridgePairingException("x", "10.0.0.2")).isInstanceOf(HueVoiceException.class);
        assertThat(new MicrophoneUnavailableException("x")).isInstanceOf(HueVoiceException.class);
        assertThat(new CommandRejectedException("x")).isInstanceOf(RuntimeException.class);
    }

    @Test
    void shouldClassifyRecognitionFailures() {
        assertThat(new RecognitionException("x", RecognitionException.Reason.NOT_UNDERSTOOD).isServiceFailure())
                .isFalse();
        assertThat(new RecognitionException("x", RecognitionException.Reason.MALFORMED_RESPONSE).isServiceFailure())
                .isTrue();
    }

    @Test
    void shouldListAttemptedWakeWords() {
        WakeWordUnavailableException e = new WakeWordUnavailableException(List.of("philips", "computer"), null);

        assertThat(e.getAttemptedKeywords()).containsExactly("philips", "computer");
        assertThat(e.getMessage()).contains("philips", "computer");
    }

    @Test
    void shouldBuildDetailedBridgeMessage() {
        // Arrange
        IllegalStateException cause = new IllegalStateException("socket closed");

        // Act
        DeviceBridgeException e = DeviceBridgeExceptionBuilder.create("State update rejected")
                .device("Desk")
                .operation("PUT /lights/3/state")
                .statusCode(503)
                .metadata("bridgeError", "device is unreachable")
                .metadata("ignored", null)
                .cause(cause)
                .build();

        // Assert
        assertThat(e.getMessage()).isEqualTo("State update rejected (device=Desk, operation=PUT /lights/3/state, "
                + "status=503, bridgeError=device is unreachable)");
        assertThat(e.getDeviceName()).isEqualTo("Desk");
        assertThat(e.getCause()).isSameAs(cause);
    }

    @Test
    void shouldKeepPlainMessageWithoutDetails() {
        assertThat(DeviceBridgeExceptionBuilder.create("Bridge unreachable").build().getMessage())
                .isEqualTo("Bridge unreachable");
    }
}
