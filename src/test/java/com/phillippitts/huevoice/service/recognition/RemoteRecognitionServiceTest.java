package com.phillippitts.huevoice.service.recognition;

import com.phillippitts.huevoice.config.properties.RecognitionProperties;
import com.phillippitts.huevoice.domain.AudioClip;
import com.phillippitts.huevoice.exception.RecognitionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.hamcrest.Matchers.startsWith;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class RemoteRecognitionServiceTest {

    private static final String URL = "http://speech.test/recognize?output=json&lang=en-US&key=k123";

    private MockRestServiceServer server;
    private RemoteRecognitionService service;
    private final AudioClip clip = new AudioClip(new byte[3200], Instant.now());

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplate();
        server = MockRestServiceServer.bindTo(restTemplate).build();
        RecognitionProperties props = new RecognitionProperties(
                "http://speech.test/recognize", "k123", "en-US", null, null, null);
        service = new RemoteRecognitionService(restTemplate, props);
    }

    @Test
    void shouldPostRawAudioAndParseAlternatives() {
        // Arrange
        server.expect(requestTo(URL))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("Content-Type", startsWith("audio/l16")))
                .andRespond(withSuccess("{\"result\":[]}\n{\"result\":[{\"alternative\":"
                        + "[{\"transcript\":\"dim the lights\",\"confidence\":0.88}],\"final\":true}]}",
                        MediaType.APPLICATION_JSON));

        // Act
        RecognitionResponse response = service.recognize(clip);

        // Assert
        assertThat(response.best().text()).isEqualTo("dim the lights");
        assertThat(response.best().confidence()).isEqualTo(0.88);
        server.verify();
    }

    @Test
    void shouldOmitKeyWhenNotConfigured() {
        RecognitionProperties props = new RecognitionProperties(
                "http://speech.test/recognize", "  ", "de-DE", null, null, null);
        RemoteRecognitionService keyless = new RemoteRecognitionService(new RestTemplate(), props);

        assertThat(keyless.requestUri().toString()).isEqualTo("http://speech.test/recognize?output=json&lang=de-DE");
    }

    @Test
    void shouldMapHttpErrorToUnavailable() {
        server.expect(requestTo(URL)).andRespond(withStatus(HttpStatus.FORBIDDEN));

        assertThatThrownBy(() -> service.recognize(clip))
                .isInstanceOfSatisfying(RecognitionException.class, e -> {
                    assertThat(e.getReason()).isEqualTo(RecognitionException.Reason.UNAVAILABLE);
                    assertThat(e.getMessage()).contains("403");
                });
    }

    @Test
    void shouldMapNoSpeechToNotUnderstood() {
        server.expect(requestTo(URL)).andRespond(withSuccess("{\"result\":[]}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> service.recognize(clip))
                .isInstanceOfSatisfying(RecognitionException.class,
                        e -> assertThat(e.isServiceFailure()).isFalse());
    }
}
