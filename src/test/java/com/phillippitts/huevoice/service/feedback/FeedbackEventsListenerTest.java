package com.phillippitts.huevoice.service.feedback;

import com.phillippitts.huevoice.service.feedback.event.NotificationFallbackEvent;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class FeedbackEventsListenerTest {

    private final FeedbackEventsListener listener = new FeedbackEventsListener();
    private final Instant t0 = Instant.parse("2024-05-01T20:00:00Z");

    @Test
    void shouldThrottlePerTier() {
        assertThat(listener.shouldLog("desktop", t0)).isTrue();
        assertThat(listener.shouldLog("desktop", t0.plusSeconds(30))).isFalse();
        assertThat(listener.shouldLog("console", t0.plusSeconds(30))).isTrue();
        assertThat(listener.shouldLog("desktop", t0.plusSeconds(61))).isTrue();
    }

    @Test
    void shouldHandleFallbackEvent() {
        assertThatCode(() -> listener.onFallback(new NotificationFallbackEvent("desktop", "exit 1", t0)))
                .doesNotThrowAnyException();
        assertThat(listener.shouldLog("desktop", t0.plusSeconds(1))).isFalse();
    }
}
