package com.phillippitts.huevoice.service.pipeline;

import com.phillippitts.huevoice.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CooldownTrackerTest {

    @Test
    void shouldNotCoolDownBeforeFirstCommand() {
        CooldownTracker tracker = new CooldownTracker(MutableClock.startingAt("2024-01-01T00:00:00Z"),
                Duration.ofSeconds(5));

        assertThat(tracker.isCoolingDown()).isFalse();
        assertThat(tracker.remaining()).isEqualTo(Duration.ZERO);
    }

    @Test
    void shouldCoolDownForConfiguredPeriod() {
        // Arrange
        MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        CooldownTracker tracker = new CooldownTracker(clock, Duration.ofSeconds(5));

        // Act
        tracker.begin();
        clock.advance(Duration.ofSeconds(3));

        // Assert
        assertThat(tracker.isCoolingDown()).isTrue();
        assertThat(tracker.remaining()).isEqualTo(Duration.ofSeconds(2));
        clock.advance(Duration.ofSeconds(2));
        assertThat(tracker.isCoolingDown()).isFalse();
    }

    @Test
    void shouldRestartCooldownOnNextCommand() {
        MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        CooldownTracker tracker = new CooldownTracker(clock, Duration.ofSeconds(5));

        tracker.begin();
        clock.advance(Duration.ofSeconds(4));
        tracker.begin();
        clock.advance(Duration.ofSeconds(4));

        assertThat(tracker.isCoolingDown()).isTrue();
    }
}
