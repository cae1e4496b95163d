package com.phillippitts.huevoice.service.pipeline;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Quiet period after a command. Written by the dispatcher, read by audio capture.
 */
public class CooldownTracker {

    private final Clock clock;
    private final Duration cooldown;
    private volatile Instant until = Instant.MIN;

    public CooldownTracker(Clock clock, Duration cooldown) {
        this.clock = Objects.requireNonNull(clock, "clock");
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
    }

    /** Starts (or restarts) the cooldown from now. */
    public void begin() {
        until = clock.instant().plus(cooldown);
    }

    public boolean isCoolingDown() {
        return clock.instant().isBefore(until);
    }

    /** @return time left, zero when not cooling down */
    public Duration remaining() {
        Instant now = clock.instant();
        return now.isBefore(until) ? Duration.between(now, until) : Duration.ZERO;
    }
}
