package com.phillippitts.huevoice.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the pipeline supervisor.
 */
@Validated
@ConfigurationProperties(prefix = "supervisor")
public class SupervisorProperties {

    /** A restart is triggered once counted errors in the window exceed this. */
    @Min(1)
    private final int maxErrors;

    @NotNull
    private final Duration errorWindow;

    @NotNull
    private final Duration pollInterval;

    @NotNull
    private final Duration initialBackoff;

    @NotNull
    private final Duration maxBackoff;

    /** How long a restart waits for the previous generation's workers to exit. */
    @NotNull
    private final Duration stopTimeout;

    @ConstructorBinding
    public SupervisorProperties(Integer maxErrors,
                                Duration errorWindow,
                                Duration pollInterval,
                                Duration initialBackoff,
                                Duration maxBackoff,
                                Duration stopTimeout) {
        this.maxErrors = maxErrors == null ? 5 : maxErrors;
        this.errorWindow = errorWindow == null ? Duration.ofSeconds(30) : errorWindow;
        this.pollInterval = pollInterval == null ? Duration.ofMillis(500) : pollInterval;
        this.initialBackoff = initialBackoff == null ? Duration.ofSeconds(1) : initialBackoff;
        this.maxBackoff = maxBackoff == null ? Duration.ofSeconds(30) : maxBackoff;
        this.stopTimeout = stopTimeout == null ? Duration.ofSeconds(10) : stopTimeout;
    }

    public SupervisorProperties(Integer maxErrors,
                                Duration errorWindow,
                                Duration pollInterval,
                                Duration initialBackoff,
                                Duration maxBackoff) {
        this(maxErrors, errorWindow, pollInterval, initialBackoff, maxBackoff, null);
    }

    public static SupervisorProperties defaults() {
        return new SupervisorProperties(null, null, null, null, null, null);
    }

    public int getMaxErrors() {
        return maxErrors;
    }

    public Duration getErrorWindow() {
        return errorWindow;
    }

    public Duration getPollInterval() {
        return pollInterval;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public Duration getStopTimeout() {
        return stopTimeout;
    }
}
