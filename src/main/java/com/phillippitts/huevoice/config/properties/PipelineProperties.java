package com.phillippitts.huevoice.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the stage pipeline as a whole.
 */
@Validated
@ConfigurationProperties(prefix = "pipeline")
public class PipelineProperties {

    /** Start the voice pipeline when the application starts. */
    private final boolean autoStart;

    /** Switch to continuous capture when no wake word can be loaded. */
    private final boolean autoFallback;

    /** Capacity of each inter-stage channel. */
    @Min(1)
    private final int channelCapacity;

    /** How long an idle stage waits on its input before re-checking its running flag. */
    @NotNull
    private final Duration pollTimeout;

    @ConstructorBinding
    public PipelineProperties(Boolean autoStart,
                              Boolean autoFallback,
                              Integer channelCapacity,
                              Duration pollTimeout) {
        this.autoStart = autoStart == null || autoStart;
        this.autoFallback = autoFallback == null || autoFallback;
        this.channelCapacity = channelCapacity == null ? 32 : channelCapacity;
        this.pollTimeout = pollTimeout == null ? Duration.ofMillis(100) : pollTimeout;
    }

    public static PipelineProperties defaults() {
        return new PipelineProperties(null, null, null, null);
    }

    public boolean isAutoStart() {
        return autoStart;
    }

    public boolean isAutoFallback() {
        return autoFallback;
    }

    public int getChannelCapacity() {
        return channelCapacity;
    }

    public Duration getPollTimeout() {
        return pollTimeout;
    }
}
