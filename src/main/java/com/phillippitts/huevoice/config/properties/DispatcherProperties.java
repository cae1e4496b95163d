package com.phillippitts.huevoice.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for command dispatch.
 */
@Validated
@ConfigurationProperties(prefix = "dispatcher")
public class DispatcherProperties {

    /** Quiet period after a command during which capture does not re-arm. */
    @NotNull
    private final Duration cooldown;

    @Min(1)
    private final int undoDepth;

    /** Fuzzy matches must score strictly above this (0-100). */
    @Min(0)
    @Max(100)
    private final int fuzzyThreshold;

    @Min(1)
    @Max(253)
    private final int smallStep;

    @Min(1)
    @Max(253)
    private final int defaultStep;

    @Min(1)
    @Max(253)
    private final int largeStep;

    @ConstructorBinding
    public DispatcherProperties(Duration cooldown,
                                Integer undoDepth,
                                Integer fuzzyThreshold,
                                Integer smallStep,
                                Integer defaultStep,
                                Integer largeStep) {
        this.cooldown = cooldown == null ? Duration.ofSeconds(5) : cooldown;
        this.undoDepth = undoDepth == null ? 5 : undoDepth;
        this.fuzzyThreshold = fuzzyThreshold == null ? 70 : fuzzyThreshold;
        this.smallStep = smallStep == null ? 25 : smallStep;
        this.defaultStep = defaultStep == null ? 64 : defaultStep;
        this.largeStep = largeStep == null ? 100 : largeStep;
    }

    public static DispatcherProperties defaults() {
        return new DispatcherProperties(null, null, null, null, null, null);
    }

    public Duration getCooldown() {
        return cooldown;
    }

    public int getUndoDepth() {
        return undoDepth;
    }

    public int getFuzzyThreshold() {
        return fuzzyThreshold;
    }

    public int getSmallStep() {
        return smallStep;
    }

    public int getDefaultStep() {
        return defaultStep;
    }

    public int getLargeStep() {
        return largeStep;
    }
}
