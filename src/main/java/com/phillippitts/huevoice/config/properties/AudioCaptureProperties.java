package com.phillippitts.huevoice.config.properties;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for microphone capture of command utterances.
 */
@Validated
@ConfigurationProperties(prefix = "audio.capture")
public class AudioCaptureProperties {

    /** Optional mixer name; null selects the system default input. */
    private final String deviceName;

    /** Read size per chunk in milliseconds. */
    @Min(10)
    @Max(200)
    private final int chunkMillis;

    /** Time allowed for speech to start once listening. */
    @NotNull
    private final Duration commandTimeout;

    /** Hard cap on one utterance. */
    @NotNull
    private final Duration phraseTimeLimit;

    /** Window after a wake word during which one utterance is accepted. */
    @NotNull
    private final Duration activationWindow;

    /** Trailing silence that ends an utterance. */
    @NotNull
    private final Duration endSilence;

    /** Ambient noise sampling at startup. */
    @NotNull
    private final Duration ambientCalibration;

    /** Lowest RMS level treated as speech, regardless of calibration. */
    @Min(0)
    private final int energyFloor;

    @ConstructorBinding
    public AudioCaptureProperties(String deviceName,
                                  Integer chunkMillis,
                                  Duration commandTimeout,
                                  Duration phraseTimeLimit,
                                  Duration activationWindow,
                                  Duration endSilence,
                                  Duration ambientCalibration,
                                  Integer energyFloor) {
        this.deviceName = deviceName == null || deviceName.isBlank() ? null : deviceName;
        this.chunkMillis = chunkMillis == null ? 30 : chunkMillis;
        this.commandTimeout = commandTimeout == null ? Duration.ofSeconds(5) : commandTimeout;
        this.phraseTimeLimit = phraseTimeLimit == null ? Duration.ofSeconds(5) : phraseTimeLimit;
        this.activationWindow = activationWindow == null ? Duration.ofSeconds(10) : activationWindow;
        this.endSilence = endSilence == null ? Duration.ofMillis(800) : endSilence;
        this.ambientCalibration = ambientCalibration == null ? Duration.ofSeconds(2) : ambientCalibration;
        this.energyFloor = energyFloor == null ? 300 : energyFloor;
    }

    /** All defaults. */
    public static AudioCaptureProperties defaults() {
        return new AudioCaptureProperties(null, null, null, null, null, null, null, null);
    }

    public String getDeviceName() {
        return deviceName;
    }

    public int getChunkMillis() {
        return chunkMillis;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public Duration getPhraseTimeLimit() {
        return phraseTimeLimit;
    }

    public Duration getActivationWindow() {
        return activationWindow;
    }

    public Duration getEndSilence() {
        return endSilence;
    }

    public Duration getAmbientCalibration() {
        return ambientCalibration;
    }

    public int getEnergyFloor() {
        return energyFloor;
    }
}
