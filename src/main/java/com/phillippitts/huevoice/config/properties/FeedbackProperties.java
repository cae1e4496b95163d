package com.phillippitts.huevoice.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for user feedback: sound cues, spoken acknowledgements and notifications.
 */
@Validated
@ConfigurationProperties(prefix = "feedback")
public class FeedbackProperties {

    private final boolean soundsEnabled;
    private final boolean speechEnabled;
    private final boolean notificationsEnabled;

    @NotBlank
    private final String voice;

    /** Words per minute for the speech synthesizer. */
    @Min(50)
    private final int speechRate;

    @NotBlank
    private final String soundDirectory;

    @NotBlank
    private final String notificationTitle;

    /** Longest a feedback helper process may run before it is killed. */
    @NotNull
    private final Duration processTimeout;

    @ConstructorBinding
    public FeedbackProperties(Boolean soundsEnabled,
                              Boolean speechEnabled,
                              Boolean notificationsEnabled,
                              String voice,
                              Integer speechRate,
                              String soundDirectory,
                              String notificationTitle,
                              Duration processTimeout) {
        this.soundsEnabled = soundsEnabled == null || soundsEnabled;
        this.speechEnabled = speechEnabled == null || speechEnabled;
        this.notificationsEnabled = notificationsEnabled == null || notificationsEnabled;
        this.voice = voice == null ? "Alex" : voice;
        this.speechRate = speechRate == null ? 175 : speechRate;
        this.soundDirectory = soundDirectory == null ? "/System/Library/Sounds" : soundDirectory;
        this.notificationTitle = notificationTitle == null ? "Hue Voice Control" : notificationTitle;
        this.processTimeout = processTimeout == null ? Duration.ofSeconds(10) : processTimeout;
    }

    public static FeedbackProperties defaults() {
        return new FeedbackProperties(null, null, null, null, null, null, null, null);
    }

    public boolean isSoundsEnabled() {
        return soundsEnabled;
    }

    public boolean isSpeechEnabled() {
        return speechEnabled;
    }

    public boolean isNotificationsEnabled() {
        return notificationsEnabled;
    }

    public String getVoice() {
        return voice;
    }

    public int getSpeechRate() {
        return speechRate;
    }

    public String getSoundDirectory() {
        return soundDirectory;
    }

    public String getNotificationTitle() {
        return notificationTitle;
    }

    public Duration getProcessTimeout() {
        return processTimeout;
    }
}
