package com.phillippitts.huevoice.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for remote speech recognition and the confidence gate.
 */
@Validated
@ConfigurationProperties(prefix = "recognition")
public class RecognitionProperties {

    @NotBlank
    private final String endpoint;

    private final String apiKey;

    @NotBlank
    private final String language;

    /** Longest the recognizer stage waits for one clip. */
    @NotNull
    private final Duration timeout;

    /** Transcripts must score strictly above this to be accepted. */
    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double confidenceThreshold;

    /** Number of recently accepted transcripts checked for duplicates. */
    @Min(1)
    private final int debounceWindow;

    @ConstructorBinding
    public RecognitionProperties(String endpoint,
                                 String apiKey,
                                 String language,
                                 Duration timeout,
                                 Double confidenceThreshold,
                                 Integer debounceWindow) {
        this.endpoint = endpoint == null ? "https://www.google.com/speech-api/v2/recognize" : endpoint;
        this.apiKey = apiKey == null || apiKey.isBlank() ? null : apiKey;
        this.language = language == null ? "en-US" : language;
        this.timeout = timeout == null ? Duration.ofSeconds(5) : timeout;
        this.confidenceThreshold = confidenceThreshold == null ? 0.7 : confidenceThreshold;
        this.debounceWindow = debounceWindow == null ? 5 : debounceWindow;
    }

    public static RecognitionProperties defaults() {
        return new RecognitionProperties(null, null, null, null, null, null);
    }

    public String getEndpoint() {
        return endpoint;
    }

    public String getApiKey() {
        return apiKey;
    }

    public String getLanguage() {
        return language;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public double getConfidenceThreshold() {
        return confidenceThreshold;
    }

    public int getDebounceWindow() {
        return debounceWindow;
    }
}
