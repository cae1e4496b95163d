package com.phillippitts.huevoice.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Typed properties for wake-word detection.
 */
@Validated
@ConfigurationProperties(prefix = "wake")
public class WakeWordProperties {

    @NotBlank
    private final String keyword;

    /** Tried in order when {@link #keyword} cannot be loaded. */
    private final List<String> fallbackKeywords;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private final double sensitivity;

    @NotBlank
    private final String modelPath;

    /** Samples per frame handed to the backend. */
    @Min(128)
    private final int frameLength;

    @ConstructorBinding
    public WakeWordProperties(String keyword,
                              List<String> fallbackKeywords,
                              Double sensitivity,
                              String modelPath,
                              Integer frameLength) {
        this.keyword = keyword == null ? "philips" : keyword;
        this.fallbackKeywords = fallbackKeywords == null
                ? List.of("computer", "jarvis", "porcupine")
                : List.copyOf(fallbackKeywords);
        this.sensitivity = sensitivity == null ? 0.5 : sensitivity;
        this.modelPath = modelPath == null ? "models/vosk-model-small-en-us-0.15" : modelPath;
        this.frameLength = frameLength == null ? 512 : frameLength;
    }

    public String getKeyword() {
        return keyword;
    }

    public List<String> getFallbackKeywords() {
        return fallbackKeywords;
    }

    public double getSensitivity() {
        return sensitivity;
    }

    public String getModelPath() {
        return modelPath;
    }

    public int getFrameLength() {
        return frameLength;
    }
}
