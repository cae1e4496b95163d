package com.phillippitts.huevoice.exception;

import java.util.List;

/**
 * Thrown when neither the configured wake word nor any fallback keyword could be loaded
 * by the wake-word backend. Gated listening cannot run without one.
 */
public class WakeWordUnavailableException extends HueVoiceException {

    private final List<String> attemptedKeywords;

    public WakeWordUnavailableException(List<String> attemptedKeywords, Throwable cause) {
        super("No wake word could be loaded; tried " + attemptedKeywords, cause);
        this.attemptedKeywords = List.copyOf(attemptedKeywords);
    }

    public List<String> getAttemptedKeywords() {
        return attemptedKeywords;
    }
}
