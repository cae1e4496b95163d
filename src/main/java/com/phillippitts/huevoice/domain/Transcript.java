package com.phillippitts.huevoice.domain;

import java.time.Instant;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable result of recognizing one utterance.
 *
 * @param text       lower-cased, trimmed transcript (may be empty)
 * @param confidence recognizer confidence between 0.0 and 1.0
 * @param timestamp  when recognition completed
 */
public record Transcript(String text, double confidence, Instant timestamp) {

    public Transcript {
        Objects.requireNonNull(text, "Transcript text must not be null");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException(
                    "Confidence must be between 0.0 and 1.0, got: " + confidence
            );
        }
        Objects.requireNonNull(timestamp, "Timestamp must not be null");
        text = text.trim().toLowerCase(Locale.ROOT);
    }

    public boolean isEmpty() {
        return text.isEmpty();
    }
}
