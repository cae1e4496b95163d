package com.phillippitts.huevoice.service.recognition;

import com.phillippitts.huevoice.domain.Transcript;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Accepts a transcript iff its confidence is strictly above the threshold and its text is not among
 * the last {@code window} accepted texts. Rejected transcripts leave the window untouched.
 *
 * <p>Not thread-safe: owned by the recognizer stage.
 */
public class ConfidenceGate {

    private final double threshold;
    private final int window;
    private final Deque<String> recent = new ArrayDeque<>();

    public ConfidenceGate(double threshold, int window) {
        if (window <= 0) {
            throw new IllegalArgumentException("window must be > 0, got: " + window);
        }
        this.threshold = threshold;
        this.window = window;
    }

    public GateDecision evaluate(Transcript transcript) {
        if (transcript.isEmpty()) {
            return GateDecision.EMPTY;
        }
        if (transcript.confidence() <= threshold) {
            return GateDecision.LOW_CONFIDENCE;
        }
        if (recent.contains(transcript.text())) {
            return GateDecision.DUPLICATE;
        }
        recent.addLast(transcript.text());
        while (recent.size() > window) {
            recent.removeFirst();
        }
        return GateDecision.ACCEPTED;
    }
}
