package com.phillippitts.huevoice.service.recognition;

/**
 * Verdict of the {@link ConfidenceGate} on one transcript.
 */
public enum GateDecision {
    ACCEPTED,
    LOW_CONFIDENCE,
    DUPLICATE,
    EMPTY;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
