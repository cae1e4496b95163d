package com.phillippitts.huevoice.exception;

/**
 * Thrown when the speech recognition service cannot turn a clip into text.
 *
 * <p>The {@link Reason} decides how the pipeline treats the failure: unintelligible audio is a
 * transient perception error, while an unreachable or misbehaving service counts toward the
 * supervisor's error budget.
 */
public class RecognitionException extends HueVoiceException {

    public enum Reason {
        /** Service answered but found no intelligible speech. */
        NOT_UNDERSTOOD,
        /** Service could not be reached or returned a non-success status. */
        UNAVAILABLE,
        /** Service answered with a payload that could not be parsed. */
        MALFORMED_RESPONSE
    }

    private final Reason reason;

    public RecognitionException(String message, Reason reason) {
        super(message + " (reason: " + reason + ")");
        this.reason = reason;
    }

    public RecognitionException(String message, Reason reason, Throwable cause) {
        super(message + " (reason: " + reason + ")", cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    /** @return true when the failure should be counted against the service error budget */
    public boolean isServiceFailure() {
        return reason != Reason.NOT_UNDERSTOOD;
    }
}
