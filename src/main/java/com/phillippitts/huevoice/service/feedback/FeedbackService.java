package com.phillippitts.huevoice.service.feedback;

/**
 * User-facing feedback. Implementations never throw and never block the calling stage for long;
 * a failed cue or notification is logged and dropped.
 */
public interface FeedbackService {

    void cue(FeedbackCue cue);

    /** Speaks a short acknowledgement. */
    void speak(String text);

    /** Shows a desktop notification, or an equivalent fallback. */
    void sendNotification(String message);
}
