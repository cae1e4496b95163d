package com.phillippitts.huevoice.testutil;

import com.phillippitts.huevoice.service.feedback.FeedbackCue;
import com.phillippitts.huevoice.service.feedback.FeedbackService;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Feedback service that records cues, spoken text and notifications instead of producing them.
 */
public class RecordingFeedbackService implements FeedbackService {

    private final List<FeedbackCue> cues = new CopyOnWriteArrayList<>();
    private final List<String> spoken = new CopyOnWriteArrayList<>();
    private final List<String> notifications = new CopyOnWriteArrayList<>();

    @Override
    public void cue(FeedbackCue cue) {
        cues.add(cue);
    }

    @Override
    public void speak(String text) {
        spoken.add(text);
    }

    @Override
    public void sendNotification(String message) {
        notifications.add(message);
    }

    public List<FeedbackCue> cues() {
        return List.copyOf(cues);
    }

    public List<String> spoken() {
        return List.copyOf(spoken);
    }

    public List<String> notifications() {
        return List.copyOf(notifications);
    }

    public void clear() {
        cues.clear();
        spoken.clear();
        notifications.clear();
    }
}
