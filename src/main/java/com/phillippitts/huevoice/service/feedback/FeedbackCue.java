package com.phillippitts.huevoice.service.feedback;

/**
 * Short audio cues played at pipeline milestones, with the system sound each maps to.
 */
public enum FeedbackCue {

    WAKE_DETECTED("Tink"),
    COMMAND_RECOGNIZED("Morse"),
    COMMAND_EXECUTED("Bottle"),
    ERROR("Basso"),
    TIMER("Glass");

    private final String soundName;

    FeedbackCue(String soundName) {
        this.soundName = soundName;
    }

    /** @return base name of the sound file, without directory or extension */
    public String soundName() {
        return soundName;
    }
}
