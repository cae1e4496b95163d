package com.phillippitts.huevoice.service.pipeline;

import com.phillippitts.huevoice.service.pipeline.event.AudioReady;
import com.phillippitts.huevoice.service.pipeline.event.PipelineEvent;
import com.phillippitts.huevoice.service.pipeline.event.WakeDetected;

/**
 * The channels that connect the stages. They outlive individual stage instances, so a
 * pipeline restart keeps pending commands and timer firings.
 *
 * <pre>
 * wake detector --wake--> audio capture --audio--> recognizer --commands--> dispatcher
 *                                                  timers ----commands--/
 * every stage -----------------errors------------------------> supervisor
 * </pre>
 */
public class PipelineChannels {

    private final EventChannel<WakeDetected> wake;
    private final EventChannel<AudioReady> audio;
    private final EventChannel<PipelineEvent> commands;
    private final EventChannel<PipelineError> errors;

    public PipelineChannels(int capacity) {
        this.wake = new EventChannel<>("wake", capacity);
        this.audio = new EventChannel<>("audio", capacity);
        this.commands = new EventChannel<>("commands", capacity);
        this.errors = new EventChannel<>("errors", Math.max(capacity, 64));
    }

    public EventChannel<WakeDetected> wake() {
        return wake;
    }

    public EventChannel<AudioReady> audio() {
        return audio;
    }

    /** Carries {@code CommandReady} and {@code TimerFired}. */
    public EventChannel<PipelineEvent> commands() {
        return commands;
    }

    public EventChannel<PipelineError> errors() {
        return errors;
    }

    /**
     * Drops stale wake and audio events. Commands are kept: they were already accepted.
     */
    public void clearTransient() {
        wake.clear();
        audio.clear();
    }
}
