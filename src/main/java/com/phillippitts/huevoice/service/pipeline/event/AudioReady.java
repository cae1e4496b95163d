package com.phillippitts.huevoice.service.pipeline.event;

import com.phillippitts.huevoice.domain.AudioClip;

import java.time.Instant;
import java.util.Objects;

/**
 * One complete utterance is ready for recognition.
 */
public record AudioReady(AudioClip clip, Instant at) implements PipelineEvent {

    public AudioReady {
        Objects.requireNonNull(clip, "clip must not be null");
    }

    public static AudioReady of(AudioClip clip) {
        return new AudioReady(clip, clip.capturedAt());
    }
}
