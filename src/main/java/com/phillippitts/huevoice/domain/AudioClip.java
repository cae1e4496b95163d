package com.phillippitts.huevoice.domain;

import java.time.Instant;
import java.util.Objects;

/**
 * A single captured utterance: raw PCM16LE mono audio at 16 kHz plus the capture instant.
 *
 * <p>The byte array is copied on the way in and on the way out, so a clip handed from
 * capture to recognition is never aliased by either side.
 *
 * @param pcm        little-endian 16-bit mono samples (must not be null)
 * @param capturedAt when the utterance finished recording
 */
public record AudioClip(byte[] pcm, Instant capturedAt) {

    /** Bytes per second at 16 kHz, 16-bit mono. */
    private static final int BYTE_RATE = 32_000;

    public AudioClip {
        Objects.requireNonNull(pcm, "pcm must not be null");
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");
        if (pcm.length % 2 != 0) {
            throw new IllegalArgumentException("PCM16 data must have an even length, got: " + pcm.length);
        }
        pcm = pcm.clone();
    }

    @Override
    public byte[] pcm() {
        return pcm.clone();
    }

    public int length() {
        return pcm.length;
    }

    public long durationMillis() {
        return (pcm.length * 1000L) / BYTE_RATE;
    }

    @Override
    public String toString() {
        return "AudioClip[bytes=" + pcm.length + ", capturedAt=" + capturedAt + "]";
    }
}
