package com.phillippitts.huevoice.service.audio;

/**
 * Single source of truth for the capture format shared by wake detection, capture and recognition.
 * 16 kHz, 16-bit signed PCM, mono, little-endian.
 */
public final class AudioFormat {

    public static final int SAMPLE_RATE = 16_000;
    public static final int BITS_PER_SAMPLE = 16;
    public static final int CHANNELS = 1;
    public static final boolean SIGNED = true;
    /** false = little-endian. */
    public static final boolean BIG_ENDIAN = false;

    /** Bytes per PCM frame. */
    public static final int BLOCK_ALIGN = (BITS_PER_SAMPLE / 8) * CHANNELS; // 2 bytes
    /** Bytes per second. */
    public static final int BYTE_RATE = SAMPLE_RATE * BLOCK_ALIGN;           // 32,000

    private AudioFormat() {}

    /** The Java Sound equivalent of this format. */
    public static javax.sound.sampled.AudioFormat javaSound() {
        return new javax.sound.sampled.AudioFormat(SAMPLE_RATE, BITS_PER_SAMPLE, CHANNELS, SIGNED, BIG_ENDIAN);
    }

    /** Bytes covering {@code millis} of audio, aligned to whole samples. */
    public static int bytesFor(long millis) {
        long samples = (SAMPLE_RATE * millis) / 1000L;
        return (int) (samples * BLOCK_ALIGN);
    }
}
