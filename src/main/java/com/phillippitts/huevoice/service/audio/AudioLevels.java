package com.phillippitts.huevoice.service.audio;

/**
 * Energy measurements over PCM16LE buffers.
 */
public final class AudioLevels {

    private AudioLevels() {
        // Utility class
    }

    /**
     * RMS amplitude of a PCM16LE window.
     *
     * @param pcm    PCM16LE buffer
     * @param offset starting byte position
     * @param length number of bytes to analyze
     * @return RMS amplitude (0-32767 range), 0 for an empty window
     */
    public static double rms(byte[] pcm, int offset, int length) {
        long sumSquares = 0;
        int sampleCount = 0;
        int end = Math.min(offset + length, pcm.length);
        for (int i = offset; i + 1 < end; i += 2) {
            int sample = (pcm[i] & 0xFF) | (pcm[i + 1] << 8);
            sumSquares += (long) sample * sample;
            sampleCount++;
        }
        if (sampleCount == 0) {
            return 0;
        }
        return Math.sqrt((double) sumSquares / sampleCount);
    }
}
