package com.phillippitts.huevoice.service.audio.capture;

/**
 * An open microphone stream delivering PCM16LE mono audio at 16 kHz.
 *
 * <p>Reads block until the buffer is filled; callers size buffers to a few tens of milliseconds.
 */
public interface AudioInput extends AutoCloseable {

    /**
     * Fills {@code buffer} with the next audio.
     *
     * @return bytes read, never more than {@code buffer.length}
     * @throws com.phillippitts.huevoice.exception.MicrophoneUnavailableException if the line fails
     */
    int read(byte[] buffer);

    /** Drops audio buffered by the line while nobody was reading. */
    void discardBuffered();

    @Override
    void close();
}
