package com.phillippitts.huevoice.service.wake;

import java.util.OptionalInt;

/**
 * A loaded keyword model. Fed consecutive PCM16LE frames by one thread.
 */
public interface WakeWordHandle extends AutoCloseable {

    String keyword();

    /**
     * @param frame  PCM16LE mono audio at 16 kHz
     * @param length valid bytes in {@code frame}
     * @return index of the matched keyword when this frame completes an utterance of it, else empty
     */
    OptionalInt processFrame(byte[] frame, int length);

    @Override
    void close();
}
