package com.phillippitts.huevoice.service.recognition;

import com.phillippitts.huevoice.domain.AudioClip;

/**
 * Speech-to-text boundary.
 *
 * <p>Implementations must be thread-safe; calls arrive on the recognition executor.
 */
public interface RecognitionService {

    /**
     * @param clip PCM16LE mono 16 kHz utterance
     * @return ranked alternatives, never empty
     * @throws com.phillippitts.huevoice.exception.RecognitionException when the service fails or
     *         hears no speech
     */
    RecognitionResponse recognize(AudioClip clip);
}
