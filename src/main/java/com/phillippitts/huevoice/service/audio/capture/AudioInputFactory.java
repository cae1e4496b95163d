package com.phillippitts.huevoice.service.audio.capture;

/**
 * Opens microphone streams. Wake detection and command capture each open their own.
 */
public interface AudioInputFactory {

    /**
     * @throws com.phillippitts.huevoice.exception.MicrophoneUnavailableException when no input line can be opened
     */
    AudioInput open();
}
