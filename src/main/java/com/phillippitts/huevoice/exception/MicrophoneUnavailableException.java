package com.phillippitts.huevoice.exception;

/**
 * Thrown when no microphone line can be opened or an open line stops delivering audio.
 */
public class MicrophoneUnavailableException extends HueVoiceException {

    public MicrophoneUnavailableException(String message) {
        super(message);
    }

    public MicrophoneUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
