package com.phillippitts.huevoice.exception;

/**
 * Base exception for all hue-voice-control application-specific errors.
 * All domain exceptions extend this class to enable centralized error handling.
 */
public class HueVoiceException extends RuntimeException {

    public HueVoiceException(String message) {
        super(message);
    }

    public HueVoiceException(String message, Throwable cause) {
        super(message, cause);
    }

    public HueVoiceException(Throwable cause) {
        super(cause);
    }
}
