package com.phillippitts.huevoice.exception;

/**
 * Thrown when an injected text command cannot be queued because the command channel is full.
 */
public class CommandRejectedException extends HueVoiceException {

    public CommandRejectedException(String message) {
        super(message);
    }
}
