package com.phillippitts.huevoice.exception;

/**
 * Thrown when the application cannot obtain credentials for the light bridge.
 * This is a fatal startup error.
 */
public class BridgePairingException extends HueVoiceException {

    private final String bridgeAddress;
    private final boolean linkButtonRequired;

    public BridgePairingException(String message, String bridgeAddress) {
        this(message, bridgeAddress, false, null);
    }

    public BridgePairingException(String message, String bridgeAddress, boolean linkButtonRequired,
                                  Throwable cause) {
        super(message + " (bridge: " + bridgeAddress + ")", cause);
        this.bridgeAddress = bridgeAddress;
        this.linkButtonRequired = linkButtonRequired;
    }

    public String getBridgeAddress() {
        return bridgeAddress;
    }

    /** @return true when the bridge refused pairing because its link button was not pressed */
    public boolean isLinkButtonRequired() {
        return linkButtonRequired;
    }
}
