package com.phillippitts.huevoice.service.bridge;

import java.util.Objects;

/**
 * Address of a paired bridge and the application key it issued.
 */
public record BridgeCredentials(String bridgeAddress, String authToken) {

    public BridgeCredentials {
        Objects.requireNonNull(bridgeAddress, "bridgeAddress");
        Objects.requireNonNull(authToken, "authToken");
        if (bridgeAddress.isBlank() || authToken.isBlank()) {
            throw new IllegalArgumentException("bridgeAddress and authToken must not be blank");
        }
    }

    @Override
    public String toString() {
        // Never log the token
        return "BridgeCredentials[bridgeAddress=" + bridgeAddress + "]";
    }
}
