package com.phillippitts.huevoice.service.bridge;

import com.phillippitts.huevoice.config.properties.BridgeProperties;
import com.phillippitts.huevoice.exception.BridgePairingException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Objects;
import java.util.Optional;

/**
 * Establishes the bridge connection at startup.
 *
 * <p>Order of preference:
 * <ol>
 *   <li>stored credentials, when no address is configured or the address matches and the key is
 *       still accepted</li>
 *   <li>pairing with the configured (or stored) address, retrying while the link button is not
 *       pressed, then persisting the new key</li>
 * </ol>
 */
@Service
public class BridgeConnector {

    private static final Logger LOG = LogManager.getLogger(BridgeConnector.class);

    private final BridgeProperties props;
    private final HueBridgeClient client;
    private final BridgeConfigStore store;
    private final HueDeviceBridge bridge;

    public BridgeConnector(BridgeProperties props, HueBridgeClient client,
                           BridgeConfigStore store, HueDeviceBridge bridge) {
        this.props = Objects.requireNonNull(props);
        this.client = Objects.requireNonNull(client);
        this.store = Objects.requireNonNull(store);
        this.bridge = Objects.requireNonNull(bridge);
    }

    /**
     * Connects and attaches the {@link HueDeviceBridge}.
     *
     * @return credentials in use
     * @throws BridgePairingException when no usable credentials could be obtained
     */
    public BridgeCredentials connect() {
        Optional<BridgeCredentials> stored = store.load();
        String address = props.getAddress();

        if (stored.isPresent() && (address == null || address.equals(stored.get().bridgeAddress()))) {
            BridgeCredentials creds = stored.get();
            if (client.isAuthorized(creds)) {
                LOG.info("Using stored credentials for bridge {}", creds.bridgeAddress());
                bridge.attach(creds);
                return creds;
            }
            LOG.warn("Stored key rejected by bridge {}; pairing again", creds.bridgeAddress());
        }

        if (address == null) {
            address = stored.map(BridgeCredentials::bridgeAddress)
                    .orElseThrow(() -> new BridgePairingException(
                            "No bridge address configured; set HUE_BRIDGE_IP", "<unset>"));
        }

        BridgeCredentials paired = pair(address);
        store.save(paired);
        bridge.attach(paired);
        return paired;
    }

    private BridgeCredentials pair(String address) {
        int attempts = props.getPairingAttempts();
        BridgePairingException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                String token = client.createUser(address, props.getDeviceType());
                LOG.info("Paired with bridge {} on attempt {}", address, attempt);
                return new BridgeCredentials(address, token);
            } catch (BridgePairingException e) {
                if (!e.isLinkButtonRequired()) {
                    throw e;
                }
                last = e;
                LOG.warn("Press the link button on the Hue bridge at {} (attempt {}/{})", address, attempt, attempts);
                if (attempt < attempts) {
                    sleep(address);
                }
            }
        }
        throw new BridgePairingException("Link button was not pressed after " + attempts + " attempts",
                address, true, last);
    }

    private void sleep(String address) {
        try {
            Thread.sleep(props.getPairingRetryDelay().toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BridgePairingException("Interrupted while waiting for link button", address, true, e);
        }
    }
}
