package com.phillippitts.huevoice.service.bridge;

import com.phillippitts.huevoice.config.properties.BridgeProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Persists bridge credentials as {@code {"bridgeAddress": "...", "authToken": "..."}}.
 *
 * <p>Also reads the older layout {@code {"<address>": {"username": "..."}}} so existing pairings keep
 * working; the file is rewritten in the current layout only when new credentials are saved.
 */
@Component
public class BridgeConfigStore {

    private static final Logger LOG = LogManager.getLogger(BridgeConfigStore.class);

    static final String KEY_ADDRESS = "bridgeAddress";
    static final String KEY_TOKEN = "authToken";

    private final Path file;

    @Autowired
    public BridgeConfigStore(BridgeProperties props) {
        this(Path.of(props.getConfigFile()));
    }

    BridgeConfigStore(Path file) {
        this.file = file;
    }

    /**
     * @return stored credentials, empty when the file is missing or unreadable
     */
    public Optional<BridgeCredentials> load() {
        if (!Files.isRegularFile(file)) {
            LOG.debug("No bridge config at {}", file.toAbsolutePath());
            return Optional.empty();
        }
        try {
            JSONObject json = new JSONObject(Files.readString(file, StandardCharsets.UTF_8));
            if (json.has(KEY_ADDRESS) && json.has(KEY_TOKEN)) {
                return Optional.of(new BridgeCredentials(json.getString(KEY_ADDRESS), json.getString(KEY_TOKEN)));
            }
            for (String address : json.keySet()) {
                JSONObject entry = json.optJSONObject(address);
                if (entry != null && entry.has("username")) {
                    return Optional.of(new BridgeCredentials(address, entry.getString("username")));
                }
            }
            LOG.warn("Bridge config {} holds no credentials", file);
            return Optional.empty();
        } catch (IOException | JSONException | IllegalArgumentException e) {
            LOG.warn("Ignoring unreadable bridge config {}: {}", file, e.toString());
            return Optional.empty();
        }
    }

    public void save(BridgeCredentials credentials) {
        JSONObject json = new JSONObject()
                .put(KEY_ADDRESS, credentials.bridgeAddress())
                .put(KEY_TOKEN, credentials.authToken());
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(file, json.toString(2), StandardCharsets.UTF_8);
            LOG.info("Saved bridge credentials for {} to {}", credentials.bridgeAddress(), file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write bridge config " + file, e);
        }
    }

    Path file() {
        return file;
    }
}
