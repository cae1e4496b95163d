package com.phillippitts.huevoice.config.properties;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Typed properties for the Hue bridge connection.
 *
 * <p>{@code address} usually comes from the {@code HUE_BRIDGE_IP} environment variable; when it is
 * blank the address persisted in {@code config-file} is used.
 */
@Validated
@ConfigurationProperties(prefix = "hue.bridge")
public class BridgeProperties {

    private final String address;

    @NotBlank
    private final String configFile;

    @NotBlank
    private final String deviceType;

    @Min(1)
    private final int pairingAttempts;

    @NotNull
    private final Duration pairingRetryDelay;

    @NotNull
    private final Duration connectTimeout;

    @NotNull
    private final Duration readTimeout;

    /** How long a fetched light list is trusted before it is refetched. */
    @NotNull
    private final Duration cacheTtl;

    @ConstructorBinding
    public BridgeProperties(String address,
                            String configFile,
                            String deviceType,
                            Integer pairingAttempts,
                            Duration pairingRetryDelay,
                            Duration connectTimeout,
                            Duration readTimeout,
                            Duration cacheTtl) {
        this.address = address == null || address.isBlank() ? null : address.trim();
        this.configFile = configFile == null ? "bridge_config.json" : configFile;
        this.deviceType = deviceType == null ? "hue_voice_control#java" : deviceType;
        this.pairingAttempts = pairingAttempts == null ? 6 : pairingAttempts;
        this.pairingRetryDelay = pairingRetryDelay == null ? Duration.ofSeconds(5) : pairingRetryDelay;
        this.connectTimeout = connectTimeout == null ? Duration.ofSeconds(3) : connectTimeout;
        this.readTimeout = readTimeout == null ? Duration.ofSeconds(5) : readTimeout;
        this.cacheTtl = cacheTtl == null ? Duration.ofSeconds(60) : cacheTtl;
    }

    /**
     * Test constructor: fixed address and config file, defaults elsewhere.
     */
    public BridgeProperties(String address, String configFile) {
        this(address, configFile, null, null, null, null, null, null);
    }

    /** @return configured bridge address, or null when it should come from the config file */
    public String getAddress() {
        return address;
    }

    public String getConfigFile() {
        return configFile;
    }

    public String getDeviceType() {
        return deviceType;
    }

    public int getPairingAttempts() {
        return pairingAttempts;
    }

    public Duration getPairingRetryDelay() {
        return pairingRetryDelay;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }
}
