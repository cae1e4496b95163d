package com.phillippitts.huevoice.service.bridge;

import com.phillippitts.huevoice.domain.LightHandle;
import com.phillippitts.huevoice.exception.DeviceBridgeException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Time-boxed cache of light handles.
 *
 * <p>The list is refetched when older than the TTL, when empty, or after {@link #invalidate()}.
 * A failed refetch propagates and leaves the cache invalidated, so the next call tries again.
 */
public class LightStateCache {

    private static final Logger LOG = LogManager.getLogger(LightStateCache.class);

    private final DeviceBridge bridge;
    private final Clock clock;
    private final Duration ttl;

    private Map<String, LightHandle> handles = Map.of();
    private Instant fetchedAt;

    public LightStateCache(DeviceBridge bridge, Clock clock, Duration ttl) {
        this.bridge = Objects.requireNonNull(bridge, "bridge");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.ttl = Objects.requireNonNull(ttl, "ttl");
    }

    /**
     * @return current handles by name
     * @throws DeviceBridgeException when a refetch fails
     */
    public synchronized Map<String, LightHandle> lights() {
        if (isFresh()) {
            return handles;
        }
        try {
            handles = Collections.unmodifiableMap(new LinkedHashMap<>(bridge.listDevices()));
            fetchedAt = clock.instant();
            LOG.debug("Refreshed light cache: {} lights", handles.size());
        } catch (DeviceBridgeException e) {
            fetchedAt = null;
            LOG.warn("Light refresh failed: {}", e.getMessage());
            throw e;
        }
        return handles;
    }

    /** Forces the next {@link #lights()} call to refetch. */
    public synchronized void invalidate() {
        fetchedAt = null;
    }

    synchronized boolean isFresh() {
        return fetchedAt != null
                && !handles.isEmpty()
                && Duration.between(fetchedAt, clock.instant()).compareTo(ttl) < 0;
    }
}
