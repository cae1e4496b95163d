package com.phillippitts.huevoice.service.feedback;

import com.phillippitts.huevoice.service.feedback.event.NotificationFallbackEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/** Logs notification fallbacks, at most once a minute per tier. */
@Component
class FeedbackEventsListener {

    private static final Logger LOG = LogManager.getLogger(FeedbackEventsListener.class);
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();

    @EventListener
    void onFallback(NotificationFallbackEvent e) {
        if (shouldLog(e.tier(), e.at())) {
            LOG.warn("Notification fallback: tier={}, reason={}", e.tier(), e.reason());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key, Instant now) {
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
