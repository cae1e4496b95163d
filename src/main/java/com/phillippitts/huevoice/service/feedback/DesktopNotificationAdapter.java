package com.phillippitts.huevoice.service.feedback;

import com.phillippitts.huevoice.config.properties.FeedbackProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Tier 1: native desktop notification via {@code osascript} (macOS) or {@code notify-send} (Linux).
 * Disables itself after the first failure so later notifications go straight to the console.
 */
@Component
@Order(1)
class DesktopNotificationAdapter implements NotificationAdapter {

    private static final Logger LOG = LogManager.getLogger(DesktopNotificationAdapter.class);

    private final CommandRunner runner;
    private final Platform platform;
    private final AtomicBoolean disabled = new AtomicBoolean(false);

    @Autowired
    DesktopNotificationAdapter(FeedbackProperties props) {
        this(new CommandRunner(props.getProcessTimeout()), Platform.current());
    }

    DesktopNotificationAdapter(CommandRunner runner, Platform platform) {
        this.runner = runner;
        this.platform = platform;
    }

    @Override
    public boolean canNotify() {
        return platform != Platform.OTHER && !disabled.get();
    }

    @Override
    public boolean send(String title, String message) {
        List<String> command = platform == Platform.MAC
                ? List.of("osascript", "-e", "display notification " + quote(message) + " with title " + quote(title))
                : List.of("notify-send", title, message);
        boolean ok = runner.run(command);
        if (!ok && disabled.compareAndSet(false, true)) {
            LOG.warn("Desktop notifications unavailable; falling back to console");
        }
        return ok;
    }

    @Override
    public String name() {
        return "desktop";
    }

    static String quote(String s) {
        return '"' + s.replace("\\", "\\\\").replace("\"", "\\\"") + '"';
    }
}
