package com.phillippitts.huevoice.service.feedback;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/** Tier 2: console line. Always available. */
@Component
@Order(2)
class ConsoleNotificationAdapter implements NotificationAdapter {

    private static final Logger LOG = LogManager.getLogger(ConsoleNotificationAdapter.class);

    @Override
    public boolean canNotify() {
        return true;
    }

    @Override
    public boolean send(String title, String message) {
        LOG.info(">>> {}: {} <<<", title, message);
        return true;
    }

    @Override
    public String name() {
        return "console";
    }
}
