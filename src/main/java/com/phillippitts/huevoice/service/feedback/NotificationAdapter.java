package com.phillippitts.huevoice.service.feedback;

/**
 * One way of showing a notification. Adapters are tried in order until one succeeds.
 */
interface NotificationAdapter {

    boolean canNotify();

    /** @return true when the notification was shown */
    boolean send(String title, String message);

    String name();
}
