package com.phillippitts.huevoice.domain;

import java.time.Instant;

/**
 * A deferred command waiting for its fire time.
 *
 * @param id     timer identifier
 * @param fireAt instant the action will be re-submitted
 * @param action command text to run on expiry
 */
public record ScheduledTimer(String id, Instant fireAt, String action) {
}
