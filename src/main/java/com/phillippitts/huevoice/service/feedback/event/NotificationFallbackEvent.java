package com.phillippitts.huevoice.service.feedback.event;

import java.time.Instant;

/** Published when a notification adapter fails and the next tier is tried. */
public record NotificationFallbackEvent(String tier, String reason, Instant at) { }
