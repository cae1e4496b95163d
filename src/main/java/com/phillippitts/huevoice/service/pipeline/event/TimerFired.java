package com.phillippitts.huevoice.service.pipeline.event;

import java.time.Instant;

/**
 * A scheduled timer expired; its action text re-enters dispatch as a new command.
 */
public record TimerFired(String timerId, String action, Instant at) implements PipelineEvent {
}
