package com.phillippitts.huevoice.service.supervisor.event;

import java.time.Instant;

/** Published after the supervisor replaced every stage with a fresh instance. */
public record PipelineRestartedEvent(String reason, int restartCount, Instant at) { }
