package com.phillippitts.huevoice.service.supervisor.event;

import java.time.Instant;

/** Published when the supervisor gives up. The application exits with status 1. */
public record PipelineFailedEvent(String reason, Throwable cause, Instant at) { }
