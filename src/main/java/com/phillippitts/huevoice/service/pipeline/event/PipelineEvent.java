package com.phillippitts.huevoice.service.pipeline.event;

import java.time.Instant;

/**
 * Messages passed between pipeline stages. The set is closed: consumers handle each variant
 * with pattern matching and need no default branch beyond logging.
 */
public sealed interface PipelineEvent permits WakeDetected, AudioReady, CommandReady, TimerFired {

    /** @return when the event was produced */
    Instant at();
}
