package com.phillippitts.huevoice.service.pipeline.event;

import java.time.Instant;

/**
 * The wake-word detector heard its keyword.
 *
 * @param keyword keyword that matched (may be a fallback keyword)
 * @param at      detection time
 */
public record WakeDetected(String keyword, Instant at) implements PipelineEvent {
}
