package com.phillippitts.huevoice.service.pipeline;

/**
 * How the pipeline decides when to record a command.
 */
public enum CaptureMode {
    /** Record only after the wake word is heard. */
    GATED,
    /** Fallback: record every utterance, no wake word. */
    CONTINUOUS
}
