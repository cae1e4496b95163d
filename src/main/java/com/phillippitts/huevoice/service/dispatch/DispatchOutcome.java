package com.phillippitts.huevoice.service.dispatch;

/**
 * How one sub-command ended.
 */
public enum DispatchOutcome {
    EXECUTED,
    SCHEDULED,
    UNDONE,
    NOTHING_TO_UNDO,
    UNRECOGNIZED,
    NO_TARGETS,
    FAILED
}
