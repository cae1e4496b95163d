package com.phillippitts.huevoice.service.pipeline;

/**
 * Classification of every failure the pipeline can observe, each with a fixed policy.
 */
public enum ErrorKind {

    /** Capture timeout, unintelligible audio, recognition timeout. */
    TRANSIENT_PERCEPTION(Policy.LOG_ONLY),
    /** Recognition service unreachable or returning garbage. */
    SERVICE(Policy.COUNT_TOWARD_RESTART),
    /** Bridge fetch or mutation failed. */
    DEVICE(Policy.INVALIDATE_CACHE),
    /** A stage worker died. */
    STAGE_FAILURE(Policy.RESTART_PIPELINE),
    /** Nothing left to try. */
    FATAL(Policy.TERMINATE);

    /** What the supervisor does with an error of a given kind. */
    public enum Policy { LOG_ONLY, INVALIDATE_CACHE, COUNT_TOWARD_RESTART, RESTART_PIPELINE, TERMINATE }

    private final Policy policy;

    ErrorKind(Policy policy) {
        this.policy = policy;
    }

    public Policy policy() {
        return policy;
    }
}
