package com.phillippitts.huevoice.service.pipeline;

import java.time.Duration;

/**
 * Uniform lifecycle for pipeline stages so the supervisor can manage them generically.
 */
public interface PipelineStage {

    /** Short name for logs, thread names and status output. */
    String name();

    /**
     * Acquires resources and starts the worker thread. Setup failures are thrown synchronously.
     *
     * @throws IllegalStateException if the stage was already started
     */
    void start();

    /** Requests shutdown and waits briefly for the worker to exit. Idempotent. */
    void stop();

    /**
     * Waits for the worker thread to exit. {@link #stop()} gives up joining after a short grace
     * period, so a worker blocked in I/O may still be running when it returns.
     *
     * @return true when no worker thread of this stage is left running
     */
    boolean awaitTermination(Duration timeout) throws InterruptedException;

    StageState state();

    /** @return true while the worker thread is running normally */
    boolean isAlive();
}
