package com.phillippitts.huevoice.service.pipeline;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Template for a stage with one dedicated worker thread.
 *
 * <p>Subclasses implement {@link #runOnce()}, one bounded unit of work (typically a poll with a
 * short timeout followed by handling). The worker calls it while the running flag is set.
 * Any exception escaping {@code runOnce} marks the stage FAILED and is reported to the
 * supervisor as a {@link ErrorKind#STAGE_FAILURE}; the supervisor then restarts the pipeline.
 *
 * <p>{@link #onStart()} runs on the caller's thread before the worker starts, so setup failures
 * (missing microphone, no wake word) propagate to whoever called {@link #start()}.
 */
public abstract class AbstractPipelineStage implements PipelineStage {

    private static final Logger LOG = LogManager.getLogger(AbstractPipelineStage.class);

    private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(2);

    private final String name;
    private final EventChannel<PipelineError> errors;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private volatile StageState state = StageState.NEW;
    private volatile Thread worker;

    protected AbstractPipelineStage(String name, EventChannel<PipelineError> errors) {
        this.name = Objects.requireNonNull(name, "name");
        this.errors = Objects.requireNonNull(errors, "errors");
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final synchronized void start() {
        if (state != StageState.NEW) {
            throw new IllegalStateException("Stage " + name + " already started (state=" + state + ")");
        }
        onStart();
        running.set(true);
        state = StageState.RUNNING;
        Thread t = new Thread(this::workLoop, "stage-" + name);
        t.setDaemon(true);
        worker = t;
        t.start();
        LOG.info("Stage {} started", name);
    }

    @Override
    public final void stop() {
        Thread t;
        synchronized (this) {
            if (state == StageState.NEW) {
                state = StageState.STOPPED;
                return;
            }
            if (state == StageState.STOPPED) {
                return;
            }
            running.set(false);
            t = worker;
        }
        // Join outside the lock so a worker finishing up cannot deadlock against us
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
            joinWorker(t);
        }
        try {
            onStop();
        } catch (RuntimeException e) {
            LOG.warn("Stage {} cleanup failed: {}", name, e.toString());
        }
        if (state != StageState.FAILED) {
            state = StageState.STOPPED;
        }
        LOG.info("Stage {} stopped", name);
    }

    @Override
    public final boolean awaitTermination(Duration timeout) throws InterruptedException {
        Thread t = worker;
        if (t == null || t == Thread.currentThread()) {
            return true;
        }
        // join(0) would wait forever
        t.join(Math.max(1, timeout.toMillis()));
        return !t.isAlive();
    }

    @Override
    public final StageState state() {
        return state;
    }

    @Override
    public final boolean isAlive() {
        Thread t = worker;
        return state == StageState.RUNNING && t != null && t.isAlive();
    }

    protected final boolean isRunning() {
        return running.get();
    }

    /**
     * Reports a non-fatal error to the supervisor without stopping this stage.
     */
    protected final void reportError(ErrorKind kind, String message, Throwable cause) {
        errors.offer(new PipelineError(name, kind, message, cause, Instant.now()));
    }

    /** Synchronous setup hook; exceptions abort {@link #start()}. */
    protected void onStart() {
    }

    /** Releases resources after the worker has exited (or failed to exit in time). */
    protected void onStop() {
    }

    /**
     * One bounded unit of work. Must return promptly after the running flag is cleared.
     */
    protected abstract void runOnce() throws InterruptedException;

    private void workLoop() {
        try {
            while (running.get()) {
                runOnce();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (running.get()) {
                fail(e);
            }
        } catch (RuntimeException | Error e) {
            fail(e);
        }
    }

    private void fail(Throwable t) {
        state = StageState.FAILED;
        running.set(false);
        LOG.error("Stage {} crashed: {}", name, t.toString(), t);
        errors.offer(new PipelineError(name, ErrorKind.STAGE_FAILURE, t.toString(), t, Instant.now()));
    }

    private void joinWorker(Thread t) {
        try {
            t.join(JOIN_TIMEOUT.toMillis());
            if (t.isAlive()) {
                LOG.warn("Stage {} worker did not terminate within {}ms", name, JOIN_TIMEOUT.toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warn("Interrupted while waiting for stage {} to stop", name);
        }
    }
}
