package com.phillippitts.huevoice.service.supervisor;

import com.phillippitts.huevoice.config.properties.SupervisorProperties;
import com.phillippitts.huevoice.service.bridge.LightStateCache;
import com.phillippitts.huevoice.service.feedback.FeedbackCue;
import com.phillippitts.huevoice.service.feedback.FeedbackService;
import com.phillippitts.huevoice.service.metrics.PipelineMetrics;
import com.phillippitts.huevoice.service.pipeline.CaptureMode;
import com.phillippitts.huevoice.service.pipeline.PipelineChannels;
import com.phillippitts.huevoice.service.pipeline.PipelineError;
import com.phillippitts.huevoice.service.pipeline.PipelineStage;
import com.phillippitts.huevoice.service.pipeline.StageState;
import com.phillippitts.huevoice.service.supervisor.event.PipelineFailedEvent;
import com.phillippitts.huevoice.service.supervisor.event.PipelineRestartedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Owns the running stages and keeps them alive.
 *
 * <p>A monitor thread wakes every {@code supervisor.poll-interval}, drains the shared error channel
 * and checks every stage's liveness. Each error is handled by its {@link com.phillippitts.huevoice.service.pipeline.ErrorKind.Policy}.
 * The whole pipeline is restarted when a stage is no longer alive, a stage reports a crash, or more than
 * {@code max-errors} counted errors fall inside the rolling {@code error-window}.
 *
 * <p>A restart stops every stage and waits up to {@code stop-timeout} for their workers to exit, so two
 * generations never run side by side. It then waits out the backoff (doubling on consecutive restarts up to
 * {@code max-backoff}), invalidates the device cache and starts a fresh generation of stages from the
 * {@link PipelineFactory}. Channels survive restarts. A failed restart moves the supervisor to
 * {@link SupervisorState#FAILED} and publishes {@link PipelineFailedEvent}.
 */
@Component
public class PipelineSupervisor {

    private static final Logger LOG = LogManager.getLogger(PipelineSupervisor.class);

    static final String RECOVERING_MESSAGE = "System is having issues. Attempting to recover.";
    static final String RECOVERED_MESSAGE = "System recovered successfully";

    private static final Duration JOIN_TIMEOUT = Duration.ofSeconds(2);

    /** Waits out the restart backoff. */
    interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final PipelineFactory factory;
    private final PipelineChannels channels;
    private final LightStateCache cache;
    private final FeedbackService feedback;
    private final PipelineMetrics metrics;
    private final SupervisorProperties props;
    private final Clock clock;
    private final ApplicationEventPublisher publisher;
    private final Sleeper sleeper;

    private final Object lock = new Object();
    // @GuardedBy("lock")
    private final Deque<Instant> errorWindow = new ArrayDeque<>();
    // @GuardedBy("lock")
    private Duration nextBackoff;
    // @GuardedBy("lock")
    private Instant lastRestartAt;

    private volatile SupervisorState state = SupervisorState.NEW;
    private volatile CaptureMode mode;
    private volatile List<PipelineStage> stages = List.of();
    private volatile int restartCount;
    private volatile boolean monitoring;
    private volatile Thread monitor;

    @Autowired
    public PipelineSupervisor(PipelineFactory factory,
                              PipelineChannels channels,
                              LightStateCache cache,
                              FeedbackService feedback,
                              PipelineMetrics metrics,
                              SupervisorProperties props,
                              Clock clock,
                              ApplicationEventPublisher publisher) {
        this(factory, channels, cache, feedback, metrics, props, clock, publisher,
                d -> Thread.sleep(d.toMillis()));
    }

    // Package-private for tests
    PipelineSupervisor(PipelineFactory factory,
                       PipelineChannels channels,
                       LightStateCache cache,
                       FeedbackService feedback,
                       PipelineMetrics metrics,
                       SupervisorProperties props,
                       Clock clock,
                       ApplicationEventPublisher publisher,
                       Sleeper sleeper) {
        this.factory = Objects.requireNonNull(factory, "factory");
        this.channels = Objects.requireNonNull(channels, "channels");
        this.cache = Objects.requireNonNull(cache, "cache");
        this.feedback = Objects.requireNonNull(feedback, "feedback");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
        this.nextBackoff = props.getInitialBackoff();
    }

    /**
     * Starts every stage for {@code mode} and the monitor thread.
     *
     * <p>Stage setup failures (no wake word, no microphone) propagate after any stages already started
     * have been stopped, leaving the supervisor startable again.
     */
    public void start(CaptureMode mode) {
        startStagesOnly(mode);
        monitoring = true;
        Thread t = new Thread(this::monitorLoop, "pipeline-supervisor");
        t.setDaemon(true);
        monitor = t;
        t.start();
        LOG.info("Pipeline supervisor started in {} mode", mode);
    }

    // Package-private for tests: same as start() without the monitor thread
    void startStagesOnly(CaptureMode mode) {
        synchronized (lock) {
            if (state == SupervisorState.RUNNING || state == SupervisorState.RESTARTING) {
                throw new IllegalStateException("Pipeline already running in " + this.mode + " mode");
            }
            startStages(mode);
            this.mode = mode;
            errorWindow.clear();
            nextBackoff = props.getInitialBackoff();
            state = SupervisorState.RUNNING;
        }
    }

    /** Stops the monitor and every stage. Idempotent. */
    public void stop() {
        monitoring = false;
        Thread t = monitor;
        monitor = null;
        if (t != null && t != Thread.currentThread()) {
            t.interrupt();
            try {
                t.join(JOIN_TIMEOUT.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                LOG.warn("Interrupted while waiting for supervisor monitor to stop");
            }
        }
        synchronized (lock) {
            stopStages();
            if (state != SupervisorState.FAILED && state != SupervisorState.NEW) {
                state = SupervisorState.STOPPED;
            }
        }
        LOG.info("Pipeline supervisor stopped");
    }

    public SupervisorState state() {
        return state;
    }

    /** @return the capture mode of the running pipeline, or null before start */
    public CaptureMode mode() {
        return mode;
    }

    public int restartCount() {
        return restartCount;
    }

    /** Stage name to state, upstream first. */
    public Map<String, StageState> stageStates() {
        Map<String, StageState> out = new LinkedHashMap<>();
        for (PipelineStage s : stages) {
            out.put(s.name(), s.state());
        }
        return Collections.unmodifiableMap(out);
    }

    private void monitorLoop() {
        while (monitoring) {
            try {
                Thread.sleep(props.getPollInterval().toMillis());
                check();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            } catch (RuntimeException e) {
                LOG.error("Supervisor check failed: {}", e.toString(), e);
            }
        }
    }

    /**
     * One supervision pass: drain errors, apply policies, check liveness, restart if needed.
     */
    void check() {
        synchronized (lock) {
            if (state != SupervisorState.RUNNING) {
                return;
            }
            String restartReason = null;
            PipelineError error;
            while ((error = channels.errors().poll()) != null) {
                metrics.recordError(error.kind());
                switch (error.kind().policy()) {
                    case LOG_ONLY -> LOG.debug("Transient error in {}: {}", error.stage(), error.message());
                    case INVALIDATE_CACHE -> {
                        LOG.warn("Device error in {}: {}", error.stage(), error.message());
                        cache.invalidate();
                    }
                    case COUNT_TOWARD_RESTART -> {
                        LOG.warn("Service error in {}: {}", error.stage(), error.message());
                        errorWindow.addLast(error.at());
                    }
                    case RESTART_PIPELINE -> {
                        LOG.error("Stage {} failed: {}", error.stage(), error.message());
                        restartReason = "stage " + error.stage() + " failed";
                    }
                    case TERMINATE -> {
                        fail("Fatal error in " + error.stage() + ": " + error.message(), error.cause());
                        return;
                    }
                    default -> throw new IllegalStateException("Unhandled policy " + error.kind().policy());
                }
            }

            pruneWindow(clock.instant());
            if (restartReason == null && errorWindow.size() > props.getMaxErrors()) {
                restartReason = errorWindow.size() + " service errors within " + props.getErrorWindow().toSeconds() + "s";
            }
            if (restartReason == null) {
                for (PipelineStage s : stages) {
                    if (!s.isAlive()) {
                        restartReason = "stage " + s.name() + " is not running (state=" + s.state() + ")";
                        break;
                    }
                }
            }
            if (restartReason != null) {
                restart(restartReason);
            }
        }
    }

    // @GuardedBy("lock")
    private void restart(String reason) {
        state = SupervisorState.RESTARTING;
        LOG.warn("Restarting pipeline: {}", reason);
        feedback.speak(RECOVERING_MESSAGE);
        stopStages();
        // A worker stuck in a bridge call must not overlap its successor
        Optional<PipelineStage> lingering;
        try {
            lingering = lingeringStage();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state = SupervisorState.STOPPED;
            LOG.info("Restart abandoned: supervisor stopping");
            return;
        }
        if (lingering.isPresent()) {
            fail("Pipeline restart failed: stage " + lingering.get().name() + " did not stop within "
                    + props.getStopTimeout().toMillis() + "ms", null);
            return;
        }
        channels.clearTransient();
        int stale = channels.errors().clear();
        if (stale > 0) {
            LOG.debug("Discarded {} errors from the previous generation", stale);
        }

        Instant now = clock.instant();
        if (lastRestartAt == null || Duration.between(lastRestartAt, now).compareTo(props.getErrorWindow()) > 0) {
            nextBackoff = props.getInitialBackoff();
        }
        Duration backoff = nextBackoff;
        nextBackoff = min(backoff.multipliedBy(2), props.getMaxBackoff());
        try {
            LOG.info("Waiting {}ms before restart", backoff.toMillis());
            sleeper.sleep(backoff);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            state = SupervisorState.STOPPED;
            LOG.info("Restart abandoned: supervisor stopping");
            return;
        }

        cache.invalidate();
        try {
            startStages(mode);
        } catch (RuntimeException e) {
            fail("Pipeline restart failed: " + e.getMessage(), e);
            return;
        }
        restartCount++;
        lastRestartAt = clock.instant();
        errorWindow.clear();
        metrics.recordRestart();
        state = SupervisorState.RUNNING;
        LOG.info("Pipeline restarted (restart #{})", restartCount);
        feedback.speak(RECOVERED_MESSAGE);
        publisher.publishEvent(new PipelineRestartedEvent(reason, restartCount, lastRestartAt));
    }

    // @GuardedBy("lock")
    private void startStages(CaptureMode mode) {
        List<PipelineStage> created = factory.create(mode);
        for (int i = 0; i < created.size(); i++) {
            try {
                created.get(i).start();
            } catch (RuntimeException e) {
                LOG.error("Stage {} failed to start: {}", created.get(i).name(), e.getMessage());
                for (int j = 0; j < i; j++) {
                    created.get(j).stop();
                }
                throw e;
            }
        }
        stages = List.copyOf(created);
    }

    // @GuardedBy("lock")
    private void stopStages() {
        for (PipelineStage s : stages) {
            s.stop();
        }
    }

    // @GuardedBy("lock")
    private Optional<PipelineStage> lingeringStage() throws InterruptedException {
        for (PipelineStage s : stages) {
            if (!s.awaitTermination(props.getStopTimeout())) {
                return Optional.of(s);
            }
        }
        return Optional.empty();
    }

    // @GuardedBy("lock")
    private void fail(String reason, Throwable cause) {
        state = SupervisorState.FAILED;
        monitoring = false;
        stopStages();
        LOG.error("Pipeline supervisor failed: {}", reason, cause);
        feedback.cue(FeedbackCue.ERROR);
        publisher.publishEvent(new PipelineFailedEvent(reason, cause, clock.instant()));
    }

    private void pruneWindow(Instant now) {
        Instant cutoff = now.minus(props.getErrorWindow());
        while (!errorWindow.isEmpty() && errorWindow.peekFirst().isBefore(cutoff)) {
            errorWindow.removeFirst();
        }
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
