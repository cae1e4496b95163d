package com.phillippitts.huevoice.service.supervisor;

import com.phillippitts.huevoice.config.properties.PipelineProperties;
import com.phillippitts.huevoice.exception.WakeWordUnavailableException;
import com.phillippitts.huevoice.service.bridge.BridgeConnector;
import com.phillippitts.huevoice.service.feedback.FeedbackService;
import com.phillippitts.huevoice.service.pipeline.CaptureMode;
import com.phillippitts.huevoice.service.supervisor.event.PipelineFailedEvent;
import com.phillippitts.huevoice.service.timer.TimerService;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Brings the voice pipeline up once the context is ready and tears it down with the context.
 *
 * <p>Start-up order: connect to the bridge (pairing if needed), then start the supervisor in gated
 * mode, or in continuous mode with {@code --fallback}. When no wake word can be loaded and
 * {@code pipeline.auto-fallback} is set, continuous mode is used instead. Any other start-up failure
 * propagates and Spring Boot exits with status 1.
 */
@Component
public class VoiceControlLauncher implements ApplicationRunner {

    private static final Logger LOG = LogManager.getLogger(VoiceControlLauncher.class);

    static final String FALLBACK_OPTION = "fallback";

    private final PipelineProperties props;
    private final BridgeConnector bridgeConnector;
    private final PipelineSupervisor supervisor;
    private final TimerService timers;
    private final FeedbackService feedback;
    private final ApplicationExit exit;

    public VoiceControlLauncher(PipelineProperties props,
                                BridgeConnector bridgeConnector,
                                PipelineSupervisor supervisor,
                                TimerService timers,
                                FeedbackService feedback,
                                ApplicationExit exit) {
        this.props = Objects.requireNonNull(props);
        this.bridgeConnector = Objects.requireNonNull(bridgeConnector);
        this.supervisor = Objects.requireNonNull(supervisor);
        this.timers = Objects.requireNonNull(timers);
        this.feedback = Objects.requireNonNull(feedback);
        this.exit = Objects.requireNonNull(exit);
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!props.isAutoStart()) {
            LOG.info("pipeline.auto-start=false; voice pipeline not started");
            return;
        }
        launch(args.containsOption(FALLBACK_OPTION) ? CaptureMode.CONTINUOUS : CaptureMode.GATED);
    }

    /**
     * @return the mode the pipeline actually started in
     */
    CaptureMode launch(CaptureMode requested) {
        bridgeConnector.connect();
        CaptureMode mode = requested;
        try {
            supervisor.start(mode);
        } catch (WakeWordUnavailableException e) {
            if (!props.isAutoFallback()) {
                throw e;
            }
            LOG.error("Wake word detection unavailable ({}); falling back to continuous listening", e.getMessage());
            mode = CaptureMode.CONTINUOUS;
            supervisor.start(mode);
        }
        feedback.sendNotification(mode == CaptureMode.GATED
                ? "Voice control started. Say the wake word to begin."
                : "Voice control started in continuous listening mode");
        return mode;
    }

    @EventListener
    void onPipelineFailed(PipelineFailedEvent event) {
        LOG.error("Voice pipeline failed permanently: {}", event.reason());
        // Exit from a fresh thread: the context shutdown joins the supervisor thread that published this
        Thread t = new Thread(() -> exit.exit(1), "fatal-exit");
        t.start();
    }

    @PreDestroy
    public void shutdown() {
        supervisor.stop();
        int cancelled = timers.cancelAll();
        if (cancelled > 0) {
            LOG.info("Cancelled {} pending timer(s)", cancelled);
        }
    }
}
