package com.phillippitts.huevoice.service.wake;

import com.phillippitts.huevoice.config.properties.WakeWordProperties;
import com.phillippitts.huevoice.exception.WakeWordUnavailableException;
import com.phillippitts.huevoice.service.audio.capture.AudioInput;
import com.phillippitts.huevoice.service.audio.capture.AudioInputFactory;
import com.phillippitts.huevoice.service.feedback.FeedbackCue;
import com.phillippitts.huevoice.service.feedback.FeedbackService;
import com.phillippitts.huevoice.service.metrics.PipelineMetrics;
import com.phillippitts.huevoice.service.pipeline.AbstractPipelineStage;
import com.phillippitts.huevoice.service.pipeline.PipelineChannels;
import com.phillippitts.huevoice.service.pipeline.event.WakeDetected;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Listens on its own microphone stream for the wake word and emits {@link WakeDetected}.
 *
 * <p>The configured keyword is tried first, then each fallback keyword in order. When none loads,
 * {@link #start()} fails with {@link WakeWordUnavailableException} and the launcher may switch to
 * continuous listening.
 */
public class WakeDetectorStage extends AbstractPipelineStage {

    private static final Logger LOG = LogManager.getLogger(WakeDetectorStage.class);

    private final PipelineChannels channels;
    private final WakeWordBackend backend;
    private final AudioInputFactory inputFactory;
    private final WakeWordProperties props;
    private final FeedbackService feedback;
    private final PipelineMetrics metrics;
    private final Clock clock;

    private volatile WakeWordHandle detector;
    private volatile AudioInput input;
    private byte[] frame;

    public WakeDetectorStage(PipelineChannels channels,
                             WakeWordBackend backend,
                             AudioInputFactory inputFactory,
                             WakeWordProperties props,
                             FeedbackService feedback,
                             PipelineMetrics metrics,
                             Clock clock) {
        super("wake", channels.errors());
        this.channels = channels;
        this.backend = Objects.requireNonNull(backend, "backend");
        this.inputFactory = Objects.requireNonNull(inputFactory, "inputFactory");
        this.props = Objects.requireNonNull(props, "props");
        this.feedback = Objects.requireNonNull(feedback, "feedback");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** @return the keyword actually in use, or null before start */
    public String activeKeyword() {
        WakeWordHandle d = detector;
        return d == null ? null : d.keyword();
    }

    @Override
    protected void onStart() {
        detector = loadDetector();
        if (!detector.keyword().equalsIgnoreCase(props.getKeyword())) {
            LOG.warn("Using fallback wake word '{}' because '{}' could not be loaded",
                    detector.keyword(), props.getKeyword());
        }
        try {
            input = inputFactory.open();
        } catch (RuntimeException e) {
            detector.close();
            throw e;
        }
        frame = new byte[props.getFrameLength() * 2];
        LOG.info("Wake word detector started. Listening for '{}'...", detector.keyword());
    }

    private WakeWordHandle loadDetector() {
        Set<String> candidates = new LinkedHashSet<>();
        candidates.add(props.getKeyword());
        candidates.addAll(props.getFallbackKeywords());
        List<String> attempted = new ArrayList<>();
        RuntimeException last = null;
        for (String keyword : candidates) {
            attempted.add(keyword);
            try {
                return backend.create(keyword, props.getSensitivity());
            } catch (WakeWordUnavailableException e) {
                LOG.warn("Wake word '{}' unavailable: {}", keyword,
                        e.getCause() != null ? e.getCause().getMessage() : e.getMessage());
                last = e;
            }
        }
        throw new WakeWordUnavailableException(attempted, last);
    }

    @Override
    protected void runOnce() {
        int n = input.read(frame);
        if (n <= 0 || detector.processFrame(frame, n).isEmpty()) {
            return;
        }
        String keyword = detector.keyword();
        LOG.info("Wake word detected: '{}'", keyword);
        metrics.recordWake(keyword);
        feedback.cue(FeedbackCue.WAKE_DETECTED);
        channels.wake().offer(new WakeDetected(keyword, clock.instant()));
    }

    @Override
    protected void onStop() {
        AudioInput in = input;
        input = null;
        WakeWordHandle d = detector;
        try {
            if (in != null) {
                in.close();
            }
        } finally {
            if (d != null) {
                d.close();
            }
        }
    }
}
