package com.phillippitts.huevoice.service.supervisor;

import com.phillippitts.huevoice.config.properties.AudioCaptureProperties;
import com.phillippitts.huevoice.config.properties.PipelineProperties;
import com.phillippitts.huevoice.config.properties.RecognitionProperties;
import com.phillippitts.huevoice.config.properties.WakeWordProperties;
import com.phillippitts.huevoice.service.audio.capture.AudioCaptureStage;
import com.phillippitts.huevoice.service.audio.capture.AudioInputFactory;
import com.phillippitts.huevoice.service.audio.capture.UtteranceRecorder;
import com.phillippitts.huevoice.service.dispatch.CommandDispatcher;
import com.phillippitts.huevoice.service.dispatch.DispatcherStage;
import com.phillippitts.huevoice.service.feedback.FeedbackService;
import com.phillippitts.huevoice.service.metrics.PipelineMetrics;
import com.phillippitts.huevoice.service.pipeline.CaptureMode;
import com.phillippitts.huevoice.service.pipeline.CooldownTracker;
import com.phillippitts.huevoice.service.pipeline.PipelineChannels;
import com.phillippitts.huevoice.service.pipeline.PipelineStage;
import com.phillippitts.huevoice.service.recognition.ConfidenceGate;
import com.phillippitts.huevoice.service.recognition.RecognitionService;
import com.phillippitts.huevoice.service.recognition.RecognizerStage;
import com.phillippitts.huevoice.service.wake.WakeDetectorStage;
import com.phillippitts.huevoice.service.wake.WakeWordBackend;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;

/**
 * Wires the production stages. Long-lived collaborators (channels, gate, dispatcher, cooldown) are
 * shared across generations; only the stage objects and their microphone streams are new.
 */
@Component
public class StagePipelineFactory implements PipelineFactory {

    private final PipelineChannels channels;
    private final WakeWordBackend wakeBackend;
    private final AudioInputFactory inputFactory;
    private final RecognitionService recognitionService;
    private final Executor recognitionExecutor;
    private final ConfidenceGate gate;
    private final CommandDispatcher dispatcher;
    private final CooldownTracker cooldown;
    private final FeedbackService feedback;
    private final PipelineMetrics metrics;
    private final WakeWordProperties wakeProps;
    private final AudioCaptureProperties captureProps;
    private final RecognitionProperties recognitionProps;
    private final PipelineProperties pipelineProps;
    private final Clock clock;

    public StagePipelineFactory(PipelineChannels channels,
                                WakeWordBackend wakeBackend,
                                AudioInputFactory inputFactory,
                                RecognitionService recognitionService,
                                @Qualifier("recognitionExecutor") Executor recognitionExecutor,
                                ConfidenceGate gate,
                                CommandDispatcher dispatcher,
                                CooldownTracker cooldown,
                                FeedbackService feedback,
                                PipelineMetrics metrics,
                                WakeWordProperties wakeProps,
                                AudioCaptureProperties captureProps,
                                RecognitionProperties recognitionProps,
                                PipelineProperties pipelineProps,
                                Clock clock) {
        this.channels = channels;
        this.wakeBackend = wakeBackend;
        this.inputFactory = inputFactory;
        this.recognitionService = recognitionService;
        this.recognitionExecutor = recognitionExecutor;
        this.gate = gate;
        this.dispatcher = dispatcher;
        this.cooldown = cooldown;
        this.feedback = feedback;
        this.metrics = metrics;
        this.wakeProps = wakeProps;
        this.captureProps = captureProps;
        this.recognitionProps = recognitionProps;
        this.pipelineProps = pipelineProps;
        this.clock = clock;
    }

    @Override
    public List<PipelineStage> create(CaptureMode mode) {
        List<PipelineStage> stages = new ArrayList<>(4);
        if (mode == CaptureMode.GATED) {
            stages.add(new WakeDetectorStage(channels, wakeBackend, inputFactory, wakeProps, feedback, metrics, clock));
        }
        stages.add(new AudioCaptureStage(channels, inputFactory, new UtteranceRecorder(captureProps, clock),
                cooldown, captureProps, mode, clock, pipelineProps.getPollTimeout()));
        stages.add(new RecognizerStage(channels, recognitionService, recognitionExecutor, gate, feedback, metrics,
                clock, recognitionProps.getTimeout(), pipelineProps.getPollTimeout()));
        stages.add(new DispatcherStage(channels, dispatcher, pipelineProps.getPollTimeout()));
        return stages;
    }
}
