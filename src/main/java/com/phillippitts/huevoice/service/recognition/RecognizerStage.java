package com.phillippitts.huevoice.service.recognition;

import com.phillippitts.huevoice.domain.AudioClip;
import com.phillippitts.huevoice.domain.Command;
import com.phillippitts.huevoice.domain.Transcript;
import com.phillippitts.huevoice.exception.RecognitionException;
import com.phillippitts.huevoice.service.feedback.FeedbackCue;
import com.phillippitts.huevoice.service.feedback.FeedbackService;
import com.phillippitts.huevoice.service.metrics.PipelineMetrics;
import com.phillippitts.huevoice.service.pipeline.AbstractPipelineStage;
import com.phillippitts.huevoice.service.pipeline.ErrorKind;
import com.phillippitts.huevoice.service.pipeline.PipelineChannels;
import com.phillippitts.huevoice.service.pipeline.event.AudioReady;
import com.phillippitts.huevoice.service.pipeline.event.CommandReady;
import com.phillippitts.huevoice.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Turns captured clips into commands.
 *
 * <p>Each clip is sent to the {@link RecognitionService} on the recognition executor and awaited
 * with a hard timeout, so a hung request never stalls this stage. The best alternative then passes
 * through the {@link ConfidenceGate}; accepted text becomes a {@link CommandReady} event.
 *
 * <p>Failure handling:
 * <ul>
 *   <li>unintelligible audio: error cue, short spoken apology, reported as {@link ErrorKind#TRANSIENT_PERCEPTION}</li>
 *   <li>service unavailable or malformed answer: reported to the supervisor as {@link ErrorKind#SERVICE}</li>
 *   <li>timeout: request cancelled, error cue, reported as {@link ErrorKind#TRANSIENT_PERCEPTION}, not retried</li>
 * </ul>
 */
public class RecognizerStage extends AbstractPipelineStage {

    private static final Logger LOG = LogManager.getLogger(RecognizerStage.class);

    static final String NOT_UNDERSTOOD_MESSAGE = "Sorry, I couldn't understand the command";

    private final PipelineChannels channels;
    private final RecognitionService recognitionService;
    private final Executor recognitionExecutor;
    private final ConfidenceGate gate;
    private final FeedbackService feedback;
    private final PipelineMetrics metrics;
    private final Clock clock;
    private final Duration timeout;
    private final Duration pollTimeout;

    public RecognizerStage(PipelineChannels channels,
                           RecognitionService recognitionService,
                           Executor recognitionExecutor,
                           ConfidenceGate gate,
                           FeedbackService feedback,
                           PipelineMetrics metrics,
                           Clock clock,
                           Duration timeout,
                           Duration pollTimeout) {
        super("recognizer", channels.errors());
        this.channels = channels;
        this.recognitionService = Objects.requireNonNull(recognitionService, "recognitionService");
        this.recognitionExecutor = Objects.requireNonNull(recognitionExecutor, "recognitionExecutor");
        this.gate = Objects.requireNonNull(gate, "gate");
        this.feedback = Objects.requireNonNull(feedback, "feedback");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
    }

    @Override
    protected void runOnce() throws InterruptedException {
        AudioReady ready = channels.audio().poll(pollTimeout);
        if (ready != null) {
            recognize(ready.clip());
        }
    }

    void recognize(AudioClip clip) throws InterruptedException {
        long start = System.nanoTime();
        CompletableFuture<RecognitionResponse> future =
                CompletableFuture.supplyAsync(() -> recognitionService.recognize(clip), recognitionExecutor);
        RecognitionResponse response;
        try {
            response = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            LOG.warn("Recognition timed out after {}ms; dropping {}ms clip",
                    timeout.toMillis(), clip.durationMillis());
            metrics.recordRecognition("timeout");
            feedback.cue(FeedbackCue.ERROR);
            reportError(ErrorKind.TRANSIENT_PERCEPTION,
                    "Recognition timed out after " + timeout.toMillis() + "ms", e);
            return;
        } catch (ExecutionException e) {
            handleFailure(e.getCause() != null ? e.getCause() : e);
            return;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
        metrics.recordRecognitionLatency(System.nanoTime() - start);

        RecognitionResponse.Alternative best = response.best();
        Transcript transcript = new Transcript(best.text(), best.confidence(), clock.instant());
        GateDecision decision = gate.evaluate(transcript);
        metrics.recordRecognition(decision.name().toLowerCase(Locale.ROOT));

        switch (decision) {
            case ACCEPTED -> accept(transcript);
            case LOW_CONFIDENCE -> LOG.info("Ignoring low-confidence transcript '{}' (confidence {})",
                    LogSanitizer.preview(transcript.text()), transcript.confidence());
            case DUPLICATE -> LOG.info("Ignoring duplicate command '{}'",
                    LogSanitizer.preview(transcript.text()));
            case EMPTY -> LOG.debug("Recognizer returned empty text");
            default -> throw new IllegalStateException("Unhandled gate decision " + decision);
        }
    }

    private void accept(Transcript transcript) {
        String text = transcript.text();
        LOG.info("Command recognized: '{}' (confidence {})", LogSanitizer.preview(text), transcript.confidence());
        feedback.cue(FeedbackCue.COMMAND_RECOGNIZED);
        feedback.speak("I heard: " + text);
        feedback.sendNotification("Command: " + text);
        channels.commands().offer(CommandReady.of(Command.of(text, transcript.timestamp())));
    }

    private void handleFailure(Throwable cause) {
        if (cause instanceof RecognitionException re && !re.isServiceFailure()) {
            LOG.info("Speech not understood");
            metrics.recordRecognition("not_understood");
            feedback.cue(FeedbackCue.ERROR);
            feedback.speak(NOT_UNDERSTOOD_MESSAGE);
            reportError(ErrorKind.TRANSIENT_PERCEPTION, "Speech not understood", cause);
            return;
        }
        if (cause instanceof RecognitionException) {
            LOG.warn("Recognition service error: {}", cause.getMessage());
        } else {
            LOG.error("Unexpected recognition failure", cause);
        }
        metrics.recordRecognition("failure");
        feedback.cue(FeedbackCue.ERROR);
        reportError(ErrorKind.SERVICE, "Recognition failed: " + cause.getMessage(), cause);
    }
}
