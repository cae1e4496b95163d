package com.phillippitts.huevoice.service.audio.capture;

import com.phillippitts.huevoice.config.properties.AudioCaptureProperties;
import com.phillippitts.huevoice.domain.AudioClip;
import com.phillippitts.huevoice.service.pipeline.AbstractPipelineStage;
import com.phillippitts.huevoice.service.pipeline.CaptureMode;
import com.phillippitts.huevoice.service.pipeline.CooldownTracker;
import com.phillippitts.huevoice.service.pipeline.ErrorKind;
import com.phillippitts.huevoice.service.pipeline.PipelineChannels;
import com.phillippitts.huevoice.service.pipeline.event.AudioReady;
import com.phillippitts.huevoice.service.pipeline.event.WakeDetected;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Records command utterances and hands them to the recognizer.
 *
 * <p>In {@link CaptureMode#GATED} mode one utterance is recorded per {@link WakeDetected} event,
 * provided the event is still inside the activation window; speech must begin before that window
 * closes. In {@link CaptureMode#CONTINUOUS} mode
 * every utterance is recorded. Both modes stay silent while the post-command cooldown runs.
 *
 * <p>The microphone is opened and ambient noise calibrated in {@link #onStart()}, so a missing
 * microphone fails the start instead of the worker.
 */
public class AudioCaptureStage extends AbstractPipelineStage {

    private static final Logger LOG = LogManager.getLogger(AudioCaptureStage.class);

    private final PipelineChannels channels;
    private final AudioInputFactory inputFactory;
    private final UtteranceRecorder recorder;
    private final CooldownTracker cooldown;
    private final AudioCaptureProperties props;
    private final CaptureMode mode;
    private final Clock clock;
    private final Duration pollTimeout;

    private volatile AudioInput input;

    public AudioCaptureStage(PipelineChannels channels,
                             AudioInputFactory inputFactory,
                             UtteranceRecorder recorder,
                             CooldownTracker cooldown,
                             AudioCaptureProperties props,
                             CaptureMode mode,
                             Clock clock,
                             Duration pollTimeout) {
        super("capture", channels.errors());
        this.channels = channels;
        this.inputFactory = Objects.requireNonNull(inputFactory, "inputFactory");
        this.recorder = Objects.requireNonNull(recorder, "recorder");
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown");
        this.props = Objects.requireNonNull(props, "props");
        this.mode = Objects.requireNonNull(mode, "mode");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.pollTimeout = Objects.requireNonNull(pollTimeout, "pollTimeout");
    }

    public CaptureMode mode() {
        return mode;
    }

    @Override
    protected void onStart() {
        input = inputFactory.open();
        try {
            recorder.calibrate(input);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            input.close();
            throw new IllegalStateException("Interrupted during ambient noise calibration", e);
        }
        LOG.info("Audio capture ready in {} mode", mode);
    }

    @Override
    protected void runOnce() throws InterruptedException {
        if (mode == CaptureMode.GATED) {
            runGated();
        } else {
            runContinuous();
        }
    }

    private void runGated() throws InterruptedException {
        WakeDetected wake = channels.wake().poll(pollTimeout);
        if (wake == null) {
            return;
        }
        Instant windowEnd = wake.at().plus(props.getActivationWindow());
        if (!clock.instant().isBefore(windowEnd)) {
            LOG.debug("Dropping stale wake event from {}", wake.at());
            return;
        }
        if (cooldown.isCoolingDown()) {
            LOG.info("Ignoring wake word during cooldown ({}ms left)", cooldown.remaining().toMillis());
            return;
        }
        input.discardBuffered();
        // Speech must start before the activation window closes
        Duration remaining = Duration.between(clock.instant(), windowEnd);
        Duration startTimeout = remaining.compareTo(props.getCommandTimeout()) < 0
                ? remaining : props.getCommandTimeout();
        LOG.info("Listening for command...");
        if (!listenOnce(startTimeout)) {
            LOG.info("Listening timeout: no command within {}ms of the wake word", startTimeout.toMillis());
            reportError(ErrorKind.TRANSIENT_PERCEPTION, "Listening timeout", null);
        }
    }

    private void runContinuous() throws InterruptedException {
        if (cooldown.isCoolingDown()) {
            Duration remaining = cooldown.remaining();
            Thread.sleep(Math.max(1, Math.min(remaining.toMillis(), pollTimeout.toMillis())));
            if (!cooldown.isCoolingDown()) {
                input.discardBuffered();
            }
            return;
        }
        listenOnce(props.getCommandTimeout());
    }

    /** @return false when no speech started within {@code startTimeout} */
    private boolean listenOnce(Duration startTimeout) throws InterruptedException {
        Optional<AudioClip> clip = recorder.record(input, startTimeout, props.getPhraseTimeLimit());
        if (clip.isEmpty()) {
            LOG.debug("Listening timed out with no speech");
            return false;
        }
        LOG.debug("Captured {}ms utterance", clip.get().durationMillis());
        channels.audio().offer(AudioReady.of(clip.get()));
        return true;
    }

    @Override
    protected void onStop() {
        if (input != null) {
            input.close();
            input = null;
        }
    }
}
