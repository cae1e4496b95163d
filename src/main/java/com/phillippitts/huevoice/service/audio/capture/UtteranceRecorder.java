package com.phillippitts.huevoice.service.audio.capture;

import com.phillippitts.huevoice.config.properties.AudioCaptureProperties;
import com.phillippitts.huevoice.domain.AudioClip;
import com.phillippitts.huevoice.service.audio.AudioFormat;
import com.phillippitts.huevoice.service.audio.AudioLevels;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.ByteArrayOutputStream;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.Optional;

/**
 * Energy-based endpointing for one spoken command.
 *
 * <p>Audio is read in fixed chunks. A chunk whose RMS reaches the speech threshold starts the
 * utterance; a run of quiet chunks covering {@code end-silence} ends it. A short pre-roll of the
 * chunks preceding speech is kept so the first syllable is not clipped. Timing is counted in chunks,
 * not wall time, so the recorder behaves the same against a live line and a canned one.
 *
 * <p>Not thread-safe: owned by the capture stage.
 */
public class UtteranceRecorder {

    private static final Logger LOG = LogManager.getLogger(UtteranceRecorder.class);

    /** Ambient level multiplier applied after calibration. */
    static final double AMBIENT_FACTOR = 1.5;

    private static final int PRE_ROLL_CHUNKS = 10;

    private final AudioCaptureProperties props;
    private final Clock clock;
    private final int chunkBytes;
    private double threshold;

    public UtteranceRecorder(AudioCaptureProperties props, Clock clock) {
        this.props = Objects.requireNonNull(props, "props");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.chunkBytes = AudioFormat.bytesFor(props.getChunkMillis());
        this.threshold = props.getEnergyFloor();
    }

    /**
     * Samples ambient noise and sets the speech threshold to
     * {@code max(energyFloor, ambientRms * 1.5)}.
     *
     * @return the new threshold
     */
    public double calibrate(AudioInput input) throws InterruptedException {
        int chunks = chunksFor(props.getAmbientCalibration());
        byte[] buf = new byte[chunkBytes];
        double total = 0;
        int measured = 0;
        for (int i = 0; i < chunks; i++) {
            checkInterrupted();
            int n = input.read(buf);
            if (n > 0) {
                total += AudioLevels.rms(buf, 0, n);
                measured++;
            }
        }
        double ambient = measured == 0 ? 0 : total / measured;
        threshold = Math.max(props.getEnergyFloor(), ambient * AMBIENT_FACTOR);
        LOG.info("Ambient noise calibrated: ambient={} threshold={}", Math.round(ambient), Math.round(threshold));
        return threshold;
    }

    /**
     * Records one utterance.
     *
     * @param startTimeout how long to wait for speech to begin
     * @param phraseLimit  maximum utterance length
     * @return the clip, or empty when no speech started within {@code startTimeout}
     */
    public Optional<AudioClip> record(AudioInput input, Duration startTimeout, Duration phraseLimit)
            throws InterruptedException {
        byte[] buf = new byte[chunkBytes];
        Deque<byte[]> preRoll = new ArrayDeque<>(PRE_ROLL_CHUNKS);
        int waitChunks = chunksFor(startTimeout);
        boolean speaking = false;

        for (int i = 0; i < waitChunks && !speaking; i++) {
            checkInterrupted();
            int n = input.read(buf);
            if (n <= 0) {
                continue;
            }
            byte[] chunk = copy(buf, n);
            if (preRoll.size() == PRE_ROLL_CHUNKS) {
                preRoll.removeFirst();
            }
            preRoll.addLast(chunk);
            speaking = AudioLevels.rms(chunk, 0, chunk.length) >= threshold;
        }
        if (!speaking) {
            LOG.debug("No speech within {}ms", startTimeout.toMillis());
            return Optional.empty();
        }

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        preRoll.forEach(c -> out.write(c, 0, c.length));
        int maxChunks = chunksFor(phraseLimit);
        int silenceChunks = chunksFor(props.getEndSilence());
        int recorded = 1;
        int quietRun = 0;
        while (recorded < maxChunks && quietRun < silenceChunks) {
            checkInterrupted();
            int n = input.read(buf);
            recorded++;
            if (n <= 0) {
                quietRun++;
                continue;
            }
            out.write(buf, 0, n);
            quietRun = AudioLevels.rms(buf, 0, n) >= threshold ? 0 : quietRun + 1;
        }
        if (recorded >= maxChunks) {
            LOG.debug("Phrase time limit reached ({}ms)", phraseLimit.toMillis());
        }
        byte[] pcm = out.toByteArray();
        if ((pcm.length & 1) != 0) {
            pcm = copy(pcm, pcm.length - 1);
        }
        return Optional.of(new AudioClip(pcm, clock.instant()));
    }

    public double threshold() {
        return threshold;
    }

    private int chunksFor(Duration d) {
        return (int) Math.max(1, d.toMillis() / props.getChunkMillis());
    }

    private static byte[] copy(byte[] buf, int n) {
        byte[] c = new byte[n];
        System.arraycopy(buf, 0, c, 0, n);
        return c;
    }

    private static void checkInterrupted() throws InterruptedException {
        if (Thread.interrupted()) {
            throw new InterruptedException();
        }
    }
}
