package com.phillippitts.huevoice.service.audio.capture;

import com.phillippitts.huevoice.config.properties.AudioCaptureProperties;
import com.phillippitts.huevoice.exception.MicrophoneUnavailableException;
import com.phillippitts.huevoice.service.audio.AudioFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import javax.sound.sampled.AudioSystem;
import javax.sound.sampled.DataLine;
import javax.sound.sampled.LineUnavailableException;
import javax.sound.sampled.Mixer;
import javax.sound.sampled.TargetDataLine;
import java.util.Objects;
import java.util.Optional;

/**
 * Java Sound microphone access producing raw PCM16LE mono @16kHz.
 *
 * <p>Uses the configured mixer when {@code audio.capture.device-name} matches one, otherwise the
 * system default input line.
 */
@Component
public class JavaSoundAudioInputFactory implements AudioInputFactory {

    private static final Logger LOG = LogManager.getLogger(JavaSoundAudioInputFactory.class);

    /** Abstraction to open a TargetDataLine (for testing). */
    public interface DataLineProvider {
        TargetDataLine open(javax.sound.sampled.AudioFormat format, Optional<String> deviceName)
                throws LineUnavailableException;
    }

    private final AudioCaptureProperties props;
    private final DataLineProvider provider;

    @Autowired
    public JavaSoundAudioInputFactory(AudioCaptureProperties props) {
        this(props, defaultProvider());
    }

    // Package-private for tests
    JavaSoundAudioInputFactory(AudioCaptureProperties props, DataLineProvider provider) {
        this.props = Objects.requireNonNull(props);
        this.provider = Objects.requireNonNull(provider);
    }

    private static DataLineProvider defaultProvider() {
        return (format, device) -> {
            TargetDataLine line = null;
            if (device.isPresent()) {
                for (Mixer.Info info : AudioSystem.getMixerInfo()) {
                    if (info.getName().equalsIgnoreCase(device.get())) {
                        Mixer m = AudioSystem.getMixer(info);
                        line = (TargetDataLine) m.getLine(new DataLine.Info(TargetDataLine.class, format));
                        break;
                    }
                }
                if (line == null) {
                    LOG.warn("Audio device '{}' not found; using system default input", device.get());
                }
            }
            if (line == null) {
                line = (TargetDataLine) AudioSystem.getLine(new DataLine.Info(TargetDataLine.class, format));
            }
            line.open(format);
            return line;
        };
    }

    @Override
    public AudioInput open() {
        TargetDataLine line;
        try {
            line = provider.open(AudioFormat.javaSound(), Optional.ofNullable(props.getDeviceName()));
        } catch (LineUnavailableException e) {
            throw new MicrophoneUnavailableException("Microphone unavailable: " + e.getMessage(), e);
        } catch (SecurityException | IllegalArgumentException e) {
            throw new MicrophoneUnavailableException("Microphone access denied: " + e.getMessage(), e);
        }
        line.start();
        LOG.debug("Opened input line {}", line.getLineInfo());
        return new LineInput(line);
    }

    private static final class LineInput implements AudioInput {

        private final TargetDataLine line;

        LineInput(TargetDataLine line) {
            this.line = line;
        }

        @Override
        public int read(byte[] buffer) {
            if (!line.isOpen()) {
                throw new MicrophoneUnavailableException("Input line closed");
            }
            return line.read(buffer, 0, buffer.length);
        }

        @Override
        public void discardBuffered() {
            line.flush();
        }

        @Override
        public void close() {
            try {
                line.stop();
            } finally {
                line.close();
            }
        }
    }
}
