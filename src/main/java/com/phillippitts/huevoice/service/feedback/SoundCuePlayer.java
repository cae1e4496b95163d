package com.phillippitts.huevoice.service.feedback;

import com.phillippitts.huevoice.config.properties.FeedbackProperties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.awt.GraphicsEnvironment;
import java.awt.Toolkit;
import java.nio.file.Path;
import java.util.List;

/**
 * Plays the system sound for a cue. Only macOS ships the named sounds; other desktops get the
 * AWT beep and headless hosts only log the cue.
 */
@Component
class SoundCuePlayer {

    private static final Logger LOG = LogManager.getLogger(SoundCuePlayer.class);

    private final FeedbackProperties props;
    private final CommandRunner runner;
    private final Platform platform;

    @Autowired
    SoundCuePlayer(FeedbackProperties props) {
        this(props, new CommandRunner(props.getProcessTimeout()), Platform.current());
    }

    SoundCuePlayer(FeedbackProperties props, CommandRunner runner, Platform platform) {
        this.props = props;
        this.runner = runner;
        this.platform = platform;
    }

    void play(FeedbackCue cue) {
        if (platform != Platform.MAC) {
            beep(cue);
            return;
        }
        Path sound = Path.of(props.getSoundDirectory(), cue.soundName() + ".aiff");
        if (!runner.run(List.of("afplay", sound.toString()))) {
            LOG.debug("Could not play {}", sound);
        }
    }

    private static void beep(FeedbackCue cue) {
        if (GraphicsEnvironment.isHeadless()) {
            LOG.debug("Cue {}", cue);
            return;
        }
        Toolkit.getDefaultToolkit().beep();
    }
}
