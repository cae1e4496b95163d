package com.phillippitts.huevoice.service.feedback;

import com.phillippitts.huevoice.config.properties.FeedbackProperties;
import com.phillippitts.huevoice.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Speaks short acknowledgements through the platform synthesizer: {@code say} on macOS,
 * {@code espeak} on Linux. Falls back to the log when neither is usable.
 */
@Component
class SpeechAnnouncer {

    private static final Logger LOG = LogManager.getLogger(SpeechAnnouncer.class);

    private final FeedbackProperties props;
    private final CommandRunner runner;
    private final Platform platform;

    @Autowired
    SpeechAnnouncer(FeedbackProperties props) {
        this(props, new CommandRunner(props.getProcessTimeout()), Platform.current());
    }

    SpeechAnnouncer(FeedbackProperties props, CommandRunner runner, Platform platform) {
        this.props = props;
        this.runner = runner;
        this.platform = platform;
    }

    void say(String text) {
        boolean spoken = switch (platform) {
            case MAC -> runner.run(List.of("say", "-v", props.getVoice(),
                    "-r", String.valueOf(props.getSpeechRate()), text));
            case LINUX -> runner.run(List.of("espeak", "-s", String.valueOf(props.getSpeechRate()), text));
            case OTHER -> false;
        };
        if (!spoken) {
            LOG.info("Voice feedback: {}", LogSanitizer.preview(text));
        }
    }
}
