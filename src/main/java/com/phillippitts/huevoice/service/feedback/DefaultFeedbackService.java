package com.phillippitts.huevoice.service.feedback;

import com.phillippitts.huevoice.config.properties.FeedbackProperties;
import com.phillippitts.huevoice.service.feedback.event.NotificationFallbackEvent;
import com.phillippitts.huevoice.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs all feedback on the single-threaded feedback executor, so a slow {@code say} never holds up
 * a pipeline stage and spoken messages keep their order.
 *
 * <p>Notifications try each {@link NotificationAdapter} in order until one succeeds.
 */
@Service
public class DefaultFeedbackService implements FeedbackService {

    private static final Logger LOG = LogManager.getLogger(DefaultFeedbackService.class);

    private final FeedbackProperties props;
    private final SoundCuePlayer sounds;
    private final SpeechAnnouncer speech;
    private final List<NotificationAdapter> notifiers;
    private final Executor executor;
    private final ApplicationEventPublisher publisher;

    DefaultFeedbackService(FeedbackProperties props,
                           SoundCuePlayer sounds,
                           SpeechAnnouncer speech,
                           List<NotificationAdapter> notifiers,
                           @Qualifier("feedbackExecutor") Executor executor,
                           ApplicationEventPublisher publisher) {
        this.props = Objects.requireNonNull(props);
        this.sounds = Objects.requireNonNull(sounds);
        this.speech = Objects.requireNonNull(speech);
        this.notifiers = List.copyOf(notifiers);
        this.executor = Objects.requireNonNull(executor);
        this.publisher = Objects.requireNonNull(publisher);
    }

    @Override
    public void cue(FeedbackCue cue) {
        if (props.isSoundsEnabled()) {
            submit("cue " + cue, () -> sounds.play(cue));
        }
    }

    @Override
    public void speak(String text) {
        if (props.isSpeechEnabled() && text != null && !text.isBlank()) {
            submit("speech", () -> speech.say(text));
        }
    }

    @Override
    public void sendNotification(String message) {
        if (props.isNotificationsEnabled() && message != null) {
            submit("notification", () -> deliver(props.getNotificationTitle(), message));
        }
    }

    // Package-private for tests
    boolean deliver(String title, String message) {
        for (NotificationAdapter a : notifiers) {
            if (!a.canNotify()) {
                LOG.debug("Skipping notifier {}: unavailable", a.name());
                continue;
            }
            try {
                if (a.send(title, message)) {
                    return true;
                }
                publisher.publishEvent(new NotificationFallbackEvent(a.name(), "send returned false", Instant.now()));
            } catch (RuntimeException e) {
                LOG.warn("Notifier {} failed: {}", a.name(), e.toString());
                publisher.publishEvent(new NotificationFallbackEvent(a.name(), e.getClass().getSimpleName(), Instant.now()));
            }
        }
        LOG.info("No notifier succeeded for '{}'", LogSanitizer.preview(message));
        return false;
    }

    private void submit(String what, Runnable task) {
        try {
            executor.execute(() -> {
                try {
                    task.run();
                } catch (RuntimeException e) {
                    LOG.warn("Feedback {} failed: {}", what, e.toString());
                }
            });
        } catch (RejectedExecutionException e) {
            LOG.warn("Feedback {} dropped: executor saturated", what);
        }
    }
}
