package com.phillippitts.huevoice.service.timer;

import com.phillippitts.huevoice.domain.ScheduledTimer;
import com.phillippitts.huevoice.service.feedback.FeedbackCue;
import com.phillippitts.huevoice.service.feedback.FeedbackService;
import com.phillippitts.huevoice.service.pipeline.EventChannel;
import com.phillippitts.huevoice.service.pipeline.event.PipelineEvent;
import com.phillippitts.huevoice.service.pipeline.event.TimerFired;
import com.phillippitts.huevoice.util.LogSanitizer;
import com.phillippitts.huevoice.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Deferred commands ("in 5 minutes turn off the lights").
 *
 * <p>On expiry a timer removes itself from the active set and puts a {@link TimerFired} on the
 * command channel, so the action runs on the dispatcher thread like any other command. Timers are
 * kept in memory only and survive pipeline restarts, not process restarts.
 */
public class TimerService {

    private static final Logger LOG = LogManager.getLogger(TimerService.class);

    private record Entry(ScheduledTimer timer, ScheduledFuture<?> future) {
    }

    private final TaskScheduler scheduler;
    private final Clock clock;
    private final EventChannel<PipelineEvent> commands;
    private final FeedbackService feedback;

    private final AtomicLong sequence = new AtomicLong();
    // Guarded by itself; fire() must not remove an entry before schedule() has stored it
    private final Map<String, Entry> active = new LinkedHashMap<>();

    public TimerService(TaskScheduler scheduler, Clock clock,
                        EventChannel<PipelineEvent> commands, FeedbackService feedback) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.commands = Objects.requireNonNull(commands, "commands");
        this.feedback = Objects.requireNonNull(feedback, "feedback");
    }

    /**
     * Schedules {@code action} to run after {@code amount} {@code unit}s.
     *
     * @param unit "second", "minute" or "hour" (plural accepted)
     * @return the registered timer
     */
    public ScheduledTimer schedule(long amount, String unit, String action) {
        Duration delay = TimeUtils.spokenDuration(amount, unit);
        String id = "timer-" + sequence.incrementAndGet();
        Instant fireAt = clock.instant().plus(delay);
        ScheduledTimer timer = new ScheduledTimer(id, fireAt, action);
        synchronized (active) {
            ScheduledFuture<?> future = scheduler.schedule(() -> fire(timer), fireAt);
            active.put(id, new Entry(timer, future));
        }
        LOG.info("Timer {} set for {} {}(s) at {}: '{}'", id, amount, unit, fireAt, LogSanitizer.preview(action));
        feedback.sendNotification("Timer set: " + amount + " " + unit + "(s) for '" + action + "'");
        return timer;
    }

    /** @return true if the timer existed and was cancelled */
    public boolean cancel(String timerId) {
        Entry entry;
        synchronized (active) {
            entry = active.remove(timerId);
        }
        if (entry == null) {
            return false;
        }
        entry.future().cancel(false);
        LOG.info("Timer {} cancelled", timerId);
        return true;
    }

    /**
     * Cancels all outstanding timers.
     *
     * @return number of timers cancelled
     */
    public int cancelAll() {
        List<Entry> entries;
        synchronized (active) {
            entries = List.copyOf(active.values());
            active.clear();
        }
        entries.forEach(e -> e.future().cancel(false));
        if (!entries.isEmpty()) {
            LOG.info("Cancelled {} pending timer(s)", entries.size());
        }
        return entries.size();
    }

    /** @return outstanding timers, soonest first */
    public List<ScheduledTimer> activeTimers() {
        synchronized (active) {
            return active.values().stream()
                    .map(Entry::timer)
                    .sorted(Comparator.comparing(ScheduledTimer::fireAt))
                    .toList();
        }
    }

    void fire(ScheduledTimer timer) {
        synchronized (active) {
            active.remove(timer.id());
        }
        LOG.info("Timer {} expired", timer.id());
        commands.offer(new TimerFired(timer.id(), timer.action(), clock.instant()));
        feedback.cue(FeedbackCue.TIMER);
        feedback.sendNotification("Timer expired: " + timer.action());
    }
}
