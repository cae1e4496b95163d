package com.phillippitts.huevoice.service.dispatch;

import com.phillippitts.huevoice.domain.Command;
import com.phillippitts.huevoice.domain.LightHandle;
import com.phillippitts.huevoice.domain.LightSnapshot;
import com.phillippitts.huevoice.domain.UndoEntry;
import com.phillippitts.huevoice.exception.DeviceBridgeException;
import com.phillippitts.huevoice.service.bridge.LightStateCache;
import com.phillippitts.huevoice.service.feedback.FeedbackCue;
import com.phillippitts.huevoice.service.feedback.FeedbackService;
import com.phillippitts.huevoice.service.metrics.PipelineMetrics;
import com.phillippitts.huevoice.service.pipeline.CooldownTracker;
import com.phillippitts.huevoice.service.pipeline.ErrorKind;
import com.phillippitts.huevoice.service.pipeline.EventChannel;
import com.phillippitts.huevoice.service.pipeline.PipelineError;
import com.phillippitts.huevoice.service.pipeline.event.TimerFired;
import com.phillippitts.huevoice.service.timer.TimerService;
import com.phillippitts.huevoice.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Executes commands against the lights.
 *
 * <p>Sub-commands of a chain run strictly in order. Each mutating sub-command pushes one
 * {@link UndoEntry} for every light it targets before touching any of them. A failure in one
 * sub-command invalidates the light cache and the chain carries on with the next.
 *
 * <p>Only the dispatcher worker calls into this class; the undo stack and cache rely on that.
 */
public class CommandDispatcher {

    private static final Logger LOG = LogManager.getLogger(CommandDispatcher.class);

    static final String NOTHING_TO_UNDO_MESSAGE = "Sorry, I do not have any previous state to restore";
    static final String UNDO_CONFIRMATION = "Undoing the previous command";

    private final CommandInterpreter interpreter;
    private final ActionRegistry registry;
    private final LightActions actions;
    private final LightStateCache cache;
    private final UndoStack undoStack;
    private final TimerService timers;
    private final FeedbackService feedback;
    private final CooldownTracker cooldown;
    private final PipelineMetrics metrics;
    private final EventChannel<PipelineError> errors;
    private final Clock clock;

    public CommandDispatcher(CommandInterpreter interpreter,
                             ActionRegistry registry,
                             LightActions actions,
                             LightStateCache cache,
                             UndoStack undoStack,
                             TimerService timers,
                             FeedbackService feedback,
                             CooldownTracker cooldown,
                             PipelineMetrics metrics,
                             EventChannel<PipelineError> errors,
                             Clock clock) {
        this.interpreter = interpreter;
        this.registry = registry;
        this.actions = actions;
        this.cache = cache;
        this.undoStack = undoStack;
        this.timers = timers;
        this.feedback = feedback;
        this.cooldown = cooldown;
        this.metrics = metrics;
        this.errors = errors;
        this.clock = clock;
    }

    /**
     * Runs every sub-command of {@code command} in order and starts the capture cooldown.
     *
     * @return one result per sub-command
     */
    public List<SubCommandResult> dispatch(Command command) {
        ThreadContext.put("commandId", command.id());
        try {
            List<String> parts = command.subCommands();
            LOG.info("Dispatching command {} ('{}'): {} sub-command(s)",
                    command.id(), LogSanitizer.preview(command.rawText()), parts.size());
            List<SubCommandResult> results = new ArrayList<>(parts.size());
            for (String part : parts) {
                SubCommandResult result = dispatchSubCommand(part);
                metrics.recordDispatch(result.outcome());
                results.add(result);
            }
            return results;
        } finally {
            cooldown.begin();
            ThreadContext.remove("commandId");
        }
    }

    /**
     * Announces an expired timer and runs its action as a fresh command.
     */
    public List<SubCommandResult> dispatchTimer(TimerFired fired) {
        LOG.info("Timer {} expired; running '{}'", fired.timerId(), LogSanitizer.preview(fired.action()));
        feedback.speak("Timer expired. " + fired.action());
        return dispatch(Command.of(fired.action(), clock.instant()));
    }

    private SubCommandResult dispatchSubCommand(String subCommand) {
        Directive directive = interpreter.interpret(subCommand);
        try {
            return new SubCommandResult(subCommand, directive, execute(subCommand, directive));
        } catch (DeviceBridgeException e) {
            LOG.error("Light update failed for '{}': {}", LogSanitizer.preview(subCommand), e.getMessage());
            cache.invalidate();
            feedback.cue(FeedbackCue.ERROR);
            errors.offer(new PipelineError("dispatcher", ErrorKind.DEVICE, e.getMessage(), e, clock.instant()));
        } catch (RuntimeException e) {
            LOG.error("Error processing '{}'", LogSanitizer.preview(subCommand), e);
            cache.invalidate();
            feedback.cue(FeedbackCue.ERROR);
        }
        return new SubCommandResult(subCommand, directive, DispatchOutcome.FAILED);
    }

    private DispatchOutcome execute(String subCommand, Directive directive) {
        if (directive instanceof Directive.Delay delay) {
            timers.schedule(delay.amount(), delay.unit(), delay.action());
            return DispatchOutcome.SCHEDULED;
        }
        if (directive instanceof Directive.Undo) {
            return undo();
        }
        if (directive instanceof Directive.Unrecognized) {
            LOG.info("Command '{}' not recognized", LogSanitizer.preview(subCommand));
            feedback.cue(FeedbackCue.ERROR);
            return DispatchOutcome.UNRECOGNIZED;
        }

        Map<String, LightHandle> targets = cache.lights();
        if (targets.isEmpty()) {
            LOG.warn("No lights available for '{}'", LogSanitizer.preview(subCommand));
            feedback.cue(FeedbackCue.ERROR);
            return DispatchOutcome.NO_TARGETS;
        }
        undoStack.push(snapshot(subCommand, targets));

        String confirmation;
        if (directive instanceof Directive.BrightnessPercent percent) {
            LOG.info("Setting brightness to {}% ({})", percent.percent(), percent.brightness());
            actions.setLevel(targets.values(), percent.brightness());
            confirmation = "Setting brightness to " + percent.percent() + " percent";
        } else if (directive instanceof Directive.Action action) {
            ActionType type = action.match().action();
            registry.handler(type).apply(targets.values(), subCommand);
            confirmation = type.confirmation();
        } else {
            throw new IllegalStateException("Unhandled directive " + directive);
        }
        feedback.cue(FeedbackCue.COMMAND_EXECUTED);
        feedback.speak(confirmation);
        return DispatchOutcome.EXECUTED;
    }

    private DispatchOutcome undo() {
        if (undoStack.isEmpty()) {
            LOG.info("No previous state to restore");
            feedback.cue(FeedbackCue.ERROR);
            feedback.speak(NOTHING_TO_UNDO_MESSAGE);
            return DispatchOutcome.NOTHING_TO_UNDO;
        }
        // Entry stays on the stack if the lights cannot be fetched
        Map<String, LightHandle> lights = cache.lights();
        UndoEntry previous = undoStack.pop().orElseThrow();
        LOG.info("Undoing '{}' ({} lights)", LogSanitizer.preview(previous.subCommand()), previous.snapshots().size());
        for (Map.Entry<String, LightSnapshot> e : previous.snapshots().entrySet()) {
            LightHandle light = lights.get(e.getKey());
            if (light == null) {
                LOG.warn("Light '{}' no longer available; skipping restore", e.getKey());
                continue;
            }
            e.getValue().restoreTo(light);
        }
        feedback.cue(FeedbackCue.COMMAND_EXECUTED);
        feedback.speak(UNDO_CONFIRMATION);
        return DispatchOutcome.UNDONE;
    }

    private UndoEntry snapshot(String subCommand, Map<String, LightHandle> targets) {
        Map<String, LightSnapshot> snapshots = new LinkedHashMap<>();
        targets.forEach((name, light) -> snapshots.put(name, LightSnapshot.of(light)));
        return new UndoEntry(subCommand, clock.instant(), snapshots);
    }

    /** Visible for status reporting. */
    public int undoDepth() {
        return undoStack.size();
    }
}
