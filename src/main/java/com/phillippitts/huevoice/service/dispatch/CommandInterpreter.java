package com.phillippitts.huevoice.service.dispatch;

import com.phillippitts.huevoice.domain.LightHandle;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Classifies a sub-command into a {@link Directive}.
 *
 * <p>Priority: delay phrase, undo, "N percent", exact alias, fuzzy alias, otherwise unrecognized.
 */
public class CommandInterpreter {

    private static final Logger LOG = LogManager.getLogger(CommandInterpreter.class);

    private static final Pattern DELAY = Pattern.compile("\\b(in|after)\\s+(\\d+)\\s+(second|minute|hour)s?\\b");
    private static final Pattern PERCENT = Pattern.compile("(-?\\d+)\\s*percent");

    private final ActionRegistry registry;

    public CommandInterpreter(ActionRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public Directive interpret(String subCommand) {
        String text = subCommand.trim();

        Optional<Directive.Delay> delay = parseDelay(text);
        if (delay.isPresent()) {
            return delay.get();
        }
        if (registry.isUndo(text)) {
            return new Directive.Undo();
        }
        Matcher percent = PERCENT.matcher(text);
        if (percent.find()) {
            int value = parsePercent(percent.group(1));
            return new Directive.BrightnessPercent(value, percentToBrightness(value));
        }
        Optional<ActionRegistry.Match> exact = registry.matchExact(text);
        if (exact.isPresent()) {
            return new Directive.Action(exact.get());
        }
        Optional<ActionRegistry.Match> fuzzy = registry.matchFuzzy(text);
        if (fuzzy.isPresent()) {
            LOG.debug("Fuzzy matched '{}' (score {})", fuzzy.get().phrase(), fuzzy.get().score());
            return new Directive.Action(fuzzy.get());
        }
        return new Directive.Unrecognized(text);
    }

    /**
     * {@code round(percent / 100 * 254)} clamped to the valid brightness range.
     */
    static int percentToBrightness(int percent) {
        long raw = Math.round(percent / 100.0 * LightHandle.MAX_BRIGHTNESS);
        return (int) Math.max(LightHandle.MIN_BRIGHTNESS, Math.min(LightHandle.MAX_BRIGHTNESS, raw));
    }

    /**
     * The deferred action is the text after the delay phrase, or the text before it when nothing
     * follows ("turn off the lights in 5 minutes"). A bare delay is not a delay.
     */
    private static Optional<Directive.Delay> parseDelay(String text) {
        Matcher m = DELAY.matcher(text);
        if (!m.find()) {
            return Optional.empty();
        }
        String action = text.substring(m.end()).trim();
        if (action.isEmpty()) {
            action = text.substring(0, m.start()).trim();
        }
        if (action.isEmpty()) {
            LOG.debug("Delay phrase without an action ignored");
            return Optional.empty();
        }
        long amount;
        try {
            amount = Long.parseLong(m.group(2));
        } catch (NumberFormatException e) {
            LOG.debug("Delay amount out of range: {}", m.group(2));
            return Optional.empty();
        }
        return Optional.of(new Directive.Delay(amount, m.group(3), action));
    }

    private static int parsePercent(String digits) {
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException e) {
            // Absurdly long numbers still mean "a lot" or "none"
            return digits.startsWith("-") ? Integer.MIN_VALUE / 2 : Integer.MAX_VALUE / 2;
        }
    }
}
