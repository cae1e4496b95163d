package com.phillippitts.huevoice.service.dispatch;

/**
 * What one sub-command asks for, decided before any light is touched.
 */
public sealed interface Directive {

    /** Run {@code action} later. */
    record Delay(long amount, String unit, String action) implements Directive {
    }

    /** Restore the state captured before the most recent mutating sub-command. */
    record Undo() implements Directive {
    }

    /** Power on at an absolute brightness. */
    record BrightnessPercent(int percent, int brightness) implements Directive {
    }

    /** A registered light action. */
    record Action(ActionRegistry.Match match) implements Directive {
    }

    /** Nothing matched. */
    record Unrecognized(String text) implements Directive {
    }

    /** @return true when executing this directive changes light state and must be undoable */
    default boolean isMutating() {
        return this instanceof BrightnessPercent || this instanceof Action;
    }
}
