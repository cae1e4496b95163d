package com.phillippitts.huevoice.domain;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * An accepted voice (or injected text) command awaiting dispatch.
 *
 * <p>A command may chain several sub-commands with "and" or "then"; {@link #subCommands()}
 * returns them in spoken order.
 *
 * @param id         short correlation id used in logs
 * @param rawText    lower-cased command text
 * @param receivedAt when the command entered the pipeline
 */
public record Command(String id, String rawText, Instant receivedAt) {

    private static final Pattern CHAIN_SEPARATOR = Pattern.compile("(?:^|\\s+)(?:(?:and|then)(?:\\s+|$))+");

    public Command {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(rawText, "rawText must not be null");
        Objects.requireNonNull(receivedAt, "receivedAt must not be null");
        rawText = rawText.trim().toLowerCase(Locale.ROOT);
    }

    public static Command of(String text, Instant receivedAt) {
        return new Command(UUID.randomUUID().toString().substring(0, 8), text, receivedAt);
    }

    /**
     * Splits the command on chain conjunctions.
     *
     * @return non-empty sub-commands in order of appearance
     */
    public List<String> subCommands() {
        return Arrays.stream(CHAIN_SEPARATOR.split(rawText))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
