package com.phillippitts.huevoice.domain;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * States of every light a sub-command targeted, captured just before it mutated them.
 *
 * @param subCommand text of the sub-command that produced this entry
 * @param capturedAt when the snapshot was taken
 * @param snapshots  light name to prior state, in target order
 */
public record UndoEntry(String subCommand, Instant capturedAt, Map<String, LightSnapshot> snapshots) {

    public UndoEntry {
        Objects.requireNonNull(subCommand, "subCommand must not be null");
        Objects.requireNonNull(capturedAt, "capturedAt must not be null");
        snapshots = Collections.unmodifiableMap(new LinkedHashMap<>(snapshots));
    }
}
