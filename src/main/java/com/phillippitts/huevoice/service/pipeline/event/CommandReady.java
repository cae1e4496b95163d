package com.phillippitts.huevoice.service.pipeline.event;

import com.phillippitts.huevoice.domain.Command;

import java.time.Instant;
import java.util.Objects;

/**
 * An accepted command awaiting dispatch.
 */
public record CommandReady(Command command, Instant at) implements PipelineEvent {

    public CommandReady {
        Objects.requireNonNull(command, "command must not be null");
    }

    public static CommandReady of(Command command) {
        return new CommandReady(command, command.receivedAt());
    }
}
