package com.phillippitts.huevoice.service.pipeline;

import java.time.Instant;
import java.util.Objects;

/**
 * An error reported by a stage to the supervisor.
 *
 * <p>Messages carry technical diagnostics only, never transcript text.
 */
public record PipelineError(String stage, ErrorKind kind, String message, Throwable cause, Instant at) {

    public PipelineError {
        Objects.requireNonNull(stage, "stage");
        Objects.requireNonNull(kind, "kind");
        if (at == null) {
            at = Instant.now();
        }
    }
}
