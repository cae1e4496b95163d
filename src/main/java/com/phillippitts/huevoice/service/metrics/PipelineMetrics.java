package com.phillippitts.huevoice.service.metrics;

import com.phillippitts.huevoice.service.dispatch.DispatchOutcome;
import com.phillippitts.huevoice.service.pipeline.ErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Micrometer instrumentation for the voice pipeline.
 *
 * <p>Meters:
 * <ul>
 *   <li>{@code huevoice.wake.detected} - wake words heard, by keyword</li>
 *   <li>{@code huevoice.recognition.latency} - remote recognition round trip</li>
 *   <li>{@code huevoice.recognition.result} - gate decisions and failures, by result</li>
 *   <li>{@code huevoice.dispatch} - sub-commands, by outcome</li>
 *   <li>{@code huevoice.pipeline.errors} - errors seen by the supervisor, by kind</li>
 *   <li>{@code huevoice.pipeline.restarts} - supervisor restarts</li>
 * </ul>
 */
@Component
public class PipelineMetrics {

    private static final String PREFIX = "huevoice";

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordWake(String keyword) {
        Counter.builder(PREFIX + ".wake.detected")
                .description("Wake words detected")
                .tag("keyword", keyword)
                .register(registry)
                .increment();
    }

    public void recordRecognitionLatency(long durationNanos) {
        Timer.builder(PREFIX + ".recognition.latency")
                .description("Time taken by the remote recognition service")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * @param result accepted, low_confidence, duplicate, empty, not_understood, timeout or failure
     */
    public void recordRecognition(String result) {
        Counter.builder(PREFIX + ".recognition.result")
                .description("Recognition outcomes")
                .tag("result", result)
                .register(registry)
                .increment();
    }

    public void recordDispatch(DispatchOutcome outcome) {
        Counter.builder(PREFIX + ".dispatch")
                .description("Dispatched sub-commands")
                .tag("outcome", outcome.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordError(ErrorKind kind) {
        Counter.builder(PREFIX + ".pipeline.errors")
                .description("Errors reported to the supervisor")
                .tag("kind", kind.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    public void recordRestart() {
        Counter.builder(PREFIX + ".pipeline.restarts")
                .description("Pipeline restarts performed by the supervisor")
                .register(registry)
                .increment();
    }
}
