package com.phillippitts.huevoice.service.wake;

import com.phillippitts.huevoice.config.properties.WakeWordProperties;
import com.phillippitts.huevoice.exception.MicrophoneUnavailableException;
import com.phillippitts.huevoice.exception.WakeWordUnavailableException;
import com.phillippitts.huevoice.service.feedback.FeedbackCue;
import com.phillippitts.huevoice.service.metrics.PipelineMetrics;
import com.phillippitts.huevoice.service.pipeline.PipelineChannels;
import com.phillippitts.huevoice.service.pipeline.event.WakeDetected;
import com.phillippitts.huevoice.testutil.MutableClock;
import com.phillippitts.huevoice.testutil.RecordingFeedbackService;
import com.phillippitts.huevoice.testutil.ScriptedAudioInput;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalInt;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WakeDetectorStageTest {

    /** Backend that only knows some keywords; its detectors fire on any loud frame. */
    static class FakeBackend implements WakeWordBackend {
        final Set<String> known;
        final List<String> requested = new ArrayList<>();
        final List<FakeHandle> created = new ArrayList<>();

        FakeBackend(String... known) {
            this.known = Set.of(known);
        }

        @Override
        public WakeWordHandle create(String keyword, double sensitivity) {
            requested.add(keyword);
            if (!known.contains(keyword)) {
                throw new WakeWordUnavailableException(List.of(keyword), new IllegalArgumentException("unknown"));
            }
            FakeHandle handle = new FakeHandle(keyword);
            created.add(handle);
            return handle;
        }
    }

    static class FakeHandle implements WakeWordHandle {
        final String keyword;
        boolean closed;

        FakeHandle(String keyword) {
            this.keyword = keyword;
        }

        @Override
        public String keyword() {
            return keyword;
        }

        @Override
        public OptionalInt processFrame(byte[] frame, int length) {
            return frame[0] != 0 || frame[1] != 0 ? OptionalInt.of(0) : OptionalInt.empty();
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private final WakeWordProperties props = new WakeWordProperties(
            "philips", List.of("computer", "jarvis"), 0.5, "unused", 512);

    private PipelineChannels channels;
    private RecordingFeedbackService feedback;
    private SimpleMeterRegistry registry;
    private ScriptedAudioInput input;
    private MutableClock clock;

    @BeforeEach
    void setUp() {
        channels = new PipelineChannels(8);
        feedback = new RecordingFeedbackService();
        registry = new SimpleMeterRegistry();
        input = new ScriptedAudioInput();
        clock = MutableClock.startingAt("2024-05-01T20:00:00Z");
    }

    @Test
    void shouldUseConfiguredKeywordWhenAvailable() {
        FakeBackend backend = new FakeBackend("philips", "computer");
        WakeDetectorStage stage = stage(backend);

        stage.onStart();

        assertThat(stage.activeKeyword()).isEqualTo("philips");
        assertThat(backend.requested).containsExactly("philips");
    }

    @Test
    void shouldFallBackToNextKeyword() {
        FakeBackend backend = new FakeBackend("jarvis");
        WakeDetectorStage stage = stage(backend);

        stage.onStart();

        assertThat(stage.activeKeyword()).isEqualTo("jarvis");
        assertThat(backend.requested).containsExactly("philips", "computer", "jarvis");
    }

    @Test
    void shouldFailWhenNoKeywordLoads() {
        WakeDetectorStage stage = stage(new FakeBackend());

        assertThatThrownBy(stage::start)
                .isInstanceOfSatisfying(WakeWordUnavailableException.class,
                        e -> assertThat(e.getAttemptedKeywords()).containsExactly("philips", "computer", "jarvis"));
        assertThat(stage.activeKeyword()).isNull();
    }

    @Test
    void shouldReleaseDetectorWhenMicrophoneMissing() {
        FakeBackend backend = new FakeBackend("philips");
        WakeDetectorStage stage = new WakeDetectorStage(channels, backend,
                () -> {
                    throw new MicrophoneUnavailableException("No input line");
                },
                props, feedback, new PipelineMetrics(registry), clock);

        assertThatThrownBy(stage::onStart).isInstanceOf(MicrophoneUnavailableException.class);
        assertThat(backend.created.get(0).closed).isTrue();
    }

    @Test
    void shouldEmitWakeEventOnDetection() {
        // Arrange
        WakeDetectorStage stage = stage(new FakeBackend("philips"));
        stage.onStart();
        input.then(0, 1).then(800, 1);

        // Act
        stage.runOnce();
        stage.runOnce();

        // Assert
        WakeDetected wake = channels.wake().poll();
        assertThat(wake).isEqualTo(new WakeDetected("philips", clock.instant()));
        assertThat(channels.wake().size()).isZero();
        assertThat(feedback.cues()).containsExactly(FeedbackCue.WAKE_DETECTED);
        assertThat(registry.get("huevoice.wake.detected").tag("keyword", "philips").counter().count())
                .isEqualTo(1.0);
    }

    @Test
    void shouldCloseInputAndDetectorOnStop() {
        FakeBackend backend = new FakeBackend("philips");
        WakeDetectorStage stage = stage(backend);

        stage.start();
        stage.stop();

        assertThat(input.isClosed()).isTrue();
        assertThat(backend.created.get(0).closed).isTrue();
    }

    private WakeDetectorStage stage(WakeWordBackend backend) {
        return new WakeDetectorStage(channels, backend, () -> input, props, feedback,
                new PipelineMetrics(registry), clock);
    }
}
