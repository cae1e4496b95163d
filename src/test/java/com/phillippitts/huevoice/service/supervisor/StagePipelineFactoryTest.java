package com.phillippitts.huevoice.service.supervisor;

import com.phillippitts.huevoice.config.properties.AudioCaptureProperties;
import com.phillippitts.huevoice.config.properties.PipelineProperties;
import com.phillippitts.huevoice.config.properties.RecognitionProperties;
import com.phillippitts.huevoice.config.properties.WakeWordProperties;
import com.phillippitts.huevoice.service.audio.capture.AudioCaptureStage;
import com.phillippitts.huevoice.service.audio.capture.AudioInputFactory;
import com.phillippitts.huevoice.service.dispatch.CommandDispatcher;
import com.phillippitts.huevoice.service.dispatch.DispatcherStage;
import com.phillippitts.huevoice.service.metrics.PipelineMetrics;
import com.phillippitts.huevoice.service.pipeline.CaptureMode;
import com.phillippitts.huevoice.service.pipeline.CooldownTracker;
import com.phillippitts.huevoice.service.pipeline.PipelineChannels;
import com.phillippitts.huevoice.service.pipeline.PipelineStage;
import com.phillippitts.huevoice.service.recognition.ConfidenceGate;
import com.phillippitts.huevoice.service.recognition.RecognitionService;
import com.phillippitts.huevoice.service.recognition.RecognizerStage;
import com.phillippitts.huevoice.service.wake.WakeDetectorStage;
import com.phillippitts.huevoice.service.wake.WakeWordBackend;
import com.phillippitts.huevoice.testutil.RecordingFeedbackService;
import com.phillippitts.huevoice.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

class StagePipelineFactoryTest {

    private final StagePipelineFactory factory = new StagePipelineFactory(
            new PipelineChannels(8),
            mock(WakeWordBackend.class),
            mock(AudioInputFactory.class),
            mock(RecognitionService.class),
            new SyncExecutor(),
            new ConfidenceGate(0.7, 3),
            mock(CommandDispatcher.class),
            new CooldownTracker(Clock.systemUTC(), Duration.ofSeconds(2)),
            new RecordingFeedbackService(),
            new PipelineMetrics(new SimpleMeterRegistry()),
            new WakeWordProperties(null, null, null, null, null),
            new AudioCaptureProperties(null, null, null, null, null, null, null, null),
            new RecognitionProperties(null, null, null, null, null, null),
            new PipelineProperties(null, null, null, null),
            Clock.systemUTC());

    @Test
    void shouldBuildGatedPipelineUpstreamFirst() {
        List<PipelineStage> stages = factory.create(CaptureMode.GATED);

        assertThat(stages).extracting(PipelineStage::name)
                .containsExactly("wake", "capture", "recognizer", "dispatcher");
        assertThat(stages.get(0)).isInstanceOf(WakeDetectorStage.class);
        assertThat(stages.get(1)).isInstanceOf(AudioCaptureStage.class);
        assertThat(stages.get(2)).isInstanceOf(RecognizerStage.class);
        assertThat(stages.get(3)).isInstanceOf(DispatcherStage.class);
    }

    @Test
    void shouldOmitWakeDetectorInContinuousMode() {
        List<PipelineStage> stages = factory.create(CaptureMode.CONTINUOUS);

        assertThat(stages).extracting(PipelineStage::name).containsExactly("capture", "recognizer", "dispatcher");
        assertThat(((AudioCaptureStage) stages.get(0)).mode()).isEqualTo(CaptureMode.CONTINUOUS);
    }

    @Test
    void shouldBuildFreshStagesPerGeneration() {
        List<PipelineStage> first = factory.create(CaptureMode.GATED);
        List<PipelineStage> second = factory.create(CaptureMode.GATED);

        for (int i = 0; i < first.size(); i++) {
            assertThat(second.get(i)).isNotSameAs(first.get(i));
        }
    }
}
