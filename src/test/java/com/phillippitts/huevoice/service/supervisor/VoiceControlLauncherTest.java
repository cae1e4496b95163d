package com.phillippitts.huevoice.service.supervisor;

import com.phillippitts.huevoice.config.properties.PipelineProperties;
import com.phillippitts.huevoice.exception.BridgePairingException;
import com.phillippitts.huevoice.exception.WakeWordUnavailableException;
import com.phillippitts.huevoice.service.bridge.BridgeConnector;
import com.phillippitts.huevoice.service.pipeline.CaptureMode;
import com.phillippitts.huevoice.service.supervisor.event.PipelineFailedEvent;
import com.phillippitts.huevoice.service.timer.TimerService;
import com.phillippitts.huevoice.testutil.RecordingFeedbackService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.awaitility.Awaitility.await;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class VoiceControlLauncherTest {

    private BridgeConnector connector;
    private PipelineSupervisor supervisor;
    private TimerService timers;
    private RecordingFeedbackService feedback;
    private AtomicInteger exitStatus;

    @BeforeEach
    void setUp() {
        connector = mock(BridgeConnector.class);
        supervisor = mock(PipelineSupervisor.class);
        timers = mock(TimerService.class);
        feedback = new RecordingFeedbackService();
        exitStatus = new AtomicInteger(-1);
    }

    @Test
    void shouldConnectBridgeBeforeStartingPipeline() {
        CaptureMode mode = launcher(true).launch(CaptureMode.GATED);

        assertThat(mode).isEqualTo(CaptureMode.GATED);
        var order = inOrder(connector, supervisor);
        order.verify(connector).connect();
        order.verify(supervisor).start(CaptureMode.GATED);
        assertThat(feedback.notifications())
                .containsExactly("Voice control started. Say the wake word to begin.");
    }

    @Test
    void shouldFallBackToContinuousWhenNoWakeWord() {
        doThrow(new WakeWordUnavailableException(List.of("philips"), null))
                .when(supervisor).start(CaptureMode.GATED);

        CaptureMode mode = launcher(true).launch(CaptureMode.GATED);

        assertThat(mode).isEqualTo(CaptureMode.CONTINUOUS);
        verify(supervisor).start(CaptureMode.CONTINUOUS);
        assertThat(feedback.notifications())
                .containsExactly("Voice control started in continuous listening mode");
    }

    @Test
    void shouldPropagateWakeWordFailureWhenFallbackDisabled() {
        doThrow(new WakeWordUnavailableException(List.of("philips"), null))
                .when(supervisor).start(CaptureMode.GATED);

        assertThatThrownBy(() -> launcher(false).launch(CaptureMode.GATED))
                .isInstanceOf(WakeWordUnavailableException.class);
        verify(supervisor, never()).start(CaptureMode.CONTINUOUS);
    }

    @Test
    void shouldNotStartPipelineWithoutBridge() {
        when(connector.connect()).thenThrow(new BridgePairingException("No bridge address configured", "<unset>"));

        assertThatThrownBy(() -> launcher(true).launch(CaptureMode.GATED))
                .isInstanceOf(BridgePairingException.class);
        verifyNoInteractions(supervisor);
    }

    @Test
    void shouldHonourFallbackOption() {
        launcher(true).run(new DefaultApplicationArguments("--fallback"));

        verify(supervisor).start(CaptureMode.CONTINUOUS);
    }

    @Test
    void shouldSkipStartWhenAutoStartDisabled() {
        VoiceControlLauncher launcher = new VoiceControlLauncher(new PipelineProperties(false, true, null, null),
                connector, supervisor, timers, feedback, exitStatus::set);

        launcher.run(new DefaultApplicationArguments());

        verifyNoInteractions(connector, supervisor);
    }

    @Test
    void shouldExitWithStatusOneWhenPipelineFails() {
        launcher(true).onPipelineFailed(new PipelineFailedEvent("restart failed", null, Instant.now()));

        await().atMost(Duration.ofSeconds(2)).until(() -> exitStatus.get() == 1);
    }

    @Test
    void shouldStopPipelineAndTimersOnShutdown() {
        launcher(true).shutdown();

        verify(supervisor).stop();
        verify(timers).cancelAll();
    }

    private VoiceControlLauncher launcher(boolean autoFallback) {
        return new VoiceControlLauncher(new PipelineProperties(true, autoFallback, null, null),
                connector, supervisor, timers, feedback, exitStatus::set);
    }
}
