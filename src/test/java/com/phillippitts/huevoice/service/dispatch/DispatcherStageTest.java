package com.phillippitts.huevoice.service.dispatch;

import com.phillippitts.huevoice.domain.Command;
import com.phillippitts.huevoice.service.pipeline.PipelineChannels;
import com.phillippitts.huevoice.service.pipeline.PipelineError;
import com.phillippitts.huevoice.service.pipeline.ErrorKind;
import com.phillippitts.huevoice.service.pipeline.StageState;
import com.phillippitts.huevoice.service.pipeline.event.CommandReady;
import com.phillippitts.huevoice.service.pipeline.event.TimerFired;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DispatcherStageTest {

    private final PipelineChannels channels = new PipelineChannels(8);
    private final CommandDispatcher dispatcher = mock(CommandDispatcher.class);

    @Test
    void shouldDispatchCommandsAndTimersInArrivalOrder() throws Exception {
        // Arrange
        DispatcherStage stage = new DispatcherStage(channels, dispatcher, Duration.ofMillis(10));
        Command command = Command.of("turn on", Instant.parse("2024-05-01T20:00:00Z"));
        TimerFired fired = new TimerFired("timer-1", "turn off", Instant.parse("2024-05-01T20:05:00Z"));
        channels.commands().offer(CommandReady.of(command));
        channels.commands().offer(fired);

        // Act
        stage.runOnce();
        stage.runOnce();
        stage.runOnce();

        // Assert
        var order = inOrder(dispatcher);
        order.verify(dispatcher).dispatch(command);
        order.verify(dispatcher).dispatchTimer(fired);
    }

    @Test
    void shouldReportCrashAsStageFailure() {
        when(dispatcher.dispatch(any())).thenThrow(new IllegalStateException("boom"));
        DispatcherStage stage = new DispatcherStage(channels, dispatcher, Duration.ofMillis(10));
        channels.commands().offer(CommandReady.of(Command.of("turn on", Instant.now())));

        stage.start();
        await().atMost(Duration.ofSeconds(2)).until(() -> stage.state() == StageState.FAILED);
        stage.stop();

        PipelineError error = channels.errors().poll();
        assertThat(error).isNotNull();
        assertThat(error.kind()).isEqualTo(ErrorKind.STAGE_FAILURE);
        assertThat(error.stage()).isEqualTo("dispatcher");
        verify(dispatcher).dispatch(any());
    }
}
