package com.phillippitts.huevoice.presentation.controller;

import com.phillippitts.huevoice.domain.ScheduledTimer;
import com.phillippitts.huevoice.exception.CommandRejectedException;
import com.phillippitts.huevoice.service.dispatch.CommandDispatcher;
import com.phillippitts.huevoice.service.pipeline.CaptureMode;
import com.phillippitts.huevoice.service.pipeline.PipelineChannels;
import com.phillippitts.huevoice.service.pipeline.StageState;
import com.phillippitts.huevoice.service.pipeline.event.CommandReady;
import com.phillippitts.huevoice.service.pipeline.event.PipelineEvent;
import com.phillippitts.huevoice.service.supervisor.PipelineSupervisor;
import com.phillippitts.huevoice.service.supervisor.SupervisorState;
import com.phillippitts.huevoice.service.timer.TimerService;
import com.phillippitts.huevoice.testutil.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class PipelineControllerTest {

    private PipelineSupervisor supervisor;
    private TimerService timers;
    private CommandDispatcher dispatcher;
    private PipelineChannels channels;
    private PipelineController controller;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        supervisor = mock(PipelineSupervisor.class);
        timers = mock(TimerService.class);
        dispatcher = mock(CommandDispatcher.class);
        channels = new PipelineChannels(2);
        controller = new PipelineController(supervisor, channels, timers, dispatcher,
                MutableClock.startingAt("2024-05-01T20:00:00Z"));
        mvc = MockMvcBuilders.standaloneSetup(controller).build();
    }

    @Test
    void shouldReportPipelineStatus() throws Exception {
        when(supervisor.state()).thenReturn(SupervisorState.RUNNING);
        when(supervisor.mode()).thenReturn(CaptureMode.GATED);
        when(supervisor.stageStates()).thenReturn(Map.of("dispatcher", StageState.RUNNING));
        when(supervisor.restartCount()).thenReturn(2);
        when(dispatcher.undoDepth()).thenReturn(3);
        when(timers.activeTimers()).thenReturn(List.of(
                new ScheduledTimer("timer-1", Instant.parse("2024-05-01T20:05:00Z"), "turn off")));

        mvc.perform(get("/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.supervisor").value("RUNNING"))
                .andExpect(jsonPath("$.mode").value("GATED"))
                .andExpect(jsonPath("$.stages.dispatcher").value("RUNNING"))
                .andExpect(jsonPath("$.restarts").value(2))
                .andExpect(jsonPath("$.undoDepth").value(3))
                .andExpect(jsonPath("$.pendingCommands").value(0))
                .andExpect(jsonPath("$.activeTimers[0].id").value("timer-1"))
                .andExpect(jsonPath("$.activeTimers[0].action").value("turn off"));
    }

    @Test
    void shouldQueueTextCommand() throws Exception {
        // Act
        mvc.perform(post("/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"turn on and dim\"}"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.commandId").isNotEmpty())
                .andExpect(jsonPath("$.subCommands[0]").value("turn on"))
                .andExpect(jsonPath("$.subCommands[1]").value("dim"));

        // Assert
        PipelineEvent event = channels.commands().poll();
        assertThat(event).isInstanceOfSatisfying(CommandReady.class,
                ready -> assertThat(ready.command().rawText()).isEqualTo("turn on and dim"));
    }

    @Test
    void shouldRejectBlankText() throws Exception {
        mvc.perform(post("/commands")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\": \"  \"}"))
                .andExpect(status().isBadRequest());

        assertThat(channels.commands().size()).isZero();
    }

    @Test
    void shouldRejectWhenQueueFull() {
        controller.submit(new PipelineController.CommandRequest("turn on"));
        controller.submit(new PipelineController.CommandRequest("turn off"));

        assertThatThrownBy(() -> controller.submit(new PipelineController.CommandRequest("dim")))
                .isInstanceOf(CommandRejectedException.class)
                .hasMessageContaining("capacity 2");
    }
}
