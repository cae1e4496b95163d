package com.phillippitts.huevoice.presentation.controller;

import com.phillippitts.huevoice.domain.Command;
import com.phillippitts.huevoice.domain.ScheduledTimer;
import com.phillippitts.huevoice.exception.CommandRejectedException;
import com.phillippitts.huevoice.service.dispatch.CommandDispatcher;
import com.phillippitts.huevoice.service.pipeline.PipelineChannels;
import com.phillippitts.huevoice.service.pipeline.event.CommandReady;
import com.phillippitts.huevoice.service.supervisor.PipelineSupervisor;
import com.phillippitts.huevoice.service.timer.TimerService;
import com.phillippitts.huevoice.util.LogSanitizer;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Local HTTP surface: pipeline status, and text commands injected as if they had been spoken.
 */
@RestController
class PipelineController {

    private static final Logger LOG = LogManager.getLogger(PipelineController.class);

    private final PipelineSupervisor supervisor;
    private final PipelineChannels channels;
    private final TimerService timers;
    private final CommandDispatcher dispatcher;
    private final Clock clock;

    PipelineController(PipelineSupervisor supervisor,
                       PipelineChannels channels,
                       TimerService timers,
                       CommandDispatcher dispatcher,
                       Clock clock) {
        this.supervisor = supervisor;
        this.channels = channels;
        this.timers = timers;
        this.dispatcher = dispatcher;
        this.clock = clock;
    }

    @GetMapping("/status")
    ResponseEntity<Map<String, Object>> status() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("supervisor", supervisor.state());
        body.put("mode", supervisor.mode());
        body.put("stages", supervisor.stageStates());
        body.put("restarts", supervisor.restartCount());
        body.put("undoDepth", dispatcher.undoDepth());
        body.put("pendingCommands", channels.commands().size());
        body.put("activeTimers", timers.activeTimers().stream().map(PipelineController::timerView).toList());
        return ResponseEntity.ok(body);
    }

    /**
     * Queues a text command for the dispatcher. Bypasses recognition and the confidence gate.
     */
    @PostMapping("/commands")
    ResponseEntity<Map<String, Object>> submit(@Valid @RequestBody CommandRequest request) {
        Command command = Command.of(request.text(), clock.instant());
        if (!channels.commands().offer(CommandReady.of(command))) {
            throw new CommandRejectedException("Command queue full (capacity " + channels.commands().capacity() + ")");
        }
        LOG.info("Queued text command {}: '{}'", command.id(), LogSanitizer.preview(command.rawText()));
        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("commandId", command.id(), "subCommands", command.subCommands()));
    }

    private static Map<String, Object> timerView(ScheduledTimer t) {
        return Map.of("id", t.id(), "action", t.action(), "fireAt", t.fireAt().toString());
    }

    record CommandRequest(@NotBlank String text) {
    }
}
