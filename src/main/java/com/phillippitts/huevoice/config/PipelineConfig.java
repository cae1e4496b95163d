package com.phillippitts.huevoice.config;

import com.phillippitts.huevoice.config.properties.BridgeProperties;
import com.phillippitts.huevoice.config.properties.CommandAliasProperties;
import com.phillippitts.huevoice.config.properties.DispatcherProperties;
import com.phillippitts.huevoice.config.properties.PipelineProperties;
import com.phillippitts.huevoice.config.properties.RecognitionProperties;
import com.phillippitts.huevoice.service.bridge.DeviceBridge;
import com.phillippitts.huevoice.service.bridge.LightStateCache;
import com.phillippitts.huevoice.service.dispatch.ActionRegistry;
import com.phillippitts.huevoice.service.dispatch.CommandDispatcher;
import com.phillippitts.huevoice.service.dispatch.CommandInterpreter;
import com.phillippitts.huevoice.service.dispatch.LightActions;
import com.phillippitts.huevoice.service.dispatch.UndoStack;
import com.phillippitts.huevoice.service.feedback.FeedbackService;
import com.phillippitts.huevoice.service.metrics.PipelineMetrics;
import com.phillippitts.huevoice.service.pipeline.CooldownTracker;
import com.phillippitts.huevoice.service.pipeline.PipelineChannels;
import com.phillippitts.huevoice.service.recognition.ConfidenceGate;
import com.phillippitts.huevoice.service.supervisor.ApplicationExit;
import com.phillippitts.huevoice.service.timer.TimerService;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Long-lived pipeline collaborators. These outlive individual stage generations, so a supervisor
 * restart keeps pending commands, timers, undo history and the device cache.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public TaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.initialize();
        return scheduler;
    }

    @Bean
    public PipelineChannels pipelineChannels(PipelineProperties props) {
        return new PipelineChannels(props.getChannelCapacity());
    }

    @Bean
    public LightStateCache lightStateCache(DeviceBridge deviceBridge, Clock clock, BridgeProperties props) {
        return new LightStateCache(deviceBridge, clock, props.getCacheTtl());
    }

    @Bean
    public UndoStack undoStack(DispatcherProperties props) {
        return new UndoStack(props.getUndoDepth());
    }

    @Bean
    public CooldownTracker cooldownTracker(Clock clock, DispatcherProperties props) {
        return new CooldownTracker(clock, props.getCooldown());
    }

    @Bean
    public TimerService timerService(TaskScheduler taskScheduler, Clock clock,
                                     PipelineChannels channels, FeedbackService feedback) {
        return new TimerService(taskScheduler, clock, channels.commands(), feedback);
    }

    @Bean
    public LightActions lightActions(DispatcherProperties props) {
        return new LightActions(props);
    }

    @Bean
    public ActionRegistry actionRegistry(CommandAliasProperties aliases, LightActions actions,
                                         DispatcherProperties props) {
        return new ActionRegistry(aliases, actions.handlers(), props.getFuzzyThreshold());
    }

    @Bean
    public CommandInterpreter commandInterpreter(ActionRegistry registry) {
        return new CommandInterpreter(registry);
    }

    /** Shared across stage generations so a restart does not forget recent commands. */
    @Bean
    public ConfidenceGate confidenceGate(RecognitionProperties props) {
        return new ConfidenceGate(props.getConfidenceThreshold(), props.getDebounceWindow());
    }

    @Bean
    public CommandDispatcher commandDispatcher(CommandInterpreter interpreter,
                                               ActionRegistry registry,
                                               LightActions actions,
                                               LightStateCache cache,
                                               UndoStack undoStack,
                                               TimerService timers,
                                               FeedbackService feedback,
                                               CooldownTracker cooldown,
                                               PipelineMetrics metrics,
                                               PipelineChannels channels,
                                               Clock clock) {
        return new CommandDispatcher(interpreter, registry, actions, cache, undoStack, timers, feedback,
                cooldown, metrics, channels.errors(), clock);
    }

    @Bean
    public ApplicationExit applicationExit(ApplicationContext context) {
        return status -> System.exit(SpringApplication.exit(context, () -> status));
    }
}
