package com.phillippitts.huevoice.service.dispatch;

import com.phillippitts.huevoice.service.pipeline.AbstractPipelineStage;
import com.phillippitts.huevoice.service.pipeline.PipelineChannels;
import com.phillippitts.huevoice.service.pipeline.event.CommandReady;
import com.phillippitts.huevoice.service.pipeline.event.PipelineEvent;
import com.phillippitts.huevoice.service.pipeline.event.TimerFired;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;

/**
 * Worker that takes {@link CommandReady} and {@link TimerFired} events off the command channel and
 * hands them to the {@link CommandDispatcher}, one at a time.
 */
public class DispatcherStage extends AbstractPipelineStage {

    private static final Logger LOG = LogManager.getLogger(DispatcherStage.class);

    private final PipelineChannels channels;
    private final CommandDispatcher dispatcher;
    private final Duration pollTimeout;

    public DispatcherStage(PipelineChannels channels, CommandDispatcher dispatcher, Duration pollTimeout) {
        super("dispatcher", channels.errors());
        this.channels = channels;
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.pollTimeout = pollTimeout;
    }

    @Override
    protected void runOnce() throws InterruptedException {
        PipelineEvent event = channels.commands().poll(pollTimeout);
        if (event == null) {
            return;
        }
        if (event instanceof CommandReady ready) {
            dispatcher.dispatch(ready.command());
        } else if (event instanceof TimerFired fired) {
            dispatcher.dispatchTimer(fired);
        } else {
            LOG.warn("Dispatcher ignoring unexpected {}", event.getClass().getSimpleName());
        }
    }
}
