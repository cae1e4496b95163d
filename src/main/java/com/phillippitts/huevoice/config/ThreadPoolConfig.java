package com.phillippitts.huevoice.config;

import com.phillippitts.huevoice.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Bounded executors for work that must not run on a stage thread.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.*}).
 * Both executors copy the Log4j2 ThreadContext (MDC) of the submitting thread into the task.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Remote recognition calls.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.CallerRunsPolicy}. When the pool and queue are
     * full the recognizer stage makes the call itself, which slows intake instead of dropping audio.
     */
    @Bean(name = "recognitionExecutor")
    public Executor recognitionExecutor() {
        return build(threadPoolProperties.getRecognition(), new ThreadPoolExecutor.CallerRunsPolicy());
    }

    /**
     * Sound cues, speech and notifications. One thread by default so spoken messages never overlap.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}; the feedback service logs and
     * drops the rejected item rather than blocking a stage.
     */
    @Bean(name = "feedbackExecutor")
    public Executor feedbackExecutor() {
        return build(threadPoolProperties.getFeedback(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static Executor build(ThreadPoolProperties.PoolProperties props, RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.setTaskDecorator(mdcPropagating());
        executor.initialize();
        return executor;
    }

    static TaskDecorator mdcPropagating() {
        return runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                Map<String, String> previous = ThreadContext.getImmutableContext();
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                    if (previous != null && !previous.isEmpty()) {
                        ThreadContext.putAll(previous);
                    }
                }
            };
        };
    }
}
