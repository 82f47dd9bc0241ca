package com.phillippitts.commandrouter.config;

import com.phillippitts.commandrouter.config.properties.ThreadPoolProperties;
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
 * Thread pools for command processing.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} ({@code threadpool.command.*},
 * {@code threadpool.classifier.*}, {@code threadpool.action.*}).
 *
 * <p>Every pool copies the Log4j2 ThreadContext (correlationId, connectionId) from the
 * submitting thread to the worker thread so async logs keep their correlation.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Runs per-connection serial lanes and stateless command calls.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A lane task must never run on
     * the WebSocket I/O thread, so saturation surfaces as a rejected command instead.
     */
    @Bean(name = "commandExecutor")
    public Executor commandExecutor() {
        return build(threadPoolProperties.getCommand(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Runs fallback model calls. Bounded by the classifier timeout.
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A rejected call degrades the
     * classification instead of running unbounded on the caller.
     */
    @Bean(name = "classifierExecutor")
    public Executor classifierExecutor() {
        return build(threadPoolProperties.getClassifier(), new ThreadPoolExecutor.AbortPolicy());
    }

    /**
     * Runs action executor calls. Bounded by the executor timeout; a rejected call becomes a
     * failed step.
     */
    @Bean(name = "actionExecutor")
    public Executor actionExecutor() {
        return build(threadPoolProperties.getAction(), new ThreadPoolExecutor.AbortPolicy());
    }

    private static ThreadPoolTaskExecutor build(ThreadPoolProperties.PoolProperties props,
                                                RejectedExecutionHandler rejection) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(props.getCorePoolSize());
        executor.setMaxPoolSize(props.getMaxPoolSize());
        executor.setQueueCapacity(props.getQueueCapacity());
        executor.setThreadNamePrefix(props.getThreadNamePrefix());
        executor.setKeepAliveSeconds(props.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(rejection);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.setTaskDecorator(threadContextDecorator());
        executor.initialize();
        return executor;
    }

    /**
     * Copies the submitter's ThreadContext into the worker and restores the worker's own
     * context afterwards.
     */
    static TaskDecorator threadContextDecorator() {
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
