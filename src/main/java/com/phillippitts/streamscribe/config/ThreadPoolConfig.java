package com.phillippitts.streamscribe.config;

import com.phillippitts.streamscribe.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Configuration for the thread pool that runs the streaming loops.
 *
 * <p>Pool sizes are configured via {@link ThreadPoolProperties} and can be tuned
 * in application.properties.
 */
@Configuration
public class ThreadPoolConfig {

    private final ThreadPoolProperties threadPoolProperties;

    public ThreadPoolConfig(ThreadPoolProperties threadPoolProperties) {
        this.threadPoolProperties = threadPoolProperties;
    }

    /**
     * Creates the executor hosting the capture, pump and receiver tasks of a streaming run.
     *
     * <p>Pool sizing configured via {@code threadpool.stream.*} properties:
     * <ul>
     *   <li>Core pool: default 3 - one thread per long-running loop</li>
     *   <li>Max pool: default 4</li>
     *   <li>Queue: default 4 tasks</li>
     * </ul>
     *
     * <p>Rejection policy: {@link ThreadPoolExecutor.AbortPolicy}. A long-running loop must never
     * execute on the submitting thread, so an exhausted pool fails the run instead.
     *
     * <p>MDC propagation: Copies Log4j2 ThreadContext (MDC) from the submitting thread to
     * the worker thread so {@code sessionId} and {@code taskId} appear in task logs.
     *
     * @return Configured executor for streaming tasks
     */
    @Bean(name = "streamingExecutor")
    public Executor streamingExecutor() {
        ThreadPoolProperties.StreamPoolProperties streamProps = threadPoolProperties.getStream();
        if (streamProps.getCorePoolSize() < 3) {
            throw new IllegalStateException(
                    "threadpool.stream.core-pool-size must be at least 3, was " + streamProps.getCorePoolSize());
        }

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(streamProps.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(streamProps.getMaxPoolSize(), streamProps.getCorePoolSize()));
        executor.setQueueCapacity(streamProps.getQueueCapacity());
        executor.setThreadNamePrefix(streamProps.getThreadNamePrefix());
        executor.setKeepAliveSeconds(streamProps.getKeepAliveSeconds());
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        // Propagate MDC to worker threads
        executor.setTaskDecorator(runnable -> {
            Map<String, String> contextMap = ThreadContext.getImmutableContext();
            return () -> {
                try {
                    if (contextMap != null && !contextMap.isEmpty()) {
                        ThreadContext.putAll(contextMap);
                    }
                    runnable.run();
                } finally {
                    ThreadContext.clearAll();
                }
            };
        });

        executor.initialize();
        return executor;
    }
}
