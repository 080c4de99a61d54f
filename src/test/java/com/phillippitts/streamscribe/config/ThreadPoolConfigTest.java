package com.phillippitts.streamscribe.config;

import com.phillippitts.streamscribe.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    @AfterEach
    void clearContext() {
        ThreadContext.clearAll();
    }

    @Test
    void shouldCreateExecutorWithCorrectConfiguration() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        ThreadPoolConfig config = new ThreadPoolConfig(properties);
        Executor executor = config.streamingExecutor();

        assertThat(executor).isInstanceOf(ThreadPoolTaskExecutor.class);
        ThreadPoolTaskExecutor taskExecutor = (ThreadPoolTaskExecutor) executor;

        // Check against default property values
        assertThat(taskExecutor.getCorePoolSize()).isEqualTo(3);
        assertThat(taskExecutor.getMaxPoolSize()).isEqualTo(4);
        assertThat(taskExecutor.getThreadNamePrefix()).isEqualTo("stream-pool-");
        assertThat(taskExecutor.getThreadPoolExecutor().getRejectedExecutionHandler())
                .isInstanceOf(ThreadPoolExecutor.AbortPolicy.class);
        taskExecutor.shutdown();
    }

    @Test
    void runsThreeLongTasksConcurrently() throws InterruptedException {
        ThreadPoolTaskExecutor executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties())
                .streamingExecutor();
        CountDownLatch allRunning = new CountDownLatch(3);
        CountDownLatch release = new CountDownLatch(1);

        for (int i = 0; i < 3; i++) {
            executor.execute(() -> {
                allRunning.countDown();
                try {
                    release.await(2, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
        }

        assertThat(allRunning.await(2, TimeUnit.SECONDS)).isTrue();
        release.countDown();
        executor.shutdown();
    }

    @Test
    void propagatesMdcToWorkerThreads() throws InterruptedException {
        Executor executor = new ThreadPoolConfig(new ThreadPoolProperties()).streamingExecutor();
        ThreadContext.put("sessionId", "s-42");
        CountDownLatch latch = new CountDownLatch(1);
        AtomicReference<String> seen = new AtomicReference<>();
        AtomicReference<String> threadName = new AtomicReference<>();

        executor.execute(() -> {
            seen.set(ThreadContext.get("sessionId"));
            threadName.set(Thread.currentThread().getName());
            latch.countDown();
        });

        assertThat(latch.await(1, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("s-42");
        assertThat(threadName.get()).startsWith("stream-pool-");
        ((ThreadPoolTaskExecutor) executor).shutdown();
    }

    @Test
    void rejectsPoolTooSmallForThePipelineLoops() {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.getStream().setCorePoolSize(2);

        assertThatThrownBy(() -> new ThreadPoolConfig(properties).streamingExecutor())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("at least 3");
    }
}
