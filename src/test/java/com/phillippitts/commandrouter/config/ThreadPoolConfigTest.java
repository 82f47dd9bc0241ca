package com.phillippitts.commandrouter.config;

import com.phillippitts.commandrouter.config.logging.LogContext;
import com.phillippitts.commandrouter.config.properties.ThreadPoolProperties;
import org.apache.logging.log4j.ThreadContext;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThreadPoolConfigTest {

    private ThreadPoolTaskExecutor executor;

    @AfterEach
    void tearDown() {
        if (executor != null) {
            executor.shutdown();
        }
        ThreadContext.clearAll();
    }

    @Test
    void commandPoolUsesConfiguredDefaults() {
        executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).commandExecutor();

        assertThat(executor.getCorePoolSize()).isEqualTo(8);
        assertThat(executor.getMaxPoolSize()).isEqualTo(32);
        assertThat(executor.getThreadNamePrefix()).isEqualTo("command-pool-");
    }

    @Test
    void saturatedCommandPoolRejectsInsteadOfRunningOnCaller() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.setCommand(new ThreadPoolProperties.PoolProperties(1, 1, 1, "tiny-"));
        executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(properties).commandExecutor();
        CountDownLatch release = new CountDownLatch(1);
        Runnable blocker = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };

        try {
            executor.execute(blocker);
            executor.execute(blocker);
            assertThatThrownBy(() -> executor.execute(blocker)).isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
        }
    }

    @Test
    void saturatedClassifierAndActionPoolsRejectInsteadOfRunningOnCaller() throws InterruptedException {
        ThreadPoolProperties properties = new ThreadPoolProperties();
        properties.setClassifier(new ThreadPoolProperties.PoolProperties(1, 1, 0, "tiny-classifier-"));
        properties.setAction(new ThreadPoolProperties.PoolProperties(1, 1, 0, "tiny-action-"));
        ThreadPoolConfig config = new ThreadPoolConfig(properties);
        ThreadPoolTaskExecutor classifier = (ThreadPoolTaskExecutor) config.classifierExecutor();
        ThreadPoolTaskExecutor action = (ThreadPoolTaskExecutor) config.actionExecutor();
        CountDownLatch release = new CountDownLatch(1);
        Runnable blocker = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        };

        try {
            classifier.execute(blocker);
            action.execute(blocker);
            assertThatThrownBy(() -> classifier.execute(blocker)).isInstanceOf(RejectedExecutionException.class);
            assertThatThrownBy(() -> action.execute(blocker)).isInstanceOf(RejectedExecutionException.class);
        } finally {
            release.countDown();
            classifier.shutdown();
            action.shutdown();
        }
    }

    @Test
    void workerSeesSubmittersThreadContext() throws InterruptedException {
        executor = (ThreadPoolTaskExecutor) new ThreadPoolConfig(new ThreadPoolProperties()).actionExecutor();
        AtomicReference<String> seen = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        ThreadContext.put(LogContext.CORRELATION_ID, "corr-42");
        executor.execute(() -> {
            seen.set(ThreadContext.get(LogContext.CORRELATION_ID));
            done.countDown();
        });

        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(seen.get()).isEqualTo("corr-42");
    }

    @Test
    void decoratorRestoresWorkerContext() {
        ThreadContext.put(LogContext.CORRELATION_ID, "submitter");
        Runnable decorated = ThreadPoolConfig.threadContextDecorator().decorate(
                () -> assertThat(ThreadContext.get(LogContext.CORRELATION_ID)).isEqualTo("submitter"));

        ThreadContext.clearAll();
        ThreadContext.put(LogContext.CONNECTION_ID, "worker-own");
        decorated.run();

        assertThat(ThreadContext.get(LogContext.CONNECTION_ID)).isEqualTo("worker-own");
        assertThat(ThreadContext.get(LogContext.CORRELATION_ID)).isNull();
    }
}
