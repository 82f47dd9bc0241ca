package com.phillippitts.commandrouter.service.workflow;

import com.phillippitts.commandrouter.config.properties.WorkflowProperties;
import com.phillippitts.commandrouter.domain.ExecutionResult;
import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.domain.ParsedCommand;
import com.phillippitts.commandrouter.service.executor.ActionOutcome;
import com.phillippitts.commandrouter.service.metrics.CommandMetrics;
import com.phillippitts.commandrouter.testutil.RecordingExecutor;
import com.phillippitts.commandrouter.testutil.SyncExecutor;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class ExecutorInvokerTest {

    private final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    private final CommandMetrics metrics = new CommandMetrics(registry);
    private final ParsedCommand command =
            new ParsedCommand(IntentCategory.WEB_SEARCH, 0.8, Map.of("query", "cats"), "search for cats");

    @Test
    void successfulOutcomeIsWrappedWithExecutorAndIntent() {
        ExecutorInvoker invoker = new ExecutorInvoker(new SyncExecutor(), new WorkflowProperties(1000L, 5000L), metrics);
        RecordingExecutor search = RecordingExecutor.succeeding("web_search", IntentCategory.WEB_SEARCH,
                "Searching for cats", Map.of("url", "https://www.google.com/search?q=cats"));

        ExecutionResult result = invoker.invoke(search, command);

        assertThat(result.success()).isTrue();
        assertThat(result.executorName()).isEqualTo("web_search");
        assertThat(result.intent()).isEqualTo(IntentCategory.WEB_SEARCH);
        assertThat(result.payload()).containsKey("url");
        assertThat(search.calls).singleElement().isEqualTo(Map.of("query", "cats"));
    }

    @Test
    void slowExecutorTimesOut() {
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            ExecutorInvoker invoker = new ExecutorInvoker(pool, new WorkflowProperties(50L, 5000L), metrics);
            RecordingExecutor slow = new RecordingExecutor("web_search", IntentCategory.WEB_SEARCH, params -> {
                try {
                    Thread.sleep(2000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return ActionOutcome.success("late", Map.of());
            });

            ExecutionResult result = invoker.invoke(slow, command);

            assertThat(result.success()).isFalse();
            assertThat(result.message()).startsWith(ExecutorInvoker.TIMEOUT_MESSAGE)
                    .endsWith(IntentCategory.WEB_SEARCH.failureHint());
            assertThat(result.payload()).containsEntry("error", "timeout");
            assertThat(registry.find("commandrouter.executor.failure").tag("reason", "timeout").counter().count())
                    .isEqualTo(1.0);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void saturatedPoolFailsFastInsteadOfRunningOnCaller() {
        ThreadPoolExecutor pool = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new SynchronousQueue<>(), new ThreadPoolExecutor.AbortPolicy());
        CountDownLatch release = new CountDownLatch(1);
        try {
            pool.execute(() -> {
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            ExecutorInvoker invoker = new ExecutorInvoker(pool, new WorkflowProperties(200L, 5000L), metrics);
            RecordingExecutor slow = new RecordingExecutor("web_search", IntentCategory.WEB_SEARCH, params -> {
                try {
                    Thread.sleep(2000);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return ActionOutcome.success("late", Map.of());
            });

            long start = System.nanoTime();
            ExecutionResult result = invoker.invoke(slow, command);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

            assertThat(elapsedMs).isLessThan(1000);
            assertThat(result.success()).isFalse();
            assertThat(result.message()).startsWith(ExecutorInvoker.BUSY_MESSAGE);
            assertThat(result.payload()).containsEntry("error", "rejected");
            assertThat(slow.calls).isEmpty();
            assertThat(registry.find("commandrouter.executor.failure").tag("reason", "rejected").counter().count())
                    .isEqualTo(1.0);
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void throwingExecutorBecomesGenericFailure() {
        ExecutorInvoker invoker = new ExecutorInvoker(new SyncExecutor(), new WorkflowProperties(1000L, 5000L), metrics);
        RecordingExecutor broken = new RecordingExecutor("web_search", IntentCategory.WEB_SEARCH, params -> {
            throw new IllegalStateException("secret internal detail");
        });

        ExecutionResult result = invoker.invoke(broken, command);

        assertThat(result.success()).isFalse();
        assertThat(result.message()).startsWith(ExecutorInvoker.ERROR_MESSAGE).doesNotContain("secret");
        assertThat(result.payload()).containsEntry("error", "error");
    }

    @Test
    void nullOutcomeIsTreatedAsError() {
        ExecutorInvoker invoker = new ExecutorInvoker(new SyncExecutor(), new WorkflowProperties(1000L, 5000L), metrics);
        RecordingExecutor silent = new RecordingExecutor("web_search", IntentCategory.WEB_SEARCH, params -> null);

        ExecutionResult result = invoker.invoke(silent, command);

        assertThat(result.success()).isFalse();
        assertThat(result.message()).startsWith(ExecutorInvoker.ERROR_MESSAGE);
    }
}
