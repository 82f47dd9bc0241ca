package com.phillippitts.commandrouter.service.workflow;

import com.phillippitts.commandrouter.config.properties.WorkflowProperties;
import com.phillippitts.commandrouter.domain.ExecutionResult;
import com.phillippitts.commandrouter.domain.ParsedCommand;
import com.phillippitts.commandrouter.exception.ExecutorException;
import com.phillippitts.commandrouter.service.executor.ActionExecutor;
import com.phillippitts.commandrouter.service.executor.ActionOutcome;
import com.phillippitts.commandrouter.service.metrics.CommandMetrics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs one action executor on the action pool under {@code router.workflow.executor-timeout-ms}.
 *
 * <p>Never throws: rejections, exceptions and timeouts become a failed {@link ExecutionResult} with a generic
 * message plus the intent's failure hint. No retries.
 */
@Component
public class ExecutorInvoker {

    private static final Logger LOG = LogManager.getLogger(ExecutorInvoker.class);

    static final String TIMEOUT_MESSAGE = "That took too long to complete.";
    static final String ERROR_MESSAGE = "Something went wrong while handling that.";
    static final String BUSY_MESSAGE = "I'm handling too many requests right now.";

    private final Executor actionExecutor;
    private final long timeoutMs;
    private final CommandMetrics metrics;

    public ExecutorInvoker(@Qualifier("actionExecutor") Executor actionExecutor,
                           WorkflowProperties properties,
                           CommandMetrics metrics) {
        this.actionExecutor = actionExecutor;
        this.timeoutMs = properties.getExecutorTimeoutMs();
        this.metrics = metrics;
    }

    public ExecutionResult invoke(ActionExecutor executor, ParsedCommand command) {
        CompletableFuture<ActionOutcome> future;
        try {
            future = CompletableFuture.supplyAsync(() -> executor.execute(command.slots()), actionExecutor);
        } catch (RejectedExecutionException e) {
            metrics.incrementExecutorFailure(executor.name(), "rejected");
            LOG.warn("Action pool saturated, executor {} not started", executor.name());
            return failure(executor, command, BUSY_MESSAGE, "rejected");
        }
        try {
            ActionOutcome outcome = future.get(timeoutMs, TimeUnit.MILLISECONDS);
            if (outcome == null) {
                throw new ExecutorException("Executor returned no outcome", executor.name());
            }
            return new ExecutionResult(outcome.success(), outcome.message(), outcome.payload(),
                    executor.name(), command.intent(), Instant.now());
        } catch (TimeoutException e) {
            future.cancel(true);
            metrics.incrementExecutorFailure(executor.name(), "timeout");
            LOG.warn("Executor {} timed out after {} ms", executor.name(), timeoutMs);
            return failure(executor, command, TIMEOUT_MESSAGE, "timeout");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            metrics.incrementExecutorFailure(executor.name(), "interrupted");
            LOG.warn("Interrupted while waiting for executor {}", executor.name());
            return failure(executor, command, ERROR_MESSAGE, "interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            ExecutorException wrapped = new ExecutorException("Executor failed", executor.name(), cause);
            metrics.incrementExecutorFailure(executor.name(), "error");
            LOG.error(wrapped.getMessage(), wrapped);
            return failure(executor, command, ERROR_MESSAGE, "error");
        } catch (ExecutorException e) {
            metrics.incrementExecutorFailure(executor.name(), "error");
            LOG.error(e.getMessage());
            return failure(executor, command, ERROR_MESSAGE, "error");
        }
    }

    private static ExecutionResult failure(ActionExecutor executor, ParsedCommand command, String message, String reason) {
        return ExecutionResult.failure(message + " " + command.intent().failureHint(),
                Map.of("error", reason), executor.name(), command.intent());
    }
}
