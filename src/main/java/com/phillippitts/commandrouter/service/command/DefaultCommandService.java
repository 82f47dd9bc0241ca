package com.phillippitts.commandrouter.service.command;

import com.phillippitts.commandrouter.config.logging.LogContext;
import com.phillippitts.commandrouter.config.properties.WorkflowProperties;
import com.phillippitts.commandrouter.domain.CommandOutcome;
import com.phillippitts.commandrouter.domain.ExecutionResult;
import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.domain.WorkflowRequest;
import com.phillippitts.commandrouter.exception.CommandRouterException;
import com.phillippitts.commandrouter.exception.CommandTimeoutException;
import com.phillippitts.commandrouter.service.events.CommandCompletedEvent;
import com.phillippitts.commandrouter.service.metrics.CommandMetrics;
import com.phillippitts.commandrouter.service.workflow.WorkflowCoordinator;
import com.phillippitts.commandrouter.util.LogSanitizer;
import com.phillippitts.commandrouter.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Default {@link CommandService}: runs the coordinator, aggregates step results, records
 * metrics and publishes {@link CommandCompletedEvent}.
 *
 * <p>The correlation id is placed in the Log4j2 ThreadContext for the duration of processing.
 */
@Service
public class DefaultCommandService implements CommandService {

    private static final Logger LOG = LogManager.getLogger(DefaultCommandService.class);

    static final String FAILURE_MESSAGE = "Sorry, I couldn't process that command.";

    private final WorkflowCoordinator coordinator;
    private final CommandMetrics metrics;
    private final ApplicationEventPublisher publisher;
    private final Executor commandExecutor;
    private final long statelessTimeoutMs;

    public DefaultCommandService(WorkflowCoordinator coordinator,
                                 CommandMetrics metrics,
                                 ApplicationEventPublisher publisher,
                                 @Qualifier("commandExecutor") Executor commandExecutor,
                                 WorkflowProperties properties) {
        this.coordinator = coordinator;
        this.metrics = metrics;
        this.publisher = publisher;
        this.commandExecutor = commandExecutor;
        this.statelessTimeoutMs = properties.getStatelessTimeoutMs();
    }

    @Override
    public CommandOutcome process(WorkflowRequest request) {
        String correlationId = request.correlationId();
        String previous = ThreadContext.get(LogContext.CORRELATION_ID);
        ThreadContext.put(LogContext.CORRELATION_ID, correlationId);
        long start = System.nanoTime();
        try {
            LOG.info("Processing command: text='{}'", LogSanitizer.preview(request.utterance().text()));
            CommandOutcome outcome;
            try {
                List<ExecutionResult> results = coordinator.run(request);
                outcome = CommandOutcome.aggregate(correlationId, results);
            } catch (RuntimeException e) {
                LOG.error("Command processing failed", e);
                outcome = CommandOutcome.failure(correlationId, IntentCategory.CONVERSATION, FAILURE_MESSAGE);
            }
            long durationNanos = System.nanoTime() - start;
            metrics.recordCommand(outcome.intent().wireName(), outcome.success(), durationNanos);
            publisher.publishEvent(new CommandCompletedEvent(correlationId, outcome.intent(), outcome.success(),
                    outcome.steps().size(), durationNanos / TimeUtils.NANOS_PER_MILLI, Instant.now()));
            LOG.info("Command completed: intent={}, success={}, agent={}, durationMs={}",
                    outcome.intent().wireName(), outcome.success(), outcome.agentUsed(),
                    TimeUtils.elapsedMillis(start));
            return outcome;
        } finally {
            if (previous == null) {
                ThreadContext.remove(LogContext.CORRELATION_ID);
            } else {
                ThreadContext.put(LogContext.CORRELATION_ID, previous);
            }
        }
    }

    @Override
    public CommandOutcome processWithTimeout(WorkflowRequest request) {
        CompletableFuture<CommandOutcome> future = CompletableFuture.supplyAsync(() -> process(request), commandExecutor);
        try {
            return future.get(statelessTimeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            // In-flight executor work is not cancelled; its result is dropped
            future.cancel(false);
            LOG.warn("Stateless command exceeded {} ms: correlation={}", statelessTimeoutMs, request.correlationId());
            throw new CommandTimeoutException(request.correlationId(), statelessTimeoutMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CommandRouterException("Interrupted while processing command", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new CommandRouterException("Command processing failed", cause);
        }
    }
}
