package com.phillippitts.commandrouter.service.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for command routing.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>end-to-end command latency per intent</li>
 *   <li>success/failure counts per intent</li>
 *   <li>fallback classifier outcomes (model, timeout, error, unparseable, skipped)</li>
 *   <li>results discarded because the connection had closed</li>
 * </ul>
 */
@Component
public class CommandMetrics {

    private static final String METRIC_PREFIX = "commandrouter";

    private final MeterRegistry registry;

    public CommandMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records command latency and outcome for an intent.
     *
     * @param intent        wire name of the intent
     * @param success       whether the aggregated outcome succeeded
     * @param durationNanos duration in nanoseconds
     */
    public void recordCommand(String intent, boolean success, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".command.latency")
                .description("Time from command receipt to aggregated outcome")
                .tag("intent", intent)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
        Counter.builder(METRIC_PREFIX + ".command." + (success ? "success" : "failure"))
                .description("Number of completed commands by outcome")
                .tag("intent", intent)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome one of model, timeout, error, unparseable, skipped
     */
    public void recordFallback(String outcome) {
        Counter.builder(METRIC_PREFIX + ".classifier.fallback")
                .description("Fallback classifier invocations by outcome")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void incrementExecutorFailure(String executorName, String reason) {
        Counter.builder(METRIC_PREFIX + ".executor.failure")
                .description("Action executor failures")
                .tag("executor", executorName)
                .tag("reason", reason)
                .register(registry)
                .increment();
    }

    public void incrementDiscardedResult() {
        Counter.builder(METRIC_PREFIX + ".channel.discarded")
                .description("Results dropped because the connection was gone")
                .register(registry)
                .increment();
    }
}
