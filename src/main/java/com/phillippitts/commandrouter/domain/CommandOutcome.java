package com.phillippitts.commandrouter.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * The single aggregated outcome delivered for one correlation id.
 *
 * <p>For single dispatch {@code steps} holds one result. For a pipeline it holds the results
 * of every step that ran; {@code failedStep} is the zero-based index of the step that failed,
 * or -1 when all steps succeeded.
 */
public record CommandOutcome(
        String correlationId,
        IntentCategory intent,
        boolean success,
        String message,
        String agentUsed,
        List<ExecutionResult> steps,
        int failedStep,
        Instant timestamp
) {

    public CommandOutcome {
        Objects.requireNonNull(correlationId, "correlationId");
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(message, "message");
        agentUsed = agentUsed == null ? "none" : agentUsed;
        steps = steps == null ? List.of() : List.copyOf(steps);
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    /**
     * Aggregates step results. The outcome succeeds only if every step succeeded; its message
     * and intent are those of the failing step, or of the last step otherwise.
     */
    public static CommandOutcome aggregate(String correlationId, List<ExecutionResult> steps) {
        if (steps == null || steps.isEmpty()) {
            return failure(correlationId, IntentCategory.CONVERSATION,
                    "Sorry, I couldn't process that command.");
        }
        int failed = -1;
        for (int i = 0; i < steps.size(); i++) {
            if (!steps.get(i).success()) {
                failed = i;
                break;
            }
        }
        ExecutionResult headline = failed >= 0 ? steps.get(failed) : steps.get(steps.size() - 1);
        return new CommandOutcome(correlationId, headline.intent(), failed < 0, headline.message(),
                headline.executorName(), steps, failed, Instant.now());
    }

    public static CommandOutcome failure(String correlationId, IntentCategory intent, String message) {
        return new CommandOutcome(correlationId, intent, false, message, "none", List.of(), -1, Instant.now());
    }
}
