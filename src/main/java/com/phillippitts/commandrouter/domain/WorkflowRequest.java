package com.phillippitts.commandrouter.domain;

import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One inbound command, identified by its correlation id.
 *
 * <p>{@code steps} is empty when the utterance still has to be classified. Callers that already
 * know the intent (stateless API with an explicit intent) pass a single pre-parsed step.
 *
 * @param correlationId unique for the lifetime of the request
 * @param utterance     the original text
 * @param steps         pre-parsed steps, possibly empty (immutable)
 */
public record WorkflowRequest(String correlationId, Utterance utterance, List<ParsedCommand> steps) {

    public WorkflowRequest {
        Objects.requireNonNull(utterance, "utterance");
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = newCorrelationId();
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static WorkflowRequest of(String correlationId, Utterance utterance) {
        return new WorkflowRequest(correlationId, utterance, List.of());
    }

    public boolean isPreParsed() {
        return !steps.isEmpty();
    }

    public static String newCorrelationId() {
        return UUID.randomUUID().toString();
    }
}
