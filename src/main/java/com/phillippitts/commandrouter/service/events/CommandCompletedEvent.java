package com.phillippitts.commandrouter.service.events;

import com.phillippitts.commandrouter.domain.IntentCategory;

import java.time.Instant;

/**
 * Published once per processed command, after its outcome is aggregated.
 *
 * <p>PII note: carries no utterance text or slot values.
 */
public record CommandCompletedEvent(
        String correlationId,
        IntentCategory intent,
        boolean success,
        int steps,
        long durationMs,
        Instant at
) {
    public CommandCompletedEvent {
        if (at == null) {
            at = Instant.now();
        }
    }
}
