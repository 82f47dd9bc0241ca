package com.phillippitts.commandrouter.domain;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of one workflow step.
 *
 * @param success      whether the step achieved its effect
 * @param message      short human-readable sentence
 * @param payload      structured data (links, file paths, failing step), immutable
 * @param executorName executor that produced the result, or a pseudo-name such as "resolver"
 * @param intent       category of the step
 * @param timestamp    completion time
 */
public record ExecutionResult(
        boolean success,
        String message,
        Map<String, Object> payload,
        String executorName,
        IntentCategory intent,
        Instant timestamp
) {

    public ExecutionResult {
        Objects.requireNonNull(message, "message");
        Objects.requireNonNull(executorName, "executorName");
        Objects.requireNonNull(intent, "intent");
        payload = payload == null ? Map.of() : Map.copyOf(stripNulls(payload));
        if (timestamp == null) {
            timestamp = Instant.now();
        }
    }

    public static ExecutionResult success(String message, Map<String, Object> payload,
                                          String executorName, IntentCategory intent) {
        return new ExecutionResult(true, message, payload, executorName, intent, Instant.now());
    }

    public static ExecutionResult failure(String message, Map<String, Object> payload,
                                          String executorName, IntentCategory intent) {
        return new ExecutionResult(false, message, payload, executorName, intent, Instant.now());
    }

    // Map.copyOf rejects null values; executors are allowed to leave optional fields unset
    private static Map<String, Object> stripNulls(Map<String, Object> in) {
        Map<String, Object> out = new LinkedHashMap<>();
        in.forEach((k, v) -> {
            if (k != null && v != null) {
                out.put(k, v);
            }
        });
        return out;
    }
}
