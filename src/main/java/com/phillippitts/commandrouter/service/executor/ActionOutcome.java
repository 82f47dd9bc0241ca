package com.phillippitts.commandrouter.service.executor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * What an {@link ActionExecutor} reports back.
 *
 * @param success whether the action achieved its effect
 * @param message short human-readable sentence
 * @param payload structured output (links, file paths); null values are dropped
 */
public record ActionOutcome(boolean success, String message, Map<String, Object> payload) {

    public ActionOutcome {
        Objects.requireNonNull(message, "message");
        Map<String, Object> copy = new LinkedHashMap<>();
        if (payload != null) {
            payload.forEach((k, v) -> {
                if (k != null && v != null) {
                    copy.put(k, v);
                }
            });
        }
        payload = Map.copyOf(copy);
    }

    public static ActionOutcome success(String message, Map<String, Object> payload) {
        return new ActionOutcome(true, message, payload);
    }

    public static ActionOutcome failure(String message) {
        return new ActionOutcome(false, message, Map.of());
    }
}
