package com.phillippitts.commandrouter.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Output of intent classification.
 *
 * @param intent     the chosen category
 * @param confidence score between 0.0 and 1.0
 * @param slots      slot values extracted from the utterance (immutable)
 * @param source     which tier produced the classification
 */
public record Classification(
        IntentCategory intent,
        double confidence,
        Map<String, String> slots,
        Source source
) {

    public enum Source {
        /** Tier 1 deterministic pattern. */
        PATTERN,
        /** Tier 2 fallback model, validated against the closed schema. */
        MODEL,
        /** Nothing usable; defaulted to conversation. */
        DEGRADED
    }

    public Classification {
        Objects.requireNonNull(intent, "intent");
        Objects.requireNonNull(source, "source");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        slots = slots == null ? Map.of() : Map.copyOf(slots);
    }

    /** Default classification used whenever both tiers come up empty. */
    public static Classification degraded() {
        return new Classification(IntentCategory.CONVERSATION, 0.0, Map.of(), Source.DEGRADED);
    }

    public ParsedCommand toCommand(String sourceText) {
        return new ParsedCommand(intent, confidence, slots, sourceText);
    }
}
