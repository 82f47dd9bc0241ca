package com.phillippitts.commandrouter.domain;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A classified command ready for dispatch: intent plus slot values.
 *
 * <p>Slot names are restricted to the intent's schema; see {@link IntentCategory#slotSchema()}.
 *
 * @param intent     target category
 * @param confidence classification confidence (0.0 - 1.0)
 * @param slots      named parameters (immutable)
 * @param sourceText the utterance fragment this command was derived from
 */
public record ParsedCommand(
        IntentCategory intent,
        double confidence,
        Map<String, String> slots,
        String sourceText
) {

    public ParsedCommand {
        Objects.requireNonNull(intent, "intent");
        slots = slots == null ? Map.of() : Map.copyOf(slots);
        sourceText = sourceText == null ? "" : sourceText;
    }

    public String slot(String name) {
        return slots.get(name);
    }

    /**
     * Returns a copy with one slot added or replaced.
     */
    public ParsedCommand withSlot(String name, String value) {
        Map<String, String> copy = new HashMap<>(slots);
        copy.put(name, value);
        return new ParsedCommand(intent, confidence, copy, sourceText);
    }
}
