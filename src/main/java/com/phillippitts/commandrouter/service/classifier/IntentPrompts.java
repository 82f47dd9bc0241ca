package com.phillippitts.commandrouter.service.classifier;

import com.phillippitts.commandrouter.domain.IntentCategory;

import java.util.Arrays;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * System prompt for the fallback model, generated from the closed intent schema.
 */
final class IntentPrompts {

    private IntentPrompts() {
    }

    static String systemPrompt() {
        String schema = Arrays.stream(IntentCategory.values())
                .map(c -> "- " + c.wireName() + ": slots " + new TreeSet<>(c.slotSchema()))
                .collect(Collectors.joining("\n"));
        return """
                You classify a single user command for a task assistant.
                Choose exactly one intent from this list and extract only the listed slots:
                %s

                Answer with one JSON object and nothing else:
                {"intent": "<intent>", "confidence": <0.0-1.0>, "slots": {"<slot>": "<value>"}}
                Use "conversation" when no other intent fits.""".formatted(schema);
    }
}
