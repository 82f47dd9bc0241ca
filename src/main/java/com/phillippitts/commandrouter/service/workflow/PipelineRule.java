package com.phillippitts.commandrouter.service.workflow;

import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.service.executor.SlotNames;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Declares that a producer intent's output feeds a consumer intent's slot.
 *
 * @param producer  intent of the first step
 * @param consumer  intent of the second step
 * @param outputKey payload key read from the producer's result
 * @param inputSlot slot set on the consumer's parameters
 */
public record PipelineRule(IntentCategory producer, IntentCategory consumer, String outputKey, String inputSlot) {

    public static final List<PipelineRule> DEFAULT_RULES = List.of(
            new PipelineRule(IntentCategory.FILE_LOOKUP, IntentCategory.MESSAGING, SlotNames.FILE_PATH, SlotNames.ATTACHMENT),
            new PipelineRule(IntentCategory.FILE_LOOKUP, IntentCategory.EMAIL, SlotNames.FILE_PATH, SlotNames.ATTACHMENT));

    public PipelineRule {
        Objects.requireNonNull(producer, "producer");
        Objects.requireNonNull(consumer, "consumer");
        Objects.requireNonNull(outputKey, "outputKey");
        Objects.requireNonNull(inputSlot, "inputSlot");
    }

    public static Optional<PipelineRule> find(List<PipelineRule> rules, IntentCategory producer, IntentCategory consumer) {
        return rules.stream()
                .filter(r -> r.producer() == producer && r.consumer() == consumer)
                .findFirst();
    }
}
