package com.phillippitts.commandrouter.service.workflow;

import com.phillippitts.commandrouter.domain.ParsedCommand;

import java.util.Objects;

/**
 * A detected two-step pipeline.
 */
public record PipelinePlan(ParsedCommand producer, ParsedCommand consumer, PipelineRule rule) {

    public PipelinePlan {
        Objects.requireNonNull(producer, "producer");
        Objects.requireNonNull(consumer, "consumer");
        Objects.requireNonNull(rule, "rule");
        if (producer.intent() != rule.producer() || consumer.intent() != rule.consumer()) {
            throw new IllegalArgumentException("Steps do not match rule " + rule);
        }
    }
}
