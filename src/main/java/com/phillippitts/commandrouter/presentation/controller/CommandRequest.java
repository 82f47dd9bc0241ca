package com.phillippitts.commandrouter.presentation.controller;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;

import java.util.Map;

/**
 * Body of {@code POST /api/commands}.
 *
 * @param command       utterance text
 * @param correlationId optional client-chosen id, generated when absent
 * @param intent        optional wire name; when present classification is skipped
 * @param slots         optional slot values for an explicit intent
 */
record CommandRequest(
        @NotBlank(message = "command must not be blank") String command,
        @JsonProperty("correlation_id") String correlationId,
        String intent,
        Map<String, String> slots
) {
}
