package com.phillippitts.commandrouter.presentation.controller;

import com.phillippitts.commandrouter.config.logging.LogContext;
import com.phillippitts.commandrouter.domain.CommandOutcome;
import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.domain.ParsedCommand;
import com.phillippitts.commandrouter.domain.Utterance;
import com.phillippitts.commandrouter.domain.WorkflowRequest;
import com.phillippitts.commandrouter.service.channel.ChannelMessageCodec;
import com.phillippitts.commandrouter.service.command.CommandService;
import com.phillippitts.commandrouter.service.executor.ExecutorRegistry;
import com.phillippitts.commandrouter.util.LogSanitizer;
import jakarta.validation.Valid;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Stateless request/response API.
 *
 * <p>{@code POST /api/commands} returns the same outcome shape as a {@code command_result}
 * frame on the realtime channel. A body without {@code correlation_id} takes the
 * {@code X-Correlation-ID} header value, when one was sent.
 */
@RestController
@RequestMapping("/api")
class CommandController {

    private static final Logger LOG = LogManager.getLogger(CommandController.class);

    private final CommandService commandService;
    private final ExecutorRegistry executors;

    CommandController(CommandService commandService, ExecutorRegistry executors) {
        this.commandService = commandService;
        this.executors = executors;
    }

    @PostMapping(path = "/commands", produces = MediaType.APPLICATION_JSON_VALUE)
    ResponseEntity<String> submit(@Valid @RequestBody CommandRequest body) {
        Utterance utterance = Utterance.typed(body.command());
        String correlationId = correlationId(body);
        WorkflowRequest request = body.intent() == null || body.intent().isBlank()
                ? WorkflowRequest.of(correlationId, utterance)
                : new WorkflowRequest(correlationId, utterance, List.of(preParsed(body, utterance)));
        LOG.info("Stateless command: correlation={}, text='{}'",
                request.correlationId(), LogSanitizer.preview(utterance.text()));
        CommandOutcome outcome = commandService.processWithTimeout(request);
        return ResponseEntity.ok(ChannelMessageCodec.encodeResult(outcome));
    }

    @GetMapping("/intents")
    List<Map<String, Object>> intents() {
        List<Map<String, Object>> catalogue = new ArrayList<>();
        for (IntentCategory category : IntentCategory.values()) {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("intent", category.wireName());
            entry.put("priority", category.priority());
            entry.put("slots", new TreeSet<>(category.slotSchema()));
            executors.find(category).ifPresent(executor -> {
                entry.put("executor", executor.name());
                entry.put("description", executor.description());
            });
            catalogue.add(entry);
        }
        return catalogue;
    }

    /** Body value first, then the header id {@code MdcFilter} put in the thread context. */
    private static String correlationId(CommandRequest body) {
        if (body.correlationId() != null && !body.correlationId().isBlank()) {
            return body.correlationId();
        }
        return ThreadContext.get(LogContext.CORRELATION_ID);
    }

    /**
     * Builds the single step for an explicit intent. Slots outside the schema are dropped.
     *
     * @throws IllegalArgumentException for an unknown intent name
     */
    private static ParsedCommand preParsed(CommandRequest body, Utterance utterance) {
        IntentCategory intent = IntentCategory.fromWireName(body.intent())
                .orElseThrow(() -> new IllegalArgumentException("Unknown intent: " + body.intent()));
        Map<String, String> slots = new LinkedHashMap<>();
        if (body.slots() != null) {
            body.slots().forEach((name, value) -> {
                if (intent.accepts(name) && value != null && !value.isBlank()) {
                    slots.put(name, value.trim());
                }
            });
        }
        return new ParsedCommand(intent, 1.0, slots, utterance.text());
    }
}
