package com.phillippitts.commandrouter.service.channel;

import com.phillippitts.commandrouter.domain.CommandOutcome;
import com.phillippitts.commandrouter.domain.ExecutionResult;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Instant;
import java.util.Locale;

/**
 * JSON wire format of the realtime channel.
 *
 * <p>Inbound:
 * <pre>
 * {"type": "command", "command": "...", "correlation_id": "..."}   correlation_id optional
 * {"type": "ping"} / {"type": "pong"}
 * </pre>
 * Outbound: {@code command_result}, {@code command_ack}, {@code ping}, {@code pong}, {@code error}.
 * Timestamps are ISO-8601.
 */
public final class ChannelMessageCodec {

    private ChannelMessageCodec() {
    }

    /**
     * @throws IllegalArgumentException for malformed JSON, a missing or unknown type
     */
    public static InboundMessage decode(String text) {
        JSONObject json;
        try {
            json = new JSONObject(text);
        } catch (JSONException e) {
            throw new IllegalArgumentException("Malformed message: not a JSON object", e);
        }
        String type = json.optString("type", "").trim().toLowerCase(Locale.ROOT);
        String correlationId = json.optString("correlation_id", null);
        if (correlationId != null && correlationId.isBlank()) {
            correlationId = null;
        }
        return switch (type) {
            case "command" -> new InboundMessage(InboundMessage.Type.COMMAND,
                    json.optString("command", ""), correlationId);
            case "ping" -> new InboundMessage(InboundMessage.Type.PING, null, correlationId);
            case "pong" -> new InboundMessage(InboundMessage.Type.PONG, null, correlationId);
            case "" -> throw new IllegalArgumentException("Message has no type");
            default -> throw new IllegalArgumentException("Unknown message type: " + type);
        };
    }

    public static String encodeResult(CommandOutcome outcome) {
        JSONArray steps = new JSONArray();
        for (ExecutionResult step : outcome.steps()) {
            steps.put(new JSONObject()
                    .put("success", step.success())
                    .put("message", step.message())
                    .put("executor", step.executorName())
                    .put("intent", step.intent().wireName())
                    .put("payload", new JSONObject(step.payload()))
                    .put("timestamp", step.timestamp().toString()));
        }
        JSONObject results = new JSONObject().put("steps", steps);
        if (outcome.failedStep() >= 0 && outcome.failedStep() < outcome.steps().size()) {
            results.put("failed_step", outcome.steps().get(outcome.failedStep()).intent().wireName());
            results.put("failed_step_index", outcome.failedStep());
        }
        return new JSONObject()
                .put("type", "command_result")
                .put("correlation_id", outcome.correlationId())
                .put("success", outcome.success())
                .put("message", outcome.message())
                .put("agent_used", outcome.agentUsed())
                .put("intent", outcome.intent().wireName())
                .put("results", results)
                .put("timestamp", outcome.timestamp().toString())
                .toString();
    }

    public static String encodeAck(String correlationId, String message) {
        return new JSONObject()
                .put("type", "command_ack")
                .put("correlation_id", correlationId)
                .put("message", message)
                .put("timestamp", Instant.now().toString())
                .toString();
    }

    public static String encodePing(Instant at) {
        return new JSONObject().put("type", "ping").put("timestamp", at.toString()).toString();
    }

    public static String encodePong(Instant at) {
        return new JSONObject().put("type", "pong").put("timestamp", at.toString()).toString();
    }

    public static String encodeError(String message) {
        return new JSONObject()
                .put("type", "error")
                .put("message", message)
                .put("timestamp", Instant.now().toString())
                .toString();
    }
}
