package com.phillippitts.commandrouter.service.classifier;

import com.phillippitts.commandrouter.domain.Classification;
import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.exception.ClassificationException;
import org.json.JSONException;
import org.json.JSONObject;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates the fallback model's free-text answer against the closed intent schema.
 *
 * <p>The answer is never trusted as control flow: anything outside the schema is rejected
 * with a {@link ClassificationException}. Accepted input:
 * <ul>
 *   <li>optionally wrapped in markdown code fences, optionally surrounded by prose</li>
 *   <li>the first balanced JSON object must carry {@code intent} naming a known category</li>
 *   <li>{@code confidence}, if present, is a number in [0, 1]; missing means 0.5</li>
 *   <li>{@code slots}, if present, is an object whose keys are all in the category's schema
 *       and whose values are strings or numbers; blank values are dropped</li>
 * </ul>
 */
public final class IntentResponseParser {

    static final double DEFAULT_CONFIDENCE = 0.5;

    private static final Pattern FENCE = Pattern.compile("```(?:json)?\\s*(.*?)```", Pattern.DOTALL);

    private IntentResponseParser() {
    }

    /**
     * @param raw model output
     * @return classification with {@code source = MODEL}
     * @throws ClassificationException if the output does not satisfy the schema
     */
    public static Classification parse(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new ClassificationException("Empty model output");
        }
        String json = firstJsonObject(stripFences(raw));
        JSONObject obj;
        try {
            obj = new JSONObject(json);
        } catch (JSONException e) {
            throw new ClassificationException("Model output is not a JSON object", e);
        }

        String intentName = obj.optString("intent", null);
        IntentCategory intent = IntentCategory.fromWireName(intentName)
                .orElseThrow(() -> new ClassificationException("Unknown intent in model output: " + intentName));

        double confidence = DEFAULT_CONFIDENCE;
        if (obj.has("confidence") && !obj.isNull("confidence")) {
            Object c = obj.get("confidence");
            if (!(c instanceof Number n)) {
                throw new ClassificationException("Confidence is not a number: " + c);
            }
            confidence = n.doubleValue();
            if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
                throw new ClassificationException("Confidence out of range: " + confidence);
            }
        }

        Map<String, String> slots = new LinkedHashMap<>();
        if (obj.has("slots") && !obj.isNull("slots")) {
            JSONObject rawSlots = obj.optJSONObject("slots");
            if (rawSlots == null) {
                throw new ClassificationException("Slots is not an object");
            }
            for (String key : rawSlots.keySet()) {
                if (!intent.accepts(key)) {
                    throw new ClassificationException("Slot '" + key + "' not allowed for " + intent.wireName());
                }
                Object value = rawSlots.get(key);
                if (value == JSONObject.NULL) {
                    continue;
                }
                if (!(value instanceof String) && !(value instanceof Number)) {
                    throw new ClassificationException("Slot '" + key + "' is not a scalar");
                }
                String text = String.valueOf(value).trim();
                if (!text.isEmpty()) {
                    slots.put(key, text);
                }
            }
        }
        return new Classification(intent, confidence, slots, Classification.Source.MODEL);
    }

    static String stripFences(String raw) {
        Matcher m = FENCE.matcher(raw);
        return m.find() ? m.group(1).trim() : raw.trim();
    }

    /**
     * Extracts the first balanced {@code {...}} block, honoring string literals.
     */
    static String firstJsonObject(String text) {
        int start = text.indexOf('{');
        if (start < 0) {
            throw new ClassificationException("No JSON object in model output");
        }
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (ch == '\\') {
                    escaped = true;
                } else if (ch == '"') {
                    inString = false;
                }
                continue;
            }
            if (ch == '"') {
                inString = true;
            } else if (ch == '{') {
                depth++;
            } else if (ch == '}') {
                depth--;
                if (depth == 0) {
                    return text.substring(start, i + 1);
                }
            }
        }
        throw new ClassificationException("Unbalanced JSON object in model output");
    }
}
