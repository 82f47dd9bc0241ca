package com.phillippitts.commandrouter.service.classifier;

import com.phillippitts.commandrouter.domain.Classification;
import com.phillippitts.commandrouter.domain.IntentCategory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;

import static com.phillippitts.commandrouter.domain.IntentCategory.APP_LAUNCH;
import static com.phillippitts.commandrouter.domain.IntentCategory.CALENDAR;
import static com.phillippitts.commandrouter.domain.IntentCategory.CONVERSATION;
import static com.phillippitts.commandrouter.domain.IntentCategory.EMAIL;
import static com.phillippitts.commandrouter.domain.IntentCategory.FILE_LOOKUP;
import static com.phillippitts.commandrouter.domain.IntentCategory.MESSAGING;
import static com.phillippitts.commandrouter.domain.IntentCategory.PAYMENT;
import static com.phillippitts.commandrouter.domain.IntentCategory.PHONE_CALL;
import static com.phillippitts.commandrouter.domain.IntentCategory.WEB_SEARCH;

/**
 * Tier 1 classifier: a fixed table of {@link TriggerPattern}s evaluated locally.
 *
 * <p>Every pattern is tried. When several match, the winner is chosen by:
 * <ol>
 *   <li>longest matched span</li>
 *   <li>higher category priority (explicit action verbs outrank conversation)</li>
 *   <li>higher pattern confidence</li>
 * </ol>
 * Remaining ties keep table order. No I/O; safe for concurrent use.
 */
@Component
public class PatternIntentMatcher {

    private static final Logger LOG = LogManager.getLogger(PatternIntentMatcher.class);

    private static final String END = "\\s*[.!?]*\\s*$";
    private static final String NO_EMAIL = "(?!.*\\be-?mail\\b)";
    private static final String PAY_APP = "(?:\\s+(?:via|using|on|through|with)\\s+(?<app>gpay|google pay|phonepe|phone pe|paytm|bhim|upi))?";
    private static final String AMOUNT = "(?:rs\\.?\\s*|₹\\s*|inr\\s*)?(?<amount>\\d+(?:\\.\\d{1,2})?)\\s*(?:rs|rupees|inr|bucks)?";
    private static final String WHEN = "(?<when>(?:on|at|by|for|tomorrow|today|tonight|next|this|in)\\b.*?)";

    static final List<TriggerPattern> DEFAULT_PATTERNS = List.of(
            // Messaging
            TriggerPattern.of(MESSAGING, "message-with-body",
                    "^" + NO_EMAIL + "(?:please\\s+)?(?:send\\s+(?:a\\s+)?)?(?:whatsapp\\s+)?(?:message|msg|text|whatsapp|ping)\\s+(?:to\\s+)?"
                            + "(?<recipient>.+?)\\s*(?::|,|\\s+saying|\\s+that|\\s+about|\\s+to say)\\s+(?<body>.+?)" + END,
                    0.92, "recipient", "body"),
            TriggerPattern.of(MESSAGING, "tell-someone",
                    "^(?:tell|ask)\\s+(?<recipient>[\\w' ]+?)\\s+(?:that|to)\\s+(?<body>.+?)" + END,
                    0.85, "recipient", "body"),
            TriggerPattern.of(MESSAGING, "forward-it",
                    "^" + NO_EMAIL + "(?:send|share|forward)\\s+(?:it|them|this|that|the file)\\s+(?:to|with)\\s+(?<recipient>.+?)" + END,
                    0.8, "recipient"),
            TriggerPattern.of(MESSAGING, "message-recipient-only",
                    "^" + NO_EMAIL + "(?:message|msg|text|whatsapp)\\s+(?:to\\s+)?(?<recipient>[\\w' ]+?)" + END,
                    0.75, "recipient"),

            // Email
            TriggerPattern.of(EMAIL, "email-with-subject",
                    "^(?:send\\s+(?:an?\\s+)?)?(?:e-?mail|mail)\\s+(?:to\\s+)?(?<recipient>.+?)\\s+(?:about|regarding|with subject)\\s+"
                            + "(?<subject>.+?)(?:\\s+(?:saying|that says|with body)\\s+(?<body>.+?))?" + END,
                    0.9, "recipient", "subject", "body"),
            TriggerPattern.of(EMAIL, "forward-by-email",
                    "^(?:send|share|forward|mail)\\s+(?:it|them|this|that|the file)\\s+(?:to\\s+)?(?<recipient>.+?)\\s+(?:by|via|over|through|on)\\s+e-?mail" + END,
                    0.88, "recipient"),
            TriggerPattern.of(EMAIL, "email-recipient-only",
                    "^(?:send\\s+(?:an?\\s+)?)?(?:e-?mail|mail)\\s+(?:to\\s+)?(?<recipient>.+?)" + END,
                    0.7, "recipient"),

            // Calls
            TriggerPattern.of(PHONE_CALL, "call",
                    "^(?:please\\s+)?(?:call|phone|dial|ring)\\s+(?:up\\s+)?(?<recipient>.+?)" + END,
                    0.9, "recipient"),

            // Calendar
            TriggerPattern.of(CALENDAR, "schedule-event",
                    "^(?:schedule|book|set up|create|add)\\s+(?:an?\\s+)?(?<title>(?:meeting|event|call|appointment|reminder)[\\w ]*?)"
                            + "(?:\\s+" + WHEN + ")?" + END,
                    0.88, "title", "when"),
            TriggerPattern.of(CALENDAR, "remind-me",
                    "^(?:remind me to|add to (?:my )?calendar)\\s+(?<title>.+?)(?:\\s+" + WHEN + ")?" + END,
                    0.8, "title", "when"),

            // Payments
            TriggerPattern.of(PAYMENT, "pay-amount-to",
                    "^(?:pay|send|transfer)\\s+" + AMOUNT + "\\s+to\\s+(?<recipient>.+?)" + PAY_APP + END,
                    0.93, "amount", "recipient", "app"),
            TriggerPattern.of(PAYMENT, "pay-someone-amount",
                    "^pay\\s+(?<recipient>[\\w' ]+?)\\s+" + AMOUNT + PAY_APP + END,
                    0.9, "recipient", "amount", "app"),

            // Files
            TriggerPattern.of(FILE_LOOKUP, "find-my-file",
                    "^(?:find|locate|look for|look up|search for|get|fetch)\\s+(?:me\\s+)?(?:my|the)\\s+(?<query>[\\w .\\-]+?)"
                            + "(?:\\s+(?:file|document|doc))?" + END,
                    0.85, "query"),
            TriggerPattern.of(FILE_LOOKUP, "find-file-named",
                    "^(?:find|locate|search for)\\s+(?:the\\s+|a\\s+)?(?:file|document)\\s+(?:named|called)\\s+(?<query>.+?)" + END,
                    0.88, "query"),

            // Web search
            TriggerPattern.of(WEB_SEARCH, "search",
                    "^(?:search|google|look up)\\s+(?:for\\s+)?(?<query>.+?)(?:\\s+on\\s+(?<engine>google|youtube))?" + END,
                    0.8, "query", "engine"),
            TriggerPattern.of(WEB_SEARCH, "play-on-youtube",
                    "^play\\s+(?<query>.+?)\\s+on\\s+(?<engine>youtube)" + END,
                    0.85, "query", "engine"),

            // Applications
            TriggerPattern.of(APP_LAUNCH, "open-app",
                    "^(?:open|launch|start|run)\\s+(?!my\\b)(?:the\\s+)?(?<app>[\\w .]+?)(?:\\s+app(?:lication)?)?" + END,
                    0.85, "app"),

            // Conversation
            TriggerPattern.of(CONVERSATION, "greeting",
                    "^(?<topic>hi|hello|hey|good morning|good afternoon|good evening)\\b[\\s\\w!,.]*$",
                    0.9, "topic"),
            TriggerPattern.of(CONVERSATION, "help",
                    "^(?<topic>help|what can you do)\\b.*$",
                    0.9, "topic"),
            TriggerPattern.of(CONVERSATION, "thanks",
                    "^(?<topic>thanks|thank you|thx)\\b.*$",
                    0.9, "topic")
    );

    private static final Comparator<Candidate> PREFERENCE = Comparator
            .comparingInt(Candidate::span)
            .thenComparingInt(c -> c.pattern().category().priority())
            .thenComparingDouble(c -> c.pattern().confidence())
            .reversed();

    private final List<TriggerPattern> patterns;

    public PatternIntentMatcher() {
        this(DEFAULT_PATTERNS);
    }

    public PatternIntentMatcher(List<TriggerPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    /**
     * Evaluates every pattern against {@code text} and returns the preferred match.
     *
     * @param text utterance or utterance segment
     * @return best classification with {@code source = PATTERN}, or empty when nothing matches
     */
    public Optional<Classification> match(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String input = text.trim();
        List<Candidate> candidates = new ArrayList<>();
        for (TriggerPattern pattern : patterns) {
            Matcher m = pattern.regex().matcher(input);
            if (m.find()) {
                candidates.add(new Candidate(pattern, m.end() - m.start(), extractSlots(pattern, m)));
            }
        }
        if (candidates.isEmpty()) {
            return Optional.empty();
        }
        // List.sort is stable, so table order breaks any remaining tie
        candidates.sort(PREFERENCE);
        Candidate best = candidates.get(0);
        if (candidates.size() > 1) {
            LOG.debug("{} patterns matched; chose {} ({})",
                    candidates.size(), best.pattern().name(), best.pattern().category());
        }
        return Optional.of(new Classification(best.pattern().category(), best.pattern().confidence(),
                best.slots(), Classification.Source.PATTERN));
    }

    public List<TriggerPattern> patterns() {
        return patterns;
    }

    private static Map<String, String> extractSlots(TriggerPattern pattern, Matcher m) {
        Map<String, String> slots = new LinkedHashMap<>();
        for (String slot : pattern.slotNames()) {
            String value = m.group(slot);
            if (value != null) {
                String cleaned = value.trim().replaceAll("[\\s,.;:!?]+$", "");
                if (!cleaned.isEmpty()) {
                    slots.put(slot, cleaned);
                }
            }
        }
        return slots;
    }

    private record Candidate(TriggerPattern pattern, int span, Map<String, String> slots) {
    }

    /** @return all categories that have at least one trigger pattern */
    public List<IntentCategory> coveredCategories() {
        return patterns.stream().map(TriggerPattern::category).distinct().toList();
    }
}
