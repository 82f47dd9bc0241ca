package com.phillippitts.commandrouter.domain;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Closed set of command domains the router can dispatch to.
 *
 * <p>Each category carries:
 * <ul>
 *   <li>a stable wire name used in outbound messages and in fallback-model responses</li>
 *   <li>a priority used to break ties between equally long pattern matches
 *       (explicit action verbs outrank generic conversation)</li>
 *   <li>the slot schema: the only slot names a command of this category may carry</li>
 *   <li>a short hint appended to failure messages</li>
 * </ul>
 */
public enum IntentCategory {

    MESSAGING("messaging", 80,
            Set.of("recipient", "body", "attachment"),
            "Try something like 'message Mom that I will be late'."),
    PHONE_CALL("phone_call", 85,
            Set.of("recipient"),
            "Try something like 'call Jay'."),
    EMAIL("email", 75,
            Set.of("recipient", "subject", "body", "attachment"),
            "Try something like 'email Jay about the internship'."),
    CALENDAR("calendar", 70,
            Set.of("title", "when"),
            "Try something like 'schedule a meeting tomorrow at 3pm'."),
    PAYMENT("payment", 90,
            Set.of("recipient", "amount", "app"),
            "Try something like 'pay 100 to Jay via paytm'."),
    FILE_LOOKUP("file_lookup", 60,
            Set.of("query"),
            "Try something like 'find my resume'."),
    APP_LAUNCH("app_launch", 50,
            Set.of("app"),
            "Try something like 'open chrome'."),
    WEB_SEARCH("web_search", 40,
            Set.of("query", "engine"),
            "Try something like 'search for cats on youtube'."),
    CONVERSATION("conversation", 0,
            Set.of("topic"),
            "Try asking 'what can you do?'.");

    private final String wireName;
    private final int priority;
    private final Set<String> slotSchema;
    private final String failureHint;

    IntentCategory(String wireName, int priority, Set<String> slotSchema, String failureHint) {
        this.wireName = wireName;
        this.priority = priority;
        this.slotSchema = slotSchema;
        this.failureHint = failureHint;
    }

    public String wireName() {
        return wireName;
    }

    public int priority() {
        return priority;
    }

    public Set<String> slotSchema() {
        return slotSchema;
    }

    public String failureHint() {
        return failureHint;
    }

    /** @return true if {@code slot} is part of this category's schema */
    public boolean accepts(String slot) {
        return slotSchema.contains(slot);
    }

    /**
     * Looks up a category by wire name or constant name, case-insensitively.
     *
     * @param name candidate name, may be null
     * @return the matching category, or empty for anything outside the closed set
     */
    public static Optional<IntentCategory> fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(c -> c.wireName.equals(normalized) || c.name().toLowerCase(Locale.ROOT).equals(normalized))
                .findFirst();
    }
}
