package com.phillippitts.commandrouter.service.classifier;

import com.phillippitts.commandrouter.domain.IntentCategory;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One deterministic trigger: a case-insensitive regex whose named groups become slots.
 *
 * @param category  intent this pattern signals
 * @param name      short identifier used in logs
 * @param regex     compiled pattern
 * @param confidence confidence assigned when the pattern matches
 * @param slotNames named groups to read; each must be in the category's slot schema
 */
public record TriggerPattern(
        IntentCategory category,
        String name,
        Pattern regex,
        double confidence,
        List<String> slotNames
) {

    public TriggerPattern {
        Objects.requireNonNull(category, "category");
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(regex, "regex");
        slotNames = slotNames == null ? List.of() : List.copyOf(slotNames);
        for (String slot : slotNames) {
            if (!category.accepts(slot)) {
                throw new IllegalArgumentException("Slot '" + slot + "' not in schema of " + category);
            }
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence out of range: " + confidence);
        }
    }

    public static TriggerPattern of(IntentCategory category, String name, String regex,
                                    double confidence, String... slotNames) {
        return new TriggerPattern(category, name,
                Pattern.compile(regex, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE),
                confidence, List.of(slotNames));
    }
}
