package com.phillippitts.commandrouter.config.properties;

import com.phillippitts.commandrouter.service.resolver.TieBreakPolicy;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Locale;

/**
 * Typed properties for fuzzy entity resolution.
 */
@Validated
@ConfigurationProperties(prefix = "router.resolver")
public class ResolverProperties {

    public static final List<String> DEFAULT_CONTEXT_WORDS = List.of(
            "college", "clg", "mam", "maam", "madam", "sir", "bro", "bhai", "ji", "didi", "on whatsapp");

    /**
     * Trailing words stripped from a spoken name before matching ("Shivam clg" → "Shivam").
     * Entries may span several words.
     */
    @NotNull
    private final List<String> contextWords;

    @NotNull
    private final TieBreakPolicy tieBreak;

    @ConstructorBinding
    public ResolverProperties(List<String> contextWords, TieBreakPolicy tieBreak) {
        List<String> words = contextWords == null || contextWords.isEmpty() ? DEFAULT_CONTEXT_WORDS : contextWords;
        this.contextWords = words.stream()
                .map(w -> w.trim().toLowerCase(Locale.ROOT))
                .filter(w -> !w.isEmpty())
                .toList();
        this.tieBreak = tieBreak == null ? TieBreakPolicy.SHORTEST_LABEL : tieBreak;
    }

    public static ResolverProperties defaults() {
        return new ResolverProperties(null, null);
    }

    public List<String> getContextWords() {
        return contextWords;
    }

    public TieBreakPolicy getTieBreak() {
        return tieBreak;
    }
}
