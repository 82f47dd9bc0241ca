package com.phillippitts.commandrouter.service.resolver;

import com.phillippitts.commandrouter.config.properties.ResolverProperties;
import com.phillippitts.commandrouter.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Fuzzy matcher of spoken or typed names against any {@link CandidateDirectory}.
 *
 * <p>Matching tiers, first hit wins:
 * <ol>
 *   <li>exact case-insensitive match on an alias or canonical label</li>
 *   <li>exact match after stripping trailing context words ("Shivam clg", "Priya mam"),
 *       repeated while the query still ends in one</li>
 *   <li>partial match in either direction on the normalized, context-stripped query: the query
 *       is a prefix or substring of an alias ("shiv" of "shivam patel"), or an alias is a
 *       substring of the query ("my mom please")</li>
 * </ol>
 * Several tier-3 candidates are narrowed to one by the configured {@link TieBreakPolicy}.
 *
 * <p>Stateless and thread-safe. Resolution is idempotent: resolving a matched entry's label
 * yields the same entry.
 */
@Component
public class EntityResolver {

    private static final Logger LOG = LogManager.getLogger(EntityResolver.class);

    private final List<List<String>> contextWords;
    private final Comparator<CanonicalEntry> tieBreak;

    public EntityResolver(ResolverProperties properties) {
        this.contextWords = properties.getContextWords().stream()
                .map(EntityResolver::tokens)
                .filter(t -> !t.isEmpty())
                .toList();
        this.tieBreak = properties.getTieBreak().order();
    }

    /**
     * Resolves {@code query} against {@code directory}.
     *
     * @param query     spoken or typed name; null or blank never matches
     * @param directory directory to search
     * @return found resolution with its tier, or not-found echoing the query
     */
    public Resolution resolve(String query, CandidateDirectory directory) {
        String normalized = ImmutableCandidateDirectory.normalize(query);
        if (normalized.isEmpty() || directory.isEmpty()) {
            return Resolution.notFound(query);
        }
        Map<String, CanonicalEntry> aliases = directory.aliases();

        CanonicalEntry exact = aliases.get(normalized);
        if (exact != null) {
            return Resolution.found(query, exact, Resolution.MatchTier.EXACT);
        }

        List<String> queryTokens = stripContextWords(tokens(normalized));
        String stripped = String.join(" ", queryTokens);
        if (!stripped.equals(normalized)) {
            CanonicalEntry strippedMatch = aliases.get(stripped);
            if (strippedMatch != null) {
                return Resolution.found(query, strippedMatch, Resolution.MatchTier.CONTEXT_STRIPPED);
            }
        }

        Set<CanonicalEntry> partial = new TreeSet<>(tieBreak);
        aliases.forEach((alias, entry) -> {
            if (overlaps(alias, stripped)) {
                partial.add(entry);
            }
        });
        if (partial.isEmpty()) {
            LOG.debug("No {} match for '{}'", directory.name(), LogSanitizer.preview(query));
            return Resolution.notFound(query);
        }
        CanonicalEntry chosen = partial.iterator().next();
        if (partial.size() > 1) {
            LOG.debug("{} candidates in {} for '{}', picked '{}'",
                    partial.size(), directory.name(), LogSanitizer.preview(query), chosen.label());
        }
        return Resolution.found(query, chosen, Resolution.MatchTier.PARTIAL);
    }

    // Package-private for tests
    List<String> stripContextWords(List<String> queryTokens) {
        List<String> current = new ArrayList<>(queryTokens);
        boolean stripped = true;
        while (stripped) {
            stripped = false;
            for (List<String> word : contextWords) {
                // Never strip the whole query away
                if (current.size() > word.size() && endsWith(current, word)) {
                    current = new ArrayList<>(current.subList(0, current.size() - word.size()));
                    stripped = true;
                }
            }
        }
        return current;
    }

    private static boolean endsWith(List<String> tokens, List<String> suffix) {
        return tokens.subList(tokens.size() - suffix.size(), tokens.size()).equals(suffix);
    }

    /**
     * True if either normalized string contains the other. Empty strings never overlap.
     */
    static boolean overlaps(String alias, String query) {
        if (alias.isEmpty() || query.isEmpty()) {
            return false;
        }
        return alias.contains(query) || query.contains(alias);
    }

    private static List<String> tokens(String s) {
        String normalized = ImmutableCandidateDirectory.normalize(s);
        if (normalized.isEmpty()) {
            return List.of();
        }
        return Arrays.asList(normalized.split(" "));
    }
}
