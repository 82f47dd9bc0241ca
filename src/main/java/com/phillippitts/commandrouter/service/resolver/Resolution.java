package com.phillippitts.commandrouter.service.resolver;

import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of resolving a spoken name.
 *
 * @param query the original query
 * @param entry matched entry, null when not found
 * @param tier  which matching tier succeeded
 */
public record Resolution(String query, CanonicalEntry entry, MatchTier tier) {

    public enum MatchTier {
        EXACT,
        CONTEXT_STRIPPED,
        PARTIAL,
        NONE
    }

    public Resolution {
        Objects.requireNonNull(tier, "tier");
        if ((entry == null) != (tier == MatchTier.NONE)) {
            throw new IllegalArgumentException("entry must be present exactly when matched");
        }
    }

    public static Resolution found(String query, CanonicalEntry entry, MatchTier tier) {
        return new Resolution(query, Objects.requireNonNull(entry, "entry"), tier);
    }

    public static Resolution notFound(String query) {
        return new Resolution(query, null, MatchTier.NONE);
    }

    public boolean isFound() {
        return entry != null;
    }

    public Optional<CanonicalEntry> match() {
        return Optional.ofNullable(entry);
    }
}
