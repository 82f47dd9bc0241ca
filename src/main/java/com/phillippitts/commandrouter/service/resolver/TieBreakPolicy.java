package com.phillippitts.commandrouter.service.resolver;

import java.util.Comparator;

/**
 * Picks one entry when several partial matches qualify. Both policies are total orders, so the
 * choice never depends on directory iteration order.
 */
public enum TieBreakPolicy {

    /** Shortest canonical label wins, then alphabetical. */
    SHORTEST_LABEL(Comparator.<CanonicalEntry>comparingInt(e -> e.label().length())
            .thenComparing(CanonicalEntry::label, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(CanonicalEntry::label)
            .thenComparing(CanonicalEntry::value)),

    /** Alphabetical by canonical label. */
    ALPHABETICAL(Comparator.comparing(CanonicalEntry::label, String.CASE_INSENSITIVE_ORDER)
            .thenComparing(CanonicalEntry::label)
            .thenComparing(CanonicalEntry::value));

    private final Comparator<CanonicalEntry> order;

    TieBreakPolicy(Comparator<CanonicalEntry> order) {
        this.order = order;
    }

    public Comparator<CanonicalEntry> order() {
        return order;
    }
}
