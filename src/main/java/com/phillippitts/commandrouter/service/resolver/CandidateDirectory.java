package com.phillippitts.commandrouter.service.resolver;

import java.util.Collection;
import java.util.Map;

/**
 * Read-only mapping of free-text aliases to canonical entries.
 *
 * <p>Keys of {@link #aliases()} are normalized (lower case, single spaces). A canonical label is
 * always reachable as an alias of itself.
 */
public interface CandidateDirectory {

    /** Directory name, e.g. {@code contacts}. */
    String name();

    /** Normalized alias to canonical entry. Never null, never mutated. */
    Map<String, CanonicalEntry> aliases();

    /** Distinct canonical entries. */
    Collection<CanonicalEntry> entries();

    default boolean isEmpty() {
        return aliases().isEmpty();
    }
}
