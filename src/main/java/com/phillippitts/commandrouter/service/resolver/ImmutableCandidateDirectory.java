package com.phillippitts.commandrouter.service.resolver;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable snapshot of a candidate directory.
 *
 * <p>Built once; updates go through {@link #withAlias(String, CanonicalEntry)}, which returns a
 * new snapshot and leaves this one untouched.
 */
public final class ImmutableCandidateDirectory implements CandidateDirectory {

    private final String name;
    private final Map<String, CanonicalEntry> aliases;
    private final List<CanonicalEntry> entries;

    private ImmutableCandidateDirectory(String name, Map<String, CanonicalEntry> aliases) {
        this.name = Objects.requireNonNull(name, "name");
        this.aliases = Map.copyOf(aliases);
        this.entries = List.copyOf(new LinkedHashSet<>(aliases.values()));
    }

    public static ImmutableCandidateDirectory empty(String name) {
        return new ImmutableCandidateDirectory(name, Map.of());
    }

    /**
     * Builds a directory from raw alias mappings. Each canonical label is also registered as an
     * alias of itself.
     */
    public static ImmutableCandidateDirectory of(String name, Map<String, CanonicalEntry> rawAliases) {
        Map<String, CanonicalEntry> normalized = new LinkedHashMap<>();
        rawAliases.forEach((alias, entry) -> {
            normalized.putIfAbsent(normalize(entry.label()), entry);
            normalized.put(normalize(alias), entry);
        });
        return new ImmutableCandidateDirectory(name, normalized);
    }

    /**
     * @return a new snapshot with {@code alias} added or replaced
     */
    public ImmutableCandidateDirectory withAlias(String alias, CanonicalEntry entry) {
        Map<String, CanonicalEntry> copy = new LinkedHashMap<>(aliases);
        copy.putIfAbsent(normalize(entry.label()), entry);
        copy.put(normalize(alias), entry);
        return new ImmutableCandidateDirectory(name, copy);
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Map<String, CanonicalEntry> aliases() {
        return aliases;
    }

    @Override
    public Collection<CanonicalEntry> entries() {
        return entries;
    }

    /**
     * Lower-cases, trims and collapses internal whitespace.
     */
    public static String normalize(String s) {
        if (s == null) {
            return "";
        }
        return s.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    @Override
    public String toString() {
        return "ImmutableCandidateDirectory[" + name + ", aliases=" + aliases.size() + "]";
    }
}
