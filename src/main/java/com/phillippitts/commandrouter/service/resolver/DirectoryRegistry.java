package com.phillippitts.commandrouter.service.resolver;

import com.phillippitts.commandrouter.config.properties.DirectoryProperties;
import com.phillippitts.commandrouter.exception.CommandRouterException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Owns the named candidate directories ({@code contacts}, {@code emails}, {@code applications}).
 *
 * <p>Directories are loaded once from {@code router.directory.location}, a JSON document of the
 * form:
 * <pre>
 * {
 *   "contacts":     { "jay": "+919321781905", "mom": {"label": "Mom", "value": "+919876543212"} },
 *   "emails":       { "jay": "jay@example.com" },
 *   "applications": { "chrome": "com.google.Chrome" }
 * }
 * </pre>
 * A string value makes the alias its own label; an object names the canonical label explicitly.
 *
 * <p>Reads are lock-free: each directory is an immutable snapshot published through a volatile
 * reference. {@link #addAlias} is the only update path; it is serialized by a lock and publishes
 * a fresh snapshot (copy-on-write), so in-flight requests keep the snapshot they started with.
 */
@Component
public class DirectoryRegistry {

    private static final Logger LOG = LogManager.getLogger(DirectoryRegistry.class);

    public static final String CONTACTS = "contacts";
    public static final String EMAILS = "emails";
    public static final String APPLICATIONS = "applications";

    private final Lock writeLock = new ReentrantLock();
    private volatile Map<String, ImmutableCandidateDirectory> directories;

    @Autowired
    public DirectoryRegistry(DirectoryProperties properties, ResourceLoader resourceLoader) {
        this(load(resourceLoader.getResource(properties.getLocation())));
    }

    /**
     * Creates a registry over already built directories (used by tests and tooling).
     */
    public DirectoryRegistry(Map<String, ImmutableCandidateDirectory> directories) {
        Map<String, ImmutableCandidateDirectory> copy = new LinkedHashMap<>(directories);
        copy.putIfAbsent(CONTACTS, ImmutableCandidateDirectory.empty(CONTACTS));
        copy.putIfAbsent(EMAILS, ImmutableCandidateDirectory.empty(EMAILS));
        copy.putIfAbsent(APPLICATIONS, ImmutableCandidateDirectory.empty(APPLICATIONS));
        this.directories = Map.copyOf(copy);
        LOG.info("Directories loaded: contacts={}, emails={}, applications={}",
                this.directories.get(CONTACTS).entries().size(),
                this.directories.get(EMAILS).entries().size(),
                this.directories.get(APPLICATIONS).entries().size());
    }

    public CandidateDirectory contacts() {
        return directory(CONTACTS);
    }

    public CandidateDirectory emails() {
        return directory(EMAILS);
    }

    public CandidateDirectory applications() {
        return directory(APPLICATIONS);
    }

    /**
     * @throws IllegalArgumentException for an unknown directory name
     */
    public CandidateDirectory directory(String name) {
        CandidateDirectory directory = directories.get(name);
        if (directory == null) {
            throw new IllegalArgumentException("Unknown directory: " + name);
        }
        return directory;
    }

    /**
     * Adds or replaces one alias. Concurrent readers see either the old or the new snapshot,
     * never a partially updated one.
     */
    public void addAlias(String directoryName, String alias, CanonicalEntry entry) {
        Objects.requireNonNull(alias, "alias");
        Objects.requireNonNull(entry, "entry");
        writeLock.lock();
        try {
            ImmutableCandidateDirectory current = directories.get(directoryName);
            if (current == null) {
                throw new IllegalArgumentException("Unknown directory: " + directoryName);
            }
            Map<String, ImmutableCandidateDirectory> next = new LinkedHashMap<>(directories);
            next.put(directoryName, current.withAlias(alias, entry));
            directories = Map.copyOf(next);
        } finally {
            writeLock.unlock();
        }
        LOG.info("Alias added to {}: '{}' -> '{}'", directoryName, alias, entry.label());
    }

    /**
     * Creates a registry from a directory JSON document.
     *
     * @throws CommandRouterException if the document is malformed
     */
    public static DirectoryRegistry fromJson(String json) {
        return new DirectoryRegistry(parse(json));
    }

    static Map<String, ImmutableCandidateDirectory> load(Resource resource) {
        if (!resource.exists()) {
            LOG.warn("Directory file not found at {}; starting with empty directories", resource);
            return Map.of();
        }
        try (InputStream in = resource.getInputStream()) {
            return parse(new String(in.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new CommandRouterException("Failed to read directory file " + resource, e);
        }
    }

    /**
     * Parses the directory JSON document.
     *
     * @throws CommandRouterException if the document is malformed
     */
    static Map<String, ImmutableCandidateDirectory> parse(String json) {
        try {
            JSONObject root = new JSONObject(json);
            Map<String, ImmutableCandidateDirectory> result = new LinkedHashMap<>();
            for (String name : root.keySet()) {
                JSONObject section = root.getJSONObject(name);
                Map<String, CanonicalEntry> aliases = new LinkedHashMap<>();
                for (String alias : section.keySet()) {
                    Object raw = section.get(alias);
                    if (raw instanceof JSONObject obj) {
                        aliases.put(alias, new CanonicalEntry(obj.optString("label", alias), obj.getString("value")));
                    } else {
                        aliases.put(alias, new CanonicalEntry(alias, String.valueOf(raw)));
                    }
                }
                result.put(name, ImmutableCandidateDirectory.of(name, aliases));
            }
            return result;
        } catch (JSONException | IllegalArgumentException e) {
            throw new CommandRouterException("Malformed directory document: " + e.getMessage(), e);
        }
    }
}
