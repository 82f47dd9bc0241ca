package com.phillippitts.commandrouter.service.executor.builtin;

import com.phillippitts.commandrouter.config.properties.ExecutorProperties;
import com.phillippitts.commandrouter.domain.IntentCategory;
import com.phillippitts.commandrouter.service.executor.ActionExecutor;
import com.phillippitts.commandrouter.service.executor.ActionOutcome;
import com.phillippitts.commandrouter.service.executor.SlotNames;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Finds local files whose name contains every word of the query.
 *
 * <p>Searches the configured roots up to a fixed depth, skipping hidden directories and
 * unreadable entries. The walk stops after {@code max-file-candidates} matches or when the
 * calling thread is interrupted (a timed-out step). Best match first: exact base name, then
 * name prefix, then shortest name.
 * Publishes the best path as {@code file_path} so a following step can attach it.
 */
@Component
public class FileLookupExecutor implements ActionExecutor {

    private static final Logger LOG = LogManager.getLogger(FileLookupExecutor.class);

    private final List<Path> roots;
    private final int maxResults;
    private final int maxDepth;
    private final int maxCandidates;

    public FileLookupExecutor(ExecutorProperties properties) {
        this.roots = properties.getFileSearchRoots().stream().map(Paths::get).toList();
        this.maxResults = properties.getMaxFileResults();
        this.maxDepth = properties.getMaxFileSearchDepth();
        this.maxCandidates = properties.getMaxFileCandidates();
    }

    @Override
    public String name() {
        return "file_search";
    }

    @Override
    public IntentCategory intent() {
        return IntentCategory.FILE_LOOKUP;
    }

    @Override
    public String description() {
        return "Finds a file on this machine";
    }

    @Override
    public ActionOutcome execute(Map<String, String> parameters) {
        String query = parameters.get(SlotNames.QUERY);
        if (query == null || query.isBlank()) {
            return ActionOutcome.failure("What file should I look for?");
        }
        List<String> words = Arrays.stream(query.toLowerCase(Locale.ROOT).split("[\\s_\\-]+"))
                .filter(w -> !w.isBlank())
                .toList();

        List<Path> matches = new ArrayList<>();
        for (Path root : roots) {
            if (stopped(matches)) {
                break;
            }
            if (Files.isDirectory(root)) {
                collect(root, words, matches);
            } else {
                LOG.debug("Skipping missing search root {}", root);
            }
        }
        if (Thread.currentThread().isInterrupted()) {
            LOG.info("File search for '{}' interrupted after {} matches", query, matches.size());
            return ActionOutcome.failure("The file search was cancelled.");
        }
        if (matches.size() >= maxCandidates) {
            LOG.debug("File search for '{}' stopped at {} candidates", query, maxCandidates);
        }
        if (matches.isEmpty()) {
            return ActionOutcome.failure("I couldn't find a file matching '" + query + "'.");
        }

        String joined = String.join(" ", words);
        matches.sort(Comparator
                .comparingInt((Path p) -> rank(baseName(p), joined))
                .thenComparingInt(p -> p.getFileName().toString().length())
                .thenComparing(Path::toString));
        List<Path> top = matches.subList(0, Math.min(maxResults, matches.size()));
        Path best = top.get(0);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(SlotNames.FILE_PATH, best.toAbsolutePath().toString());
        payload.put("file_name", best.getFileName().toString());
        payload.put("matches", top.stream().map(p -> p.toAbsolutePath().toString()).toList());
        return ActionOutcome.success("Found " + best.getFileName() + ".", payload);
    }

    private void collect(Path root, List<String> words, List<Path> matches) {
        try {
            Files.walkFileTree(root, EnumSet.noneOf(FileVisitOption.class), maxDepth, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (stopped(matches)) {
                        return FileVisitResult.TERMINATE;
                    }
                    Path name = dir.getFileName();
                    if (!dir.equals(root) && name != null && name.toString().startsWith(".")) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (stopped(matches)) {
                        return FileVisitResult.TERMINATE;
                    }
                    String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
                    if (attrs.isRegularFile() && words.stream().allMatch(name::contains)) {
                        matches.add(file);
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) {
                    LOG.debug("Cannot read {}: {}", file, exc.getMessage());
                    return FileVisitResult.CONTINUE;
                }
            });
        } catch (IOException e) {
            LOG.warn("File search under {} failed: {}", root, e.getMessage());
        }
    }

    private boolean stopped(List<Path> matches) {
        return matches.size() >= maxCandidates || Thread.currentThread().isInterrupted();
    }

    private static String baseName(Path p) {
        String name = p.getFileName().toString().toLowerCase(Locale.ROOT);
        int dot = name.lastIndexOf('.');
        return (dot > 0 ? name.substring(0, dot) : name).replaceAll("[_\\-]+", " ");
    }

    private static int rank(String baseName, String query) {
        if (baseName.equals(query)) {
            return 0;
        }
        return baseName.startsWith(query) ? 1 : 2;
    }
}
