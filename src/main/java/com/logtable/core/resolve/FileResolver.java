package com.logtable.core.resolve;

import com.logtable.core.errors.LogtableException;
import com.logtable.core.errors.NoMatchException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Expands glob-style path patterns into an ordered, deduplicated list of regular files.
 * <p>
 * Patterns are resolved in the order given; the files matched by one pattern are sorted
 * lexicographically so that resolution, and with it canonical line order, is stable across
 * runs against an unchanged filesystem. A file matched by several patterns keeps the rank of
 * the first pattern that matched it.
 * <p>
 * Glob syntax is that of {@link java.nio.file.FileSystem#getPathMatcher(String)}: {@code *}
 * and {@code ?} stay within one path segment, {@code **} crosses directories. A pattern that
 * names an existing file is taken literally, even when it contains glob characters.
 */
@Service
public class FileResolver {

    private static final Logger log = LoggerFactory.getLogger(FileResolver.class);

    private static final String GLOB_CHARS = "*?[{";

    /**
     * Resolves the given patterns.
     *
     * @param patterns   glob patterns, absolute or relative to the working directory
     * @param allowEmpty when {@code false}, zero resolved files is an error
     * @return matching regular files as normalized absolute paths, in resolution order
     * @throws NoMatchException if nothing matched and {@code allowEmpty} is {@code false}
     */
    public List<Path> resolve(List<String> patterns, boolean allowEmpty) {
        var resolved = new LinkedHashSet<Path>();
        for (String pattern : patterns) {
            List<Path> matches = expand(pattern);
            log.debug("Pattern {} matched {} file(s)", pattern, matches.size());
            resolved.addAll(matches);
        }
        if (resolved.isEmpty() && !allowEmpty) {
            throw NoMatchException.noFiles(patterns);
        }
        return List.copyOf(resolved);
    }

    List<Path> expand(String pattern) {
        String normalized = pattern.replace('\\', '/');
        Path literal = literalFile(normalized);
        if (literal != null) {
            return List.of(literal);
        }
        if (!hasGlob(normalized)) {
            return List.of();
        }

        String[] segments = normalized.split("/", -1);
        // existing directories stay literal even when their names look like globs
        int firstGlob = 0;
        while (firstGlob < segments.length - 1
                && (!hasGlob(segments[firstGlob]) || isDirectory(segments, firstGlob))) {
            firstGlob++;
        }
        Path base = baseDirectory(normalized, segments, firstGlob);
        if (!Files.isDirectory(base)) {
            return List.of();
        }

        String remainder = String.join("/", List.of(segments).subList(firstGlob, segments.length));
        PathMatcher matcher = base.getFileSystem().getPathMatcher("glob:" + remainder);
        int maxDepth = remainder.contains("**") ? Integer.MAX_VALUE : segments.length - firstGlob;

        var matches = new ArrayList<Path>();
        try (var stream = Files.walk(base, maxDepth)) {
            stream.filter(Files::isRegularFile)
                  .filter(p -> matcher.matches(base.relativize(p)))
                  .map(p -> p.toAbsolutePath().normalize())
                  .forEach(matches::add);
        } catch (IOException | UncheckedIOException e) {
            throw new LogtableException("Failed to expand pattern " + pattern + ": " + e.getMessage(), e);
        }
        matches.sort(null);
        return matches;
    }

    /**
     * The pattern as an existing regular file, or {@code null}. Checked before globbing so that
     * names containing {@code [} or {@code {} resolve to themselves.
     */
    private static Path literalFile(String pattern) {
        try {
            Path path = Path.of(pattern).toAbsolutePath().normalize();
            return Files.isRegularFile(path) ? path : null;
        } catch (InvalidPathException e) {
            return null;
        }
    }

    private static boolean isDirectory(String[] segments, int through) {
        String prefix = String.join("/", List.of(segments).subList(0, through + 1));
        try {
            return !prefix.isEmpty() && Files.isDirectory(Path.of(prefix));
        } catch (InvalidPathException e) {
            return false;
        }
    }

    private static Path baseDirectory(String pattern, String[] segments, int firstGlob) {
        String prefix = String.join("/", List.of(segments).subList(0, firstGlob));
        if (prefix.isEmpty()) {
            prefix = pattern.startsWith("/") ? "/" : ".";
        }
        return Path.of(prefix).toAbsolutePath().normalize();
    }

    static boolean hasGlob(String text) {
        for (int i = 0; i < text.length(); i++) {
            if (GLOB_CHARS.indexOf(text.charAt(i)) >= 0) {
                return true;
            }
        }
        return false;
    }
}
