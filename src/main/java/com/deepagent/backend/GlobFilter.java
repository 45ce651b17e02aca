package com.deepagent.backend;

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;

/**
 * Glob matching on relative paths using {@code java.nio} glob syntax.
 *
 * <p>A pattern without a separator ({@code *.py}) matches file names at any depth;
 * a leading {@code **}{@code /} also matches entries at the top level.
 */
public final class GlobFilter {

    private final PathMatcher matcher;
    private final PathMatcher tailMatcher;
    private final boolean nameOnly;

    private GlobFilter(String pattern) {
        String normalized = BackendPaths.stripLeadingSlashes(pattern);
        this.nameOnly = !normalized.contains("/");
        this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + normalized);
        this.tailMatcher = normalized.startsWith("**/")
                ? FileSystems.getDefault().getPathMatcher("glob:" + normalized.substring(3))
                : null;
    }

    public static GlobFilter of(String pattern) {
        if (pattern == null || pattern.isBlank()) {
            return new GlobFilter("*");
        }
        return new GlobFilter(pattern);
    }

    /**
     * @param relativePath path relative to the search directory, using {@code /} separators
     */
    public boolean matches(String relativePath) {
        if (relativePath == null || relativePath.isEmpty()) {
            return false;
        }
        Path candidate = Paths.get(relativePath);
        if (nameOnly) {
            Path name = candidate.getFileName();
            return name != null && matcher.matches(name);
        }
        if (matcher.matches(candidate)) {
            return true;
        }
        return tailMatcher != null && tailMatcher.matches(candidate);
    }
}
