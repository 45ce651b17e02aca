package com.deepagent.backend;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Root-confined path resolution shared by the host backends.
 *
 * <p>Relative paths and absolute "virtual" paths ({@code /src/App.java}) both land under
 * the root. An absolute path already inside the root's real location passes through
 * unchanged. Anything that normalizes outside the root is rejected.
 */
public final class BackendPaths {

    private BackendPaths() {}

    public static Path resolve(Path root, String path) {
        if (path == null || path.isBlank() || ".".equals(path) || "/".equals(path)) {
            return root;
        }
        Path candidate;
        try {
            Path raw = Path.of(path);
            if (raw.isAbsolute() && raw.normalize().startsWith(root)) {
                candidate = raw.normalize();
            } else {
                candidate = root.resolve(stripLeadingSlashes(path)).normalize();
            }
        } catch (InvalidPathException e) {
            throw new PathOutsideRootException(path);
        }
        if (!candidate.startsWith(root)) {
            throw new PathOutsideRootException(path);
        }
        return candidate;
    }

    /**
     * Renders a resolved path as the virtual path the agent sees, e.g. {@code /src/App.java}.
     */
    public static String toVirtual(Path root, Path resolved) {
        String relative = root.relativize(resolved).toString().replace('\\', '/');
        return "/" + relative;
    }

    static String stripLeadingSlashes(String path) {
        int i = 0;
        while (i < path.length() && (path.charAt(i) == '/' || path.charAt(i) == '\\')) {
            i++;
        }
        return path.substring(i);
    }
}
