package com.deepagent.backend;

/**
 * Raised by path resolution when a requested path would leave the backend root.
 * Backends convert it into an error result before it reaches callers.
 */
public class PathOutsideRootException extends RuntimeException {

    public PathOutsideRootException(String path) {
        super("Path escapes backend root: " + path);
    }
}
