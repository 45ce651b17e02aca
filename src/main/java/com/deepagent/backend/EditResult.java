package com.deepagent.backend;

/**
 * Outcome of an {@code edit}.
 *
 * @param error       message when the edit failed, otherwise {@code null}
 * @param path        the resolved path, when known
 * @param occurrences number of occurrences actually replaced (0 on failure)
 */
public record EditResult(String error, String path, int occurrences) {

    public static EditResult ok(String path, int occurrences) {
        return new EditResult(null, path, occurrences);
    }

    public static EditResult error(String error, String path) {
        return new EditResult(error, path, 0);
    }

    public boolean isError() {
        return error != null;
    }
}
