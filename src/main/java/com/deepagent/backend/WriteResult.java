package com.deepagent.backend;

/**
 * Outcome of a {@code write}. Expected failures are carried in {@code error}, never thrown.
 *
 * @param error message when the write failed, otherwise {@code null}
 * @param path  the resolved path that was written, {@code null} on failure
 */
public record WriteResult(String error, String path) {

    public static WriteResult ok(String path) {
        return new WriteResult(null, path);
    }

    public static WriteResult error(String error) {
        return new WriteResult(error, null);
    }

    public boolean isError() {
        return error != null;
    }
}
