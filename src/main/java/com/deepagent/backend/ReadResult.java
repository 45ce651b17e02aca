package com.deepagent.backend;

/**
 * Outcome of a {@code read}: either the windowed content or an error message.
 */
public record ReadResult(String content, String error) {

    public static ReadResult ok(String content) {
        return new ReadResult(content, null);
    }

    public static ReadResult error(String error) {
        return new ReadResult(null, error);
    }

    public boolean isError() {
        return error != null;
    }
}
