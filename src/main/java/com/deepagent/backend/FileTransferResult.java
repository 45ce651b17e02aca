package com.deepagent.backend;

/**
 * Per-file outcome of {@code upload} or {@code download}.
 *
 * @param path    the requested path
 * @param content downloaded bytes ({@code null} for uploads and failures)
 * @param error   one of {@code file_not_found}, {@code is_directory}, {@code invalid_path},
 *                {@code permission_denied}, {@code file_too_large}, or {@code null} on success
 */
public record FileTransferResult(String path, byte[] content, String error) {

    public static FileTransferResult ok(String path, byte[] content) {
        return new FileTransferResult(path, content, null);
    }

    public static FileTransferResult failed(String path, String error) {
        return new FileTransferResult(path, null, error);
    }

    public boolean isError() {
        return error != null;
    }
}
