package com.deepagent.backend;

import java.util.List;

/**
 * Uniform contract for the file and command operations an agent may perform.
 *
 * <p>Every path is resolved against the backend's root before use; a path that would
 * leave the root is reported as an error result, never followed. Expected conditions
 * (missing file, no match, edit mismatch) come back as values: {@link ReadResult},
 * {@link WriteResult}, {@link EditResult}, or an empty list.
 *
 * <p>Implementations: {@link FilesystemBackend} (no execution), {@link LocalShellBackend}
 * (host execution), and {@code DockerSandboxBackend} (execution inside a container).
 */
public interface ExecutionBackend extends AutoCloseable {

    int DEFAULT_READ_LIMIT = 2000;

    /**
     * Lists the direct children of a directory, excluding the directory itself.
     * @return entries sorted by path; empty when the path is missing or not a directory
     */
    List<FileInfo> ls(String path);

    /**
     * Reads a window of lines {@code [offset, offset + limit)} from a text file.
     */
    ReadResult read(String path, int offset, int limit);

    default ReadResult read(String path) {
        return read(path, 0, DEFAULT_READ_LIMIT);
    }

    /**
     * Writes {@code content} to {@code path}, creating parent directories and replacing
     * any existing content.
     */
    WriteResult write(String path, String content);

    /**
     * Replaces the first (or every) occurrence of {@code oldString}.
     * Fails without writing when the file does not contain it.
     */
    EditResult edit(String path, String oldString, String newString, boolean replaceAll);

    /**
     * Finds entries under {@code path} whose relative path matches a glob pattern.
     */
    List<FileInfo> glob(String pattern, String path);

    default List<FileInfo> glob(String pattern) {
        return glob(pattern, "/");
    }

    /**
     * Literal (fixed-string) search across files under {@code path}, optionally restricted
     * to file names matching {@code glob}.
     */
    List<GrepMatch> grep(String pattern, String path, String glob);

    /**
     * Whether {@link #execute(String)} is available on this backend.
     */
    default boolean supportsExecution() {
        return false;
    }

    /**
     * Runs a shell command under the backend's deadline and output cap.
     * @throws UnsupportedOperationException on backends without execution
     */
    default ExecuteResult execute(String command) {
        throw new UnsupportedOperationException(
                "Command execution not supported by " + getClass().getSimpleName());
    }

    List<FileTransferResult> upload(List<FileUpload> files);

    List<FileTransferResult> download(List<String> paths);

    /**
     * Short identifier used in logs and session summaries.
     */
    String id();

    BackendKind kind();

    /**
     * Releases the backend. For the sandbox this tears the container down.
     * Never throws.
     */
    @Override
    default void close() {
    }
}
