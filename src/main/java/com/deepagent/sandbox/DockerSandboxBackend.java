package com.deepagent.sandbox;

import com.deepagent.backend.BackendKind;
import com.deepagent.backend.BoundedOutput;
import com.deepagent.backend.EditResult;
import com.deepagent.backend.ExecuteResult;
import com.deepagent.backend.ExecutionBackend;
import com.deepagent.backend.FileInfo;
import com.deepagent.backend.FileTransferResult;
import com.deepagent.backend.FileUpload;
import com.deepagent.backend.GlobFilter;
import com.deepagent.backend.GrepMatch;
import com.deepagent.backend.PathOutsideRootException;
import com.deepagent.backend.ReadResult;
import com.deepagent.backend.TextEdits;
import com.deepagent.backend.WriteResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Base64;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * {@link ExecutionBackend} whose every operation runs inside a dedicated Docker container.
 *
 * <p>Agent-supplied values (paths, content, patterns) are always passed as separate argv
 * entries or positional shell parameters, never spliced into a shell string. The one
 * exception is {@link #execute(String)}, whose purpose is to run the agent's command.
 *
 * <p>Paths are container paths under the working directory. {@code /} and relative
 * paths map into the working directory; anything normalizing outside it is rejected.
 */
public class DockerSandboxBackend implements ExecutionBackend {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxBackend.class);

    static final long FILE_OP_TIMEOUT_SECONDS = 30;
    static final int MAX_FILE_BYTES = 10 * 1024 * 1024;
    /** Characters per argv chunk; keeps each argument well under the kernel's per-arg limit. */
    static final int WRITE_CHUNK_CHARS = 16_384;
    static final int UPLOAD_CHUNK_CHARS = 32_768;

    private static final String WRITE_SCRIPT = "printf '%s' \"$1\" > \"$2\"";
    private static final String APPEND_SCRIPT = "printf '%s' \"$1\" >> \"$2\"";
    private static final String DECODE_SCRIPT = "base64 -d \"$1\" > \"$2\" && rm -f \"$1\"";
    private static final Pattern GREP_LINE = Pattern.compile("^(.*?):(\\d+):(.*)$");

    private final ContainerExec exec;
    private final String workdir;
    private final long executeTimeoutSeconds;
    private final int maxOutputBytes;
    private final Runnable onClose;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public DockerSandboxBackend(ContainerExec exec, String workdir, long executeTimeoutSeconds,
                                int maxOutputBytes, Runnable onClose) {
        this.exec = exec;
        this.workdir = normalize(workdir);
        this.executeTimeoutSeconds = executeTimeoutSeconds;
        this.maxOutputBytes = maxOutputBytes;
        this.onClose = onClose;
    }

    @Override
    public String id() {
        return "sandbox:" + exec.containerId();
    }

    @Override
    public BackendKind kind() {
        return BackendKind.SANDBOX;
    }

    public String containerId() {
        return exec.containerId();
    }

    public String workdir() {
        return workdir;
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Maps an agent path to a container path under the working directory.
     * @throws PathOutsideRootException when the path normalizes outside it
     */
    String containerPath(String path) {
        if (path == null || path.isBlank() || ".".equals(path) || "/".equals(path)) {
            return workdir;
        }
        String candidate;
        if (path.equals(workdir) || path.startsWith(workdir + "/")) {
            candidate = normalize(path);
        } else if (path.startsWith("/")) {
            candidate = normalize(workdir + path);
        } else {
            candidate = normalize(workdir + "/" + path);
        }
        if (candidate == null || !(candidate.equals(workdir) || candidate.startsWith(workdir + "/"))) {
            throw new PathOutsideRootException(path);
        }
        return candidate;
    }

    @Override
    public List<FileInfo> ls(String path) {
        ensureOpen();
        String dir;
        try {
            dir = containerPath(path);
        } catch (PathOutsideRootException e) {
            log.warn("ls rejected: {}", e.getMessage());
            return List.of();
        }
        ExecOutput out = exec.run(List.of("find", dir, "-mindepth", "1", "-maxdepth", "1",
                "-printf", "%p\\t%s\\t%y\\n"), FILE_OP_TIMEOUT_SECONDS, MAX_FILE_BYTES);
        if (!out.succeeded()) {
            return List.of();
        }
        return parseFindOutput(out.stdout(), null);
    }

    @Override
    public ReadResult read(String path, int offset, int limit) {
        ensureOpen();
        String file;
        try {
            file = containerPath(path);
        } catch (PathOutsideRootException e) {
            return ReadResult.error(e.getMessage());
        }
        ExecOutput out = cat(file);
        if (!out.succeeded()) {
            return ReadResult.error(readFailure(path, out));
        }
        if (out.truncated()) {
            return ReadResult.error(tooLarge(path));
        }
        return TextEdits.window(out.stdout(), offset, limit);
    }

    @Override
    public WriteResult write(String path, String content) {
        ensureOpen();
        String file;
        try {
            file = containerPath(path);
        } catch (PathOutsideRootException e) {
            return WriteResult.error(e.getMessage());
        }
        String failure = writeFile(file, content == null ? "" : content);
        if (failure != null) {
            return WriteResult.error("Write failed for " + path + ": " + failure);
        }
        log.debug("Wrote {} chars to {} in {}", content == null ? 0 : content.length(), file, id());
        return WriteResult.ok(file);
    }

    @Override
    public EditResult edit(String path, String oldString, String newString, boolean replaceAll) {
        ensureOpen();
        String file;
        try {
            file = containerPath(path);
        } catch (PathOutsideRootException e) {
            return EditResult.error(e.getMessage(), null);
        }
        ExecOutput out = cat(file);
        if (!out.succeeded()) {
            return EditResult.error(readFailure(path, out), null);
        }
        if (out.truncated()) {
            return EditResult.error(tooLarge(path), file);
        }
        String current = out.stdout();
        int count = TextEdits.countOccurrences(current, oldString);
        if (count == 0) {
            return EditResult.error("String not found in " + path, file);
        }
        String failure = writeFile(file, TextEdits.replace(current, oldString, newString, replaceAll));
        if (failure != null) {
            return EditResult.error("Write failed for " + path + ": " + failure, file);
        }
        return EditResult.ok(file, replaceAll ? count : 1);
    }

    @Override
    public List<FileInfo> glob(String pattern, String path) {
        ensureOpen();
        String dir;
        try {
            dir = containerPath(path);
        } catch (PathOutsideRootException e) {
            log.warn("glob rejected: {}", e.getMessage());
            return List.of();
        }
        ExecOutput out = exec.run(List.of("find", dir, "-mindepth", "1",
                "-printf", "%P\\t%s\\t%y\\n"), FILE_OP_TIMEOUT_SECONDS, MAX_FILE_BYTES);
        if (!out.succeeded()) {
            return List.of();
        }
        return parseFindOutput(out.stdout(), new RelativeGlob(dir, GlobFilter.of(pattern)));
    }

    @Override
    public List<GrepMatch> grep(String pattern, String path, String glob) {
        ensureOpen();
        if (pattern == null || pattern.isEmpty()) {
            return List.of();
        }
        String target;
        try {
            target = containerPath(path);
        } catch (PathOutsideRootException e) {
            log.warn("grep rejected: {}", e.getMessage());
            return List.of();
        }
        var argv = new ArrayList<>(List.of("grep", "-rnHIF", "-e", pattern));
        if (glob != null && !glob.isBlank()) {
            argv.add("--include=" + glob);
        }
        argv.add("--");
        argv.add(target);

        ExecOutput out = exec.run(argv, FILE_OP_TIMEOUT_SECONDS, MAX_FILE_BYTES);
        // grep exits 1 when nothing matched and 2 on unreadable paths
        if (out.exitCode() != 0 && out.stdout().isEmpty()) {
            if (out.exitCode() > 1) {
                log.debug("grep in {} exited {}: {}", id(), out.exitCode(), out.stderr().strip());
            }
            return List.of();
        }
        var matches = new ArrayList<GrepMatch>();
        for (String line : out.stdout().split("\n")) {
            Matcher m = GREP_LINE.matcher(line);
            if (m.matches()) {
                matches.add(new GrepMatch(m.group(1), Integer.parseInt(m.group(2)), m.group(3)));
            }
        }
        return matches;
    }

    @Override
    public boolean supportsExecution() {
        return true;
    }

    @Override
    public ExecuteResult execute(String command) {
        ensureOpen();
        if (command == null || command.isBlank()) {
            return new ExecuteResult("Error: command must not be empty", 1, false);
        }
        log.debug("Executing in {}: {}", id(), command);
        ExecOutput out = exec.run(List.of("timeout", "-k", "5", String.valueOf(executeTimeoutSeconds),
                "bash", "-c", command), executeTimeoutSeconds + 15, maxOutputBytes);

        String combined = out.stdout();
        if (!out.stderr().isEmpty()) {
            combined = combined.isEmpty() ? out.stderr() : combined + "\n" + out.stderr();
        }
        boolean timedOut = out.timedOut() || out.exitCode() == ExecuteResult.TIMEOUT_EXIT_CODE;
        int exitCode = timedOut ? ExecuteResult.TIMEOUT_EXIT_CODE : out.exitCode();

        ExecuteResult capped = BoundedOutput.cap(combined, exitCode, maxOutputBytes);
        String text = capped.output();
        boolean truncated = capped.truncated();
        if (out.truncated() && !truncated) {
            text = text + ExecuteResult.TRUNCATION_MARKER;
            truncated = true;
        }
        if (timedOut) {
            String marker = ExecuteResult.timeoutMarker(executeTimeoutSeconds);
            text = text.isEmpty() ? marker : text + "\n" + marker;
            log.warn("Command timed out after {}s in {}", executeTimeoutSeconds, id());
        }
        return new ExecuteResult(text, exitCode, truncated);
    }

    @Override
    public List<FileTransferResult> upload(List<FileUpload> files) {
        ensureOpen();
        var results = new ArrayList<FileTransferResult>();
        for (FileUpload upload : files) {
            String file;
            try {
                file = containerPath(upload.path());
            } catch (PathOutsideRootException e) {
                results.add(FileTransferResult.failed(upload.path(), "invalid_path"));
                continue;
            }
            String encoded = Base64.getEncoder().encodeToString(upload.content());
            String staging = file + ".upload.b64";
            String failure = mkdirParent(file);
            if (failure == null) {
                failure = writeChunks(staging, encoded, UPLOAD_CHUNK_CHARS);
            }
            if (failure == null) {
                ExecOutput out = exec.run(List.of("sh", "-c", DECODE_SCRIPT, "sh", staging, file),
                        FILE_OP_TIMEOUT_SECONDS, maxOutputBytes);
                failure = out.succeeded() ? null : out.stderr();
            }
            if (failure == null) {
                results.add(FileTransferResult.ok(upload.path(), null));
            } else {
                log.debug("upload of {} into {} failed: {}", upload.path(), id(), failure.strip());
                results.add(FileTransferResult.failed(upload.path(), transferError(failure)));
            }
        }
        return results;
    }

    @Override
    public List<FileTransferResult> download(List<String> paths) {
        ensureOpen();
        var results = new ArrayList<FileTransferResult>();
        for (String path : paths) {
            String file;
            try {
                file = containerPath(path);
            } catch (PathOutsideRootException e) {
                results.add(FileTransferResult.failed(path, "invalid_path"));
                continue;
            }
            if (exec.run(List.of("test", "-d", file), FILE_OP_TIMEOUT_SECONDS, 1024).succeeded()) {
                results.add(FileTransferResult.failed(path, "is_directory"));
                continue;
            }
            ExecOutput out = exec.run(List.of("base64", "-w", "0", "--", file),
                    FILE_OP_TIMEOUT_SECONDS, MAX_FILE_BYTES * 2);
            if (!out.succeeded()) {
                results.add(FileTransferResult.failed(path, transferError(out.stderr())));
            } else if (out.truncated()) {
                results.add(FileTransferResult.failed(path, "file_too_large"));
            } else {
                results.add(FileTransferResult.ok(path, Base64.getDecoder().decode(out.stdout().strip())));
            }
        }
        return results;
    }

    /**
     * Tears the container down through the owning manager. Safe to call repeatedly.
     */
    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            try {
                onClose.run();
            } catch (RuntimeException e) {
                log.warn("Sandbox teardown for {} failed: {}", id(), e.getMessage());
            }
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Sandbox is closed");
        }
    }

    private ExecOutput cat(String file) {
        return exec.run(List.of("cat", "--", file), FILE_OP_TIMEOUT_SECONDS, MAX_FILE_BYTES);
    }

    private static String tooLarge(String path) {
        return "File too large: " + path + " exceeds " + MAX_FILE_BYTES + " bytes";
    }

    private static String readFailure(String path, ExecOutput out) {
        String stderr = out.stderr();
        if (stderr.contains("No such file")) {
            return "File not found: " + path;
        }
        if (stderr.contains("Is a directory")) {
            return "Cannot read " + path + ": it is a directory";
        }
        return "Error reading file " + path + ": " + stderr.strip();
    }

    /**
     * @return {@code null} on success, otherwise the failure detail
     */
    private String writeFile(String file, String content) {
        String failure = mkdirParent(file);
        if (failure != null) {
            return failure;
        }
        return writeChunks(file, content, WRITE_CHUNK_CHARS);
    }

    private String mkdirParent(String file) {
        int slash = file.lastIndexOf('/');
        String parent = slash > 0 ? file.substring(0, slash) : "/";
        ExecOutput out = exec.run(List.of("mkdir", "-p", "--", parent), FILE_OP_TIMEOUT_SECONDS, maxOutputBytes);
        return out.succeeded() ? null : out.stderr().strip();
    }

    private String writeChunks(String file, String content, int chunkChars) {
        int pos = 0;
        boolean first = true;
        do {
            int end = Math.min(content.length(), pos + chunkChars);
            if (end < content.length() && Character.isHighSurrogate(content.charAt(end - 1))) {
                end--;
            }
            String chunk = content.substring(pos, end);
            ExecOutput out = exec.run(List.of("sh", "-c", first ? WRITE_SCRIPT : APPEND_SCRIPT,
                    "sh", chunk, file), FILE_OP_TIMEOUT_SECONDS, maxOutputBytes);
            if (!out.succeeded()) {
                return out.stderr().isBlank() ? "exit code " + out.exitCode() : out.stderr().strip();
            }
            first = false;
            pos = end;
        } while (pos < content.length());
        return null;
    }

    private static String transferError(String stderr) {
        if (stderr == null) {
            return "invalid_path";
        }
        if (stderr.contains("Permission denied")) {
            return "permission_denied";
        }
        if (stderr.contains("No such file")) {
            return "file_not_found";
        }
        if (stderr.contains("Is a directory")) {
            return "is_directory";
        }
        return "invalid_path";
    }

    private List<FileInfo> parseFindOutput(String output, RelativeGlob glob) {
        var entries = new ArrayList<FileInfo>();
        for (String line : output.split("\n")) {
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\t");
            if (parts.length < 3) {
                continue;
            }
            String path = parts[0];
            if (glob != null) {
                if (!glob.filter().matches(path)) {
                    continue;
                }
                path = glob.dir().endsWith("/") ? glob.dir() + path : glob.dir() + "/" + path;
            }
            boolean directory = "d".equals(parts[2]);
            long size = 0;
            if (!directory) {
                try {
                    size = Long.parseLong(parts[1].trim());
                } catch (NumberFormatException e) {
                    log.trace("Unparseable size in find output: {}", line);
                }
            }
            entries.add(new FileInfo(path, directory, size));
        }
        entries.sort(Comparator.comparing(FileInfo::path));
        return entries;
    }

    /**
     * POSIX-style normalization of an absolute container path.
     * @return the normalized path, or {@code null} when {@code ..} climbs above {@code /}
     */
    static String normalize(String path) {
        Deque<String> segments = new ArrayDeque<>();
        for (String segment : path.split("/")) {
            if (segment.isEmpty() || ".".equals(segment)) {
                continue;
            }
            if ("..".equals(segment)) {
                if (segments.isEmpty()) {
                    return null;
                }
                segments.removeLast();
            } else {
                segments.addLast(segment);
            }
        }
        return "/" + String.join("/", segments);
    }

    private record RelativeGlob(String dir, GlobFilter filter) {}
}
