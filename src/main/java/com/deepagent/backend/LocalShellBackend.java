package com.deepagent.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * {@link FilesystemBackend} that can also run shell commands on the host, with the
 * root directory as working directory.
 *
 * <p>Commands run through {@code bash -c} ({@code cmd /c} on Windows). Stdout and stderr
 * are merged, capped at {@code maxOutputBytes}, and the process tree is destroyed once
 * the deadline passes.
 */
public class LocalShellBackend extends FilesystemBackend {

    private static final Logger log = LoggerFactory.getLogger(LocalShellBackend.class);

    private static final boolean WINDOWS =
            System.getProperty("os.name", "").toLowerCase().startsWith("windows");

    private final long timeoutSeconds;
    private final int maxOutputBytes;

    public LocalShellBackend(Path root, long timeoutSeconds, int maxOutputBytes) {
        super(root);
        this.timeoutSeconds = timeoutSeconds;
        this.maxOutputBytes = maxOutputBytes;
    }

    @Override
    public String id() {
        return "shell:" + root;
    }

    @Override
    public BackendKind kind() {
        return BackendKind.LOCAL_SHELL;
    }

    @Override
    public boolean supportsExecution() {
        return true;
    }

    @Override
    public ExecuteResult execute(String command) {
        if (command == null || command.isBlank()) {
            return new ExecuteResult("Error: command must not be empty", 1, false);
        }
        List<String> argv = WINDOWS
                ? List.of("cmd", "/c", command)
                : List.of("bash", "-c", command);
        log.debug("Executing in {}: {}", root, command);

        Process process;
        try {
            process = new ProcessBuilder(argv)
                    .directory(root.toFile())
                    .redirectErrorStream(true)
                    .start();
        } catch (IOException e) {
            log.warn("Failed to start command in {}: {}", root, e.getMessage());
            return new ExecuteResult("Error: failed to start command: " + e.getMessage(), 1, false);
        }

        var output = new BoundedOutput(maxOutputBytes);
        Thread drain = new Thread(() -> pump(process.getInputStream(), output), "shell-output-drain");
        drain.setDaemon(true);
        drain.start();

        try {
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                process.waitFor(5, TimeUnit.SECONDS);
                drain.join(TimeUnit.SECONDS.toMillis(1));
                log.warn("Command timed out after {}s in {}", timeoutSeconds, root);
                String captured = output.render();
                String text = captured.isEmpty()
                        ? ExecuteResult.timeoutMarker(timeoutSeconds)
                        : captured + "\n" + ExecuteResult.timeoutMarker(timeoutSeconds);
                return new ExecuteResult(text, ExecuteResult.TIMEOUT_EXIT_CODE, output.overflowed());
            }
            drain.join(TimeUnit.SECONDS.toMillis(5));
            int exitCode = process.exitValue();
            log.debug("Command exited with {} ({} bytes captured)", exitCode, output.size());
            return new ExecuteResult(output.render(), exitCode, output.overflowed());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            return new ExecuteResult("Error: command interrupted", 1, output.overflowed());
        }
    }

    private static void pump(InputStream in, BoundedOutput out) {
        byte[] buffer = new byte[8192];
        try (in) {
            int n;
            while ((n = in.read(buffer)) != -1) {
                out.write(buffer, 0, n);
            }
        } catch (IOException e) {
            // stream closes when the process is destroyed
            log.trace("Output drain ended: {}", e.getMessage());
        }
    }

    public long timeoutSeconds() {
        return timeoutSeconds;
    }

    public int maxOutputBytes() {
        return maxOutputBytes;
    }
}
