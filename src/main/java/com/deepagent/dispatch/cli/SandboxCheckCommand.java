package com.deepagent.dispatch.cli;

import com.deepagent.backend.ExecuteResult;
import com.deepagent.backend.ExecutionBackend;
import com.deepagent.backend.ReadResult;
import com.deepagent.backend.WriteResult;
import com.deepagent.sandbox.DockerSandboxManager;
import com.deepagent.sandbox.SandboxContainer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * CLI command: deepagent sandbox-check
 * <p>
 * Creates a throwaway sandbox, round-trips a test file, runs a command, tears the sandbox
 * down and lists any labelled containers still present.
 */
@Command(name = "sandbox-check", mixinStandardHelpOptions = true,
        description = "Verify that Docker sandboxes can be created, used and removed")
@Component
public class SandboxCheckCommand implements Callable<Integer> {

    static final String CHECK_PATH = "/check/hello.txt";
    static final String CHECK_CONTENT = "sandbox check";

    private final DockerSandboxManager sandboxManager;

    public SandboxCheckCommand(@Autowired(required = false) DockerSandboxManager sandboxManager) {
        this.sandboxManager = sandboxManager;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();
        if (sandboxManager == null) {
            ConsoleOutput.error("Sandbox support is disabled (deepagent.sandbox.enabled=false)");
            return 1;
        }
        if (!sandboxManager.ping()) {
            ConsoleOutput.error("Docker daemon is not reachable");
            return 1;
        }

        String checkSession = "check-" + UUID.randomUUID().toString().substring(0, 8);
        boolean ok = true;
        ExecutionBackend backend;
        try {
            backend = sandboxManager.create(checkSession);
        } catch (RuntimeException e) {
            ConsoleOutput.error("Sandbox creation failed: " + e.getMessage());
            return 1;
        }
        ConsoleOutput.sandbox("Started " + backend.id());
        try {
            WriteResult written = backend.write(CHECK_PATH, CHECK_CONTENT);
            ReadResult read = backend.read(CHECK_PATH);
            if (written.isError() || read.isError() || !CHECK_CONTENT.equals(read.content())) {
                ConsoleOutput.error("File round trip failed: "
                        + (written.isError() ? written.error() : read.error()));
                ok = false;
            } else {
                ConsoleOutput.success("File round trip");
            }

            ExecuteResult echo = backend.execute("echo sandbox-ok");
            if (echo.succeeded() && echo.output().contains("sandbox-ok")) {
                ConsoleOutput.success("Command execution");
            } else {
                ConsoleOutput.error("Command execution failed (exit " + echo.exitCode() + "): " + echo.output());
                ok = false;
            }
        } finally {
            backend.close();
            ConsoleOutput.sandbox("Torn down " + backend.id());
        }

        List<SandboxContainer> remaining = sandboxManager.activeSandboxes();
        if (remaining.isEmpty()) {
            ConsoleOutput.success("No sandbox containers left behind");
        } else {
            ConsoleOutput.warn(remaining.size() + " labelled sandbox container(s) still present:");
            remaining.forEach(c -> ConsoleOutput.sandbox("  " + c.name() + " (" + c.state() + ", session "
                    + c.sessionId() + ")"));
        }
        ConsoleOutput.rule();
        return ok ? 0 : 1;
    }
}
