package com.deepagent.dispatch.cli;

import com.deepagent.backend.ExecuteResult;
import com.deepagent.backend.ReadResult;
import com.deepagent.backend.WriteResult;
import com.deepagent.core.health.HealthCheckService;
import com.deepagent.core.health.HealthStatus;
import com.deepagent.sandbox.DockerSandboxBackend;
import com.deepagent.sandbox.DockerSandboxManager;
import com.deepagent.sandbox.SandboxContainer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * Exercises the picocli command tree directly, without a Spring context.
 */
class CliTest {

    private record CliResult(int exitCode, String output) {}

    private CommandLine.IFactory factory(HealthCheckService health, DockerSandboxManager manager) {
        return new CommandLine.IFactory() {
            @Override
            @SuppressWarnings("unchecked")
            public <K> K create(Class<K> cls) throws Exception {
                if (cls == HealthCommand.class) {
                    return (K) new HealthCommand(health);
                }
                if (cls == SandboxCheckCommand.class) {
                    return (K) new SandboxCheckCommand(manager);
                }
                return CommandLine.defaultFactory().create(cls);
            }
        };
    }

    private CliResult execute(HealthCheckService health, DockerSandboxManager manager, String... args) {
        ByteArrayOutputStream capture = new ByteArrayOutputStream();
        PrintStream capturePrintStream = new PrintStream(capture, true);
        PrintStream originalOut = System.out;
        PrintStream originalErr = System.err;
        System.setOut(capturePrintStream);
        System.setErr(capturePrintStream);
        try {
            int exitCode = new CommandLine(new DeepAgentCommand(), factory(health, manager)).execute(args);
            capturePrintStream.flush();
            return new CliResult(exitCode, capture.toString());
        } finally {
            System.setOut(originalOut);
            System.setErr(originalErr);
        }
    }

    private HealthCheckService health(HealthStatus.Status model, HealthStatus.Status docker) {
        HealthCheckService service = mock(HealthCheckService.class);
        when(service.checkAll()).thenReturn(List.of(
                new HealthStatus("sessions", HealthStatus.Status.UP, "0 active session(s)", Map.of()),
                new HealthStatus("model", model, "model check", Map.of()),
                new HealthStatus("docker", docker, "docker check", Map.of())));
        return service;
    }

    @Nested
    @DisplayName("Help output")
    class HelpTests {

        @Test
        @DisplayName("--help lists every subcommand")
        void helpListsSubcommands() {
            CliResult result = execute(null, null, "--help");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("serve"));
            assertTrue(result.output().contains("health"));
            assertTrue(result.output().contains("sandbox-check"));
        }

        @Test
        @DisplayName("--version shows version")
        void versionOutput() {
            CliResult result = execute(null, null, "--version");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("Deep Agent 0.1.0"));
        }
    }

    @Nested
    @DisplayName("health")
    class HealthTests {

        @Test
        @DisplayName("degraded components still exit 0")
        void degraded() {
            CliResult result = execute(health(HealthStatus.Status.UP, HealthStatus.Status.DEGRADED), null, "health");
            assertEquals(0, result.exitCode());
            assertTrue(result.output().contains("degraded"));
        }

        @Test
        @DisplayName("a down component exits 1")
        void down() {
            CliResult result = execute(health(HealthStatus.Status.DOWN, HealthStatus.Status.UP), null, "health");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("model check"));
        }

        @Test
        @DisplayName("without a health service the command fails")
        void unavailable() {
            assertEquals(1, execute(null, null, "health").exitCode());
        }
    }

    @Nested
    @DisplayName("sandbox-check")
    class SandboxCheckTests {

        @Test
        @DisplayName("fails when sandboxes are disabled")
        void disabled() {
            CliResult result = execute(null, null, "sandbox-check");
            assertEquals(1, result.exitCode());
            assertTrue(result.output().contains("disabled"));
        }

        @Test
        @DisplayName("fails when the daemon does not answer")
        void unreachable() {
            DockerSandboxManager manager = mock(DockerSandboxManager.class);
            when(manager.ping()).thenReturn(false);
            assertEquals(1, execute(null, manager, "sandbox-check").exitCode());
            verify(manager, never()).create(anyString());
        }

        @Test
        @DisplayName("round-trips a file, runs a command and tears the sandbox down")
        void fullCheck() {
            DockerSandboxManager manager = mock(DockerSandboxManager.class);
            DockerSandboxBackend backend = mock(DockerSandboxBackend.class);
            when(manager.ping()).thenReturn(true);
            when(manager.create(anyString())).thenReturn(backend);
            when(manager.activeSandboxes()).thenReturn(List.of());
            when(backend.id()).thenReturn("0123456789ab");
            when(backend.write(SandboxCheckCommand.CHECK_PATH, SandboxCheckCommand.CHECK_CONTENT))
                    .thenReturn(WriteResult.ok(SandboxCheckCommand.CHECK_PATH));
            when(backend.read(SandboxCheckCommand.CHECK_PATH)).thenReturn(ReadResult.ok(SandboxCheckCommand.CHECK_CONTENT));
            when(backend.execute("echo sandbox-ok")).thenReturn(new ExecuteResult("sandbox-ok\n", 0, false));

            CliResult result = execute(null, manager, "sandbox-check");

            assertEquals(0, result.exitCode(), result.output());
            verify(backend).close();
            assertTrue(result.output().contains("No sandbox containers left behind"));
        }

        @Test
        @DisplayName("a failing command still tears the sandbox down and reports leftovers")
        void failedCommand() {
            DockerSandboxManager manager = mock(DockerSandboxManager.class);
            DockerSandboxBackend backend = mock(DockerSandboxBackend.class);
            when(manager.ping()).thenReturn(true);
            when(manager.create(anyString())).thenReturn(backend);
            when(manager.activeSandboxes()).thenReturn(List.of(
                    new SandboxContainer("0123456789ab", "deepagent-sandbox-x", "x", "running")));
            when(backend.write(anyString(), anyString())).thenReturn(WriteResult.ok(SandboxCheckCommand.CHECK_PATH));
            when(backend.read(anyString())).thenReturn(ReadResult.ok(SandboxCheckCommand.CHECK_CONTENT));
            when(backend.execute(anyString())).thenReturn(new ExecuteResult("sh: not found", 127, false));

            CliResult result = execute(null, manager, "sandbox-check");

            assertEquals(1, result.exitCode());
            verify(backend).close();
            assertTrue(result.output().contains("deepagent-sandbox-x"));
        }
    }
}
