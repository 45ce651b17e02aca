package com.deepagent.sandbox;

import com.deepagent.backend.BackendProperties;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.CreateContainerCmd;
import com.github.dockerjava.api.command.CreateContainerResponse;
import com.github.dockerjava.api.command.ExecCreateCmd;
import com.github.dockerjava.api.command.ExecCreateCmdResponse;
import com.github.dockerjava.api.command.ExecStartCmd;
import com.github.dockerjava.api.command.InspectExecCmd;
import com.github.dockerjava.api.command.InspectExecResponse;
import com.github.dockerjava.api.command.InspectImageCmd;
import com.github.dockerjava.api.command.ListContainersCmd;
import com.github.dockerjava.api.command.PingCmd;
import com.github.dockerjava.api.command.RemoveContainerCmd;
import com.github.dockerjava.api.command.StartContainerCmd;
import com.github.dockerjava.api.command.StopContainerCmd;
import com.github.dockerjava.api.exception.DockerException;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for DockerSandboxManager.
 *
 * <p>The docker-java fluent builders are mocked by hand, one command at a time, so each
 * test can verify exactly which calls reached the daemon.
 */
class DockerSandboxManagerTest {

    private DockerClient dockerClient;
    private SandboxProperties sandboxProperties;
    private DockerSandboxManager manager;
    private CreateContainerCmd createCmd;

    @BeforeEach
    void setUp() {
        dockerClient = mock(DockerClient.class);
        sandboxProperties = new SandboxProperties();
        manager = new DockerSandboxManager(dockerClient, sandboxProperties, new BackendProperties());
        when(dockerClient.inspectImageCmd(anyString())).thenReturn(mock(InspectImageCmd.class));
        createCmd = mockCreateContainerCmd("c0ffee1234567890");
        when(dockerClient.startContainerCmd(anyString())).thenReturn(mock(StartContainerCmd.class));
        mockStopAndRemove();
    }

    @Test
    @DisplayName("create starts a locked-down, labelled container and prepares the workdir")
    void createSandbox() {
        mockExec(0);

        DockerSandboxBackend backend = manager.create("sess-1");

        assertEquals("c0ffee1234567890", backend.containerId());
        assertEquals("/workspace", backend.workdir());
        verify(createCmd).withName("deepagent-sandbox-sess-1");
        verify(createCmd).withLabels(Map.of(
                DockerSandboxManager.LABEL_SESSION, "sess-1",
                DockerSandboxManager.LABEL_ROLE, DockerSandboxManager.ROLE_SANDBOX));
        verify(createCmd).withCmd("sleep", "infinity");

        ArgumentCaptor<HostConfig> hostConfig = ArgumentCaptor.forClass(HostConfig.class);
        verify(createCmd).withHostConfig(hostConfig.capture());
        assertEquals("none", hostConfig.getValue().getNetworkMode());
        assertEquals(512L * 1024 * 1024, hostConfig.getValue().getMemory());
        assertEquals(1_000_000_000L, hostConfig.getValue().getNanoCPUs());

        verify(dockerClient).startContainerCmd("c0ffee1234567890");
        assertEquals(1, manager.trackedCount());
    }

    @Test
    @DisplayName("closing the backend stops and removes the container")
    void closeTearsDown() {
        mockExec(0);
        DockerSandboxBackend backend = manager.create("sess-2");

        backend.close();

        verify(dockerClient).stopContainerCmd("c0ffee1234567890");
        verify(dockerClient).removeContainerCmd("c0ffee1234567890");
        assertEquals(0, manager.trackedCount());
    }

    @Test
    @DisplayName("missing image without pull permission fails before creating anything")
    void missingImage() {
        when(dockerClient.inspectImageCmd(anyString())).thenThrow(new NotFoundException("no such image"));

        SandboxException e = assertThrows(SandboxException.class, () -> manager.create("sess-3"));
        assertTrue(e.getMessage().contains("python:3.11-slim"));
        verify(dockerClient, never()).createContainerCmd(anyString());
    }

    @Test
    @DisplayName("a container that fails to start is removed")
    void startFailureCleansUp() {
        var startCmd = mock(StartContainerCmd.class);
        when(startCmd.exec()).thenThrow(new DockerException("cannot start", 500));
        when(dockerClient.startContainerCmd(anyString())).thenReturn(startCmd);

        assertThrows(SandboxException.class, () -> manager.create("sess-4"));
        verify(dockerClient).removeContainerCmd("c0ffee1234567890");
        assertEquals(0, manager.trackedCount());
    }

    @Test
    @DisplayName("teardown never throws")
    void teardownSwallowsDaemonErrors() {
        when(dockerClient.stopContainerCmd(anyString())).thenThrow(new DockerException("gone", 500));
        when(dockerClient.removeContainerCmd(anyString())).thenThrow(new NotFoundException("gone"));

        assertDoesNotThrow(() -> manager.teardown("sess-5", "deadbeef"));
    }

    @Test
    @DisplayName("activeSandboxes lists containers by role label")
    void activeSandboxes() {
        var listCmd = mock(ListContainersCmd.class);
        when(dockerClient.listContainersCmd()).thenReturn(listCmd);
        when(listCmd.withShowAll(true)).thenReturn(listCmd);
        when(listCmd.withLabelFilter(anyMap())).thenReturn(listCmd);
        var container = mock(Container.class);
        when(container.getId()).thenReturn("abc");
        when(container.getNames()).thenReturn(new String[]{"/deepagent-sandbox-s"});
        when(container.getLabels()).thenReturn(Map.of(DockerSandboxManager.LABEL_SESSION, "s"));
        when(container.getState()).thenReturn("running");
        when(listCmd.exec()).thenReturn(List.of(container));

        List<SandboxContainer> sandboxes = manager.activeSandboxes();

        assertEquals(1, sandboxes.size());
        assertEquals("s", sandboxes.get(0).sessionId());
        verify(listCmd).withLabelFilter(Map.of(DockerSandboxManager.LABEL_ROLE, DockerSandboxManager.ROLE_SANDBOX));
    }

    @Test
    @DisplayName("ping reports daemon reachability")
    void ping() {
        var pingCmd = mock(PingCmd.class);
        when(dockerClient.pingCmd()).thenReturn(pingCmd);
        assertTrue(manager.ping());

        when(pingCmd.exec()).thenThrow(new RuntimeException("connection refused"));
        assertFalse(manager.ping());
    }

    // ── helpers ─────────────────────────────────────────────────────────

    private CreateContainerCmd mockCreateContainerCmd(String containerId) {
        var cmd = mock(CreateContainerCmd.class);
        when(dockerClient.createContainerCmd(anyString())).thenReturn(cmd);
        when(cmd.withName(anyString())).thenReturn(cmd);
        when(cmd.withHostConfig(any())).thenReturn(cmd);
        when(cmd.withLabels(anyMap())).thenReturn(cmd);
        when(cmd.withCmd(any(String[].class))).thenReturn(cmd);
        when(cmd.withWorkingDir(anyString())).thenReturn(cmd);
        var response = new CreateContainerResponse();
        response.setId(containerId);
        when(cmd.exec()).thenReturn(response);
        return cmd;
    }

    private void mockStopAndRemove() {
        var stopCmd = mock(StopContainerCmd.class);
        when(dockerClient.stopContainerCmd(anyString())).thenReturn(stopCmd);
        when(stopCmd.withTimeout(anyInt())).thenReturn(stopCmd);
        var removeCmd = mock(RemoveContainerCmd.class);
        when(dockerClient.removeContainerCmd(anyString())).thenReturn(removeCmd);
        when(removeCmd.withForce(anyBoolean())).thenReturn(removeCmd);
    }

    @SuppressWarnings("unchecked")
    private void mockExec(long exitCode) {
        var createExec = mock(ExecCreateCmd.class);
        when(dockerClient.execCreateCmd(anyString())).thenReturn(createExec);
        when(createExec.withCmd(any(String[].class))).thenReturn(createExec);
        when(createExec.withAttachStdout(anyBoolean())).thenReturn(createExec);
        when(createExec.withAttachStderr(anyBoolean())).thenReturn(createExec);
        var execResponse = mock(ExecCreateCmdResponse.class);
        when(execResponse.getId()).thenReturn("exec-1");
        when(createExec.exec()).thenReturn(execResponse);

        var startExec = mock(ExecStartCmd.class);
        when(dockerClient.execStartCmd("exec-1")).thenReturn(startExec);
        when(startExec.exec(any())).thenAnswer(invocation -> {
            ResultCallback.Adapter<Frame> callback = invocation.getArgument(0);
            callback.onComplete();
            return callback;
        });

        var inspect = mock(InspectExecCmd.class);
        when(dockerClient.inspectExecCmd("exec-1")).thenReturn(inspect);
        var inspectResponse = mock(InspectExecResponse.class);
        when(inspectResponse.getExitCodeLong()).thenReturn(exitCode);
        when(inspect.exec()).thenReturn(inspectResponse);
    }
}
