package com.deepagent.sandbox;

import com.deepagent.backend.BackendProperties;
import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.model.Container;
import com.github.dockerjava.api.model.HostConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;

/**
 * Creates, tracks and destroys one Docker container per sandboxed session.
 *
 * <p>Each container is configured with:
 * <ul>
 *   <li>No network ({@code network_mode=none}) and no bind mounts</li>
 *   <li>Memory and CPU limits from {@link SandboxProperties}</li>
 *   <li>Labels {@code deepagent.session=<id>} and {@code deepagent.role=sandbox}</li>
 *   <li>Command: {@code sleep infinity}, so every operation is an exec</li>
 * </ul>
 */
public class DockerSandboxManager {

    private static final Logger log = LoggerFactory.getLogger(DockerSandboxManager.class);

    public static final String LABEL_SESSION = "deepagent.session";
    public static final String LABEL_ROLE = "deepagent.role";
    public static final String ROLE_SANDBOX = "sandbox";

    private final DockerClient dockerClient;
    private final SandboxProperties sandboxProperties;
    private final BackendProperties backendProperties;
    /** sessionId -> containerId for sandboxes created by this process. */
    private final Map<String, String> live = new ConcurrentHashMap<>();

    public DockerSandboxManager(DockerClient dockerClient,
                                SandboxProperties sandboxProperties,
                                BackendProperties backendProperties) {
        this.dockerClient = dockerClient;
        this.sandboxProperties = sandboxProperties;
        this.backendProperties = backendProperties;
    }

    /**
     * Starts a fresh container for {@code sessionId} and returns a backend bound to it.
     * A container that was created but failed to start is removed before the exception
     * propagates.
     *
     * @throws SandboxException when the image is missing or the daemon refuses
     */
    public DockerSandboxBackend create(String sessionId) {
        String image = sandboxProperties.getImage();
        String containerName = "deepagent-sandbox-" + sessionId;
        String workdir = sandboxProperties.getWorkdir();
        String containerId = null;
        try {
            ensureImage(image);

            var hostConfig = HostConfig.newHostConfig()
                    .withMemory((long) sandboxProperties.getMemoryLimitMb() * 1024 * 1024)
                    .withNanoCPUs((long) sandboxProperties.getCpuCount() * 1_000_000_000L)
                    .withNetworkMode("none");

            var response = dockerClient.createContainerCmd(image)
                    .withName(containerName)
                    .withHostConfig(hostConfig)
                    .withLabels(Map.of(LABEL_SESSION, sessionId, LABEL_ROLE, ROLE_SANDBOX))
                    .withCmd("sleep", "infinity")
                    .withWorkingDir(workdir)
                    .exec();
            containerId = response.getId();
            dockerClient.startContainerCmd(containerId).exec();

            var exec = new DockerContainerExec(dockerClient, containerId);
            ExecOutput mkdir = exec.run(List.of("mkdir", "-p", workdir),
                    DockerSandboxBackend.FILE_OP_TIMEOUT_SECONDS, 4096);
            if (!mkdir.succeeded()) {
                throw new SandboxException("Failed to prepare " + workdir + ": " + mkdir.stderr().strip());
            }

            live.put(sessionId, containerId);
            log.info("Sandbox {} started for session {} (container {}, image {})",
                    containerName, sessionId, shortId(containerId), image);

            String startedId = containerId;
            return new DockerSandboxBackend(exec, workdir,
                    backendProperties.getExecuteTimeoutSeconds(),
                    backendProperties.getMaxOutputBytes(),
                    () -> teardown(sessionId, startedId));
        } catch (RuntimeException e) {
            if (containerId != null) {
                teardown(sessionId, containerId);
            }
            if (e instanceof SandboxException se) {
                throw se;
            }
            throw new SandboxException("Failed to create sandbox for session " + sessionId
                    + ": " + e.getMessage(), e);
        }
    }

    /**
     * Stops and force-removes a container. Never throws; repeated calls are harmless.
     */
    public void teardown(String sessionId, String containerId) {
        live.remove(sessionId, containerId);
        try {
            dockerClient.stopContainerCmd(containerId).withTimeout(5).exec();
        } catch (Exception e) {
            log.debug("Container {} may already be stopped: {}", shortId(containerId), e.getMessage());
        }
        try {
            dockerClient.removeContainerCmd(containerId).withForce(true).exec();
            log.info("Sandbox for session {} torn down (container {})", sessionId, shortId(containerId));
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", shortId(containerId));
        } catch (Exception e) {
            log.warn("Failed to remove container {}: {}", shortId(containerId), e.getMessage());
        }
    }

    /**
     * Containers carrying the sandbox role label, including ones left by earlier processes.
     */
    public List<SandboxContainer> activeSandboxes() {
        List<Container> containers = dockerClient.listContainersCmd()
                .withShowAll(true)
                .withLabelFilter(Map.of(LABEL_ROLE, ROLE_SANDBOX))
                .exec();
        return containers.stream()
                .map(c -> new SandboxContainer(
                        c.getId(),
                        c.getNames() != null && c.getNames().length > 0 ? c.getNames()[0] : "",
                        c.getLabels() != null ? c.getLabels().get(LABEL_SESSION) : null,
                        c.getState()))
                .toList();
    }

    public int trackedCount() {
        return live.size();
    }

    public boolean ping() {
        try {
            dockerClient.pingCmd().exec();
            return true;
        } catch (Exception e) {
            log.debug("Docker ping failed: {}", e.getMessage());
            return false;
        }
    }

    private void ensureImage(String image) {
        try {
            dockerClient.inspectImageCmd(image).exec();
            return;
        } catch (NotFoundException e) {
            if (!sandboxProperties.isPullMissingImage()) {
                throw new SandboxException("Sandbox image " + image + " is not available locally");
            }
        }
        log.info("Pulling sandbox image {}", image);
        try {
            dockerClient.pullImageCmd(image)
                    .exec(new PullImageResultCallback())
                    .awaitCompletion(5, TimeUnit.MINUTES);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SandboxException("Interrupted while pulling " + image, e);
        }
    }

    private static String shortId(String containerId) {
        return containerId.length() > 12 ? containerId.substring(0, 12) : containerId;
    }
}
