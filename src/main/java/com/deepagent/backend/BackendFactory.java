package com.deepagent.backend;

import com.deepagent.core.metrics.AgentMetrics;
import com.deepagent.sandbox.DockerSandboxManager;
import com.deepagent.sandbox.SandboxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.Collection;

/**
 * Chooses and builds the backend for a new session.
 *
 * <p>Sandbox creation is the only step that depends on the environment. When it fails,
 * or when no Docker manager is configured, the session gets a host backend instead and
 * the fallback is logged and counted.
 */
@Service
public class BackendFactory {

    private static final Logger log = LoggerFactory.getLogger(BackendFactory.class);

    private final BackendProperties properties;
    private final DockerSandboxManager sandboxManager;
    private final AgentMetrics metrics;

    public BackendFactory(BackendProperties properties,
                          @Autowired(required = false) DockerSandboxManager sandboxManager,
                          @Autowired(required = false) AgentMetrics metrics) {
        this.properties = properties;
        this.sandboxManager = sandboxManager;
        this.metrics = metrics;
    }

    /**
     * {@code sandbox} selects the container backend; otherwise {@code codeinterpreter}
     * selects the host shell when it is enabled; everything else gets plain file access.
     */
    public BackendKind select(Collection<String> capabilities) {
        if (Capabilities.has(capabilities, Capabilities.SANDBOX)) {
            return BackendKind.SANDBOX;
        }
        if (Capabilities.has(capabilities, Capabilities.CODE_INTERPRETER) && properties.isShellEnabled()) {
            return BackendKind.LOCAL_SHELL;
        }
        return BackendKind.FILESYSTEM;
    }

    public ExecutionBackend create(Collection<String> capabilities, String sessionId) {
        return create(select(capabilities), sessionId);
    }

    public ExecutionBackend create(BackendKind kind, String sessionId) {
        return switch (kind) {
            case FILESYSTEM -> new FilesystemBackend(properties.sessionRoot(sessionId));
            case LOCAL_SHELL -> localShell(sessionId);
            case SANDBOX -> sandbox(sessionId);
        };
    }

    private ExecutionBackend sandbox(String sessionId) {
        if (sandboxManager == null) {
            return fallback(sessionId, "sandbox support is disabled");
        }
        try {
            return sandboxManager.create(sessionId);
        } catch (SandboxException e) {
            return fallback(sessionId, e.getMessage());
        }
    }

    private ExecutionBackend fallback(String sessionId, String reason) {
        ExecutionBackend backend = properties.isShellEnabled()
                ? localShell(sessionId)
                : new FilesystemBackend(properties.sessionRoot(sessionId));
        log.warn("Sandbox unavailable for session {} ({}); falling back to {}",
                sessionId, reason, backend.kind());
        if (metrics != null) {
            metrics.recordSandboxFallback(backend.kind().name().toLowerCase());
        }
        return backend;
    }

    private LocalShellBackend localShell(String sessionId) {
        return new LocalShellBackend(properties.sessionRoot(sessionId),
                properties.getExecuteTimeoutSeconds(),
                properties.getMaxOutputBytes());
    }
}
