package com.deepagent.core.health;

import com.deepagent.backend.BackendProperties;
import com.deepagent.core.session.SessionStore;
import com.deepagent.sandbox.DockerSandboxManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    static final String UNCONFIGURED_KEY = "not-configured";

    private final SessionStore sessionStore;
    private final DockerSandboxManager sandboxManager;
    private final BackendProperties backendProperties;
    private final String apiKey;

    public HealthCheckService(
            SessionStore sessionStore,
            BackendProperties backendProperties,
            @Autowired(required = false) DockerSandboxManager sandboxManager,
            @Value("${spring.ai.openai.api-key:" + UNCONFIGURED_KEY + "}") String apiKey) {
        this.sessionStore = sessionStore;
        this.backendProperties = backendProperties;
        this.sandboxManager = sandboxManager;
        this.apiKey = apiKey;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkSessions());
        results.add(checkModel());
        results.add(checkDocker());
        return results;
    }

    private HealthStatus checkSessions() {
        return new HealthStatus("sessions", HealthStatus.Status.UP,
                sessionStore.size() + " active session(s)",
                Map.of("workspace", backendProperties.getRootDir()));
    }

    private HealthStatus checkModel() {
        if (apiKey == null || apiKey.isBlank() || UNCONFIGURED_KEY.equals(apiKey)) {
            return new HealthStatus("model", HealthStatus.Status.DOWN,
                    "NVIDIA_API_KEY is not configured", Map.of());
        }
        return new HealthStatus("model", HealthStatus.Status.UP, "API key configured", Map.of());
    }

    /**
     * Docker is optional: without it sandbox sessions fall back to the local shell, so an
     * unreachable daemon degrades the service rather than taking it down.
     */
    private HealthStatus checkDocker() {
        if (sandboxManager == null) {
            return new HealthStatus("docker", HealthStatus.Status.DEGRADED,
                    "Sandbox disabled", Map.of());
        }
        if (!sandboxManager.ping()) {
            log.warn("Docker daemon is not reachable, sandbox sessions will fall back");
            return new HealthStatus("docker", HealthStatus.Status.DEGRADED,
                    "Docker daemon not reachable", Map.of());
        }
        return new HealthStatus("docker", HealthStatus.Status.UP,
                "Docker daemon reachable",
                Map.of("sandboxes", String.valueOf(sandboxManager.trackedCount())));
    }
}
