package com.deepagent.sandbox;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "deepagent.sandbox")
public class SandboxProperties {

    static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    private boolean enabled = true;
    /** Docker daemon endpoint; falls back to {@code DOCKER_HOST}, then the local socket. */
    private String dockerHost = "";
    private String image = "python:3.11-slim";
    private int memoryLimitMb = 512;
    private int cpuCount = 1;
    private String workdir = "/workspace";
    private boolean pullMissingImage = false;

    public boolean isEnabled() { return enabled; }
    public void setEnabled(boolean enabled) { this.enabled = enabled; }
    public String getDockerHost() { return dockerHost; }
    public void setDockerHost(String dockerHost) { this.dockerHost = dockerHost; }
    public String getImage() { return image; }
    public void setImage(String image) { this.image = image; }
    public int getMemoryLimitMb() { return memoryLimitMb; }
    public void setMemoryLimitMb(int memoryLimitMb) { this.memoryLimitMb = memoryLimitMb; }
    public int getCpuCount() { return cpuCount; }
    public void setCpuCount(int cpuCount) { this.cpuCount = cpuCount; }
    public String getWorkdir() { return workdir; }
    public void setWorkdir(String workdir) { this.workdir = workdir; }
    public boolean isPullMissingImage() { return pullMissingImage; }
    public void setPullMissingImage(boolean pullMissingImage) { this.pullMissingImage = pullMissingImage; }

    public String resolveDockerHost() {
        if (dockerHost != null && !dockerHost.isBlank()) {
            return dockerHost;
        }
        return System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
    }
}
