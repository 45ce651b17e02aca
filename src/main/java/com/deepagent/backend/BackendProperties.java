package com.deepagent.backend;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

@Component
@ConfigurationProperties(prefix = "deepagent.backend")
public class BackendProperties {

    /** Parent directory for per-session host workspaces. */
    private String rootDir = System.getProperty("user.dir") + "/workspace";
    private boolean shellEnabled = true;
    private int executeTimeoutSeconds = 60;
    private int maxOutputBytes = 50_000;

    public String getRootDir() { return rootDir; }
    public void setRootDir(String rootDir) { this.rootDir = rootDir; }
    public boolean isShellEnabled() { return shellEnabled; }
    public void setShellEnabled(boolean shellEnabled) { this.shellEnabled = shellEnabled; }
    public int getExecuteTimeoutSeconds() { return executeTimeoutSeconds; }
    public void setExecuteTimeoutSeconds(int executeTimeoutSeconds) { this.executeTimeoutSeconds = executeTimeoutSeconds; }
    public int getMaxOutputBytes() { return maxOutputBytes; }
    public void setMaxOutputBytes(int maxOutputBytes) { this.maxOutputBytes = maxOutputBytes; }

    public Path sessionRoot(String sessionId) {
        return Path.of(rootDir).toAbsolutePath().normalize().resolve(sessionId);
    }
}
