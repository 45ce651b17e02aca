package com.deepagent.sandbox;

/**
 * A labelled sandbox container as reported by the Docker daemon.
 */
public record SandboxContainer(String containerId, String name, String sessionId, String state) {}
