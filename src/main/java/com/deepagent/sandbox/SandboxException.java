package com.deepagent.sandbox;

/**
 * Raised when a sandbox container cannot be created or started.
 */
public class SandboxException extends RuntimeException {

    public SandboxException(String message, Throwable cause) {
        super(message, cause);
    }

    public SandboxException(String message) {
        super(message);
    }
}
