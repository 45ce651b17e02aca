package com.deepagent.backend;

/**
 * The interchangeable backend variants a session can be bound to.
 */
public enum BackendKind {
    /** File operations only, no command execution. */
    FILESYSTEM,
    /** File operations plus bounded command execution on the host. */
    LOCAL_SHELL,
    /** File operations and execution routed into an isolated container. */
    SANDBOX
}
