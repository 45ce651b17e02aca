package com.deepagent.core.session;

public enum SessionStatus {
    IDLE,
    RUNNING,
    INTERRUPTED
}
