package com.deepagent.core.session;

/**
 * Base class for protocol misuse against the session surface: unknown ids, overlapping
 * turns, and decisions that do not fit the pending interrupt.
 */
public abstract class SessionException extends RuntimeException {

    private final String sessionId;

    protected SessionException(String sessionId, String message) {
        super(message);
        this.sessionId = sessionId;
    }

    public String getSessionId() {
        return sessionId;
    }
}
