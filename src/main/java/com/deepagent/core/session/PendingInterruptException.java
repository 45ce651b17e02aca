package com.deepagent.core.session;

/**
 * A new message was sent while the session is waiting for a decision.
 */
public class PendingInterruptException extends SessionException {

    public PendingInterruptException(String sessionId) {
        super(sessionId, "Session " + sessionId + " is waiting for a decision on a pending interrupt");
    }
}
