package com.deepagent.core.session;

public class NoPendingInterruptException extends SessionException {

    public NoPendingInterruptException(String sessionId) {
        super(sessionId, "No pending interrupt for session " + sessionId);
    }
}
