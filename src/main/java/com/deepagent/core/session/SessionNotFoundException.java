package com.deepagent.core.session;

public class SessionNotFoundException extends SessionException {

    public SessionNotFoundException(String sessionId) {
        super(sessionId, "Session not found: " + sessionId);
    }
}
