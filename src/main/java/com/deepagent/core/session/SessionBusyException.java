package com.deepagent.core.session;

public class SessionBusyException extends SessionException {

    public SessionBusyException(String sessionId) {
        super(sessionId, "Session " + sessionId + " already has a turn in progress");
    }
}
