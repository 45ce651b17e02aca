package com.deepagent.core.session;

/**
 * The submitted decisions do not line up with the pending action requests, either in
 * count or because a decision type is not allowed for its action.
 */
public class DecisionMismatchException extends SessionException {

    public DecisionMismatchException(String sessionId, String message) {
        super(sessionId, message);
    }
}
