package com.deepagent.core.session;

import com.deepagent.core.metrics.AgentMetrics;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide registry of live sessions.
 */
@Component
public class SessionStore {

    private static final Logger log = LoggerFactory.getLogger(SessionStore.class);

    private final ConcurrentHashMap<String, Session> sessions = new ConcurrentHashMap<>();
    private final AgentMetrics metrics;

    public SessionStore(@Autowired(required = false) AgentMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * @throws IllegalStateException when a session with the same id already exists
     */
    public Session add(Session session) {
        Session previous = sessions.putIfAbsent(session.getId(), session);
        if (previous != null) {
            throw new IllegalStateException("Duplicate session id " + session.getId());
        }
        updateGauge();
        return session;
    }

    public Optional<Session> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Session require(String sessionId) {
        Session session = sessions.get(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        return session;
    }

    /**
     * Removes the session and releases its backend before returning.
     */
    public Session remove(String sessionId) {
        Session session = sessions.remove(sessionId);
        if (session == null) {
            throw new SessionNotFoundException(sessionId);
        }
        updateGauge();
        session.close();
        return session;
    }

    public List<Session> list() {
        return sessions.values().stream()
                .sorted(Comparator.comparing(Session::getCreatedAt))
                .toList();
    }

    public int size() {
        return sessions.size();
    }

    @PreDestroy
    void closeAll() {
        if (sessions.isEmpty()) {
            return;
        }
        log.info("Closing {} remaining session(s)", sessions.size());
        for (String id : List.copyOf(sessions.keySet())) {
            Session session = sessions.remove(id);
            if (session != null) {
                session.close();
            }
        }
        updateGauge();
    }

    private void updateGauge() {
        if (metrics != null) {
            metrics.setActiveSessions(sessions.size());
        }
    }
}
