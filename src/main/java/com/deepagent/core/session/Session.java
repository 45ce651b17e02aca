package com.deepagent.core.session;

import com.deepagent.backend.ExecutionBackend;
import com.deepagent.core.hitl.PendingInterrupt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One conversation: its backend, transcript and approval state.
 * <p>
 * The session owns its backend and releases it in {@link #close()}. At most one turn
 * runs at a time; callers take the turn permit with {@link #tryBeginTurn()} and give it
 * back with {@link #endTurn()}.
 */
public class Session {

    private static final Logger log = LoggerFactory.getLogger(Session.class);

    private final String id;
    private final String modelId;
    private final List<String> capabilities;
    private final boolean hitlEnabled;
    private final ExecutionBackend backend;
    private final String threadId;
    private final Instant createdAt;

    private final Semaphore turnPermit = new Semaphore(1);
    private final List<ChatMessage> transcript = new ArrayList<>();
    private PendingInterrupt pendingInterrupt;
    private SessionStatus status = SessionStatus.IDLE;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public Session(String id, String modelId, List<String> capabilities, boolean hitlEnabled,
                   ExecutionBackend backend, String threadId, Instant createdAt) {
        this.id = id;
        this.modelId = modelId;
        this.capabilities = List.copyOf(capabilities);
        this.hitlEnabled = hitlEnabled;
        this.backend = backend;
        this.threadId = threadId;
        this.createdAt = createdAt;
    }

    public String getId() { return id; }
    public String getModelId() { return modelId; }
    public List<String> getCapabilities() { return capabilities; }
    public boolean isHitlEnabled() { return hitlEnabled; }
    public ExecutionBackend getBackend() { return backend; }
    public String getThreadId() { return threadId; }
    public Instant getCreatedAt() { return createdAt; }

    public boolean tryBeginTurn() {
        return turnPermit.tryAcquire();
    }

    public void endTurn() {
        turnPermit.release();
    }

    public synchronized SessionStatus getStatus() {
        return status;
    }

    public synchronized void setStatus(SessionStatus status) {
        this.status = status;
    }

    public synchronized PendingInterrupt getPendingInterrupt() {
        return pendingInterrupt;
    }

    /**
     * Stores the interrupt and moves to {@link SessionStatus#INTERRUPTED}.
     */
    public synchronized void interrupt(PendingInterrupt interrupt) {
        this.pendingInterrupt = interrupt;
        this.status = SessionStatus.INTERRUPTED;
    }

    /**
     * Clears the pending interrupt and moves back to {@link SessionStatus#RUNNING}.
     */
    public synchronized PendingInterrupt resumeFromInterrupt() {
        PendingInterrupt cleared = pendingInterrupt;
        pendingInterrupt = null;
        status = SessionStatus.RUNNING;
        return cleared;
    }

    public synchronized void appendTranscript(ChatMessage message) {
        transcript.add(message);
    }

    public synchronized List<ChatMessage> getTranscript() {
        return List.copyOf(transcript);
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Marks the session closed, which cancels any in-flight turn at its next step, and
     * releases the backend.
     */
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            backend.close();
        } catch (RuntimeException e) {
            log.warn("Failed to release backend {} for session {}: {}", backend.id(), id, e.getMessage());
        }
    }
}
