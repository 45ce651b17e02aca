package com.deepagent.core.engine;

import com.deepagent.backend.BackendFactory;
import com.deepagent.backend.ExecutionBackend;
import com.deepagent.core.events.EventTranslator;
import com.deepagent.core.events.StreamEvent;
import com.deepagent.core.hitl.Decision;
import com.deepagent.core.hitl.InterruptPolicy;
import com.deepagent.core.hitl.PendingInterrupt;
import com.deepagent.core.llm.LlmProperties;
import com.deepagent.core.llm.ModelCatalog;
import com.deepagent.core.llm.SystemPrompts;
import com.deepagent.core.logging.MdcContext;
import com.deepagent.core.metrics.AgentMetrics;
import com.deepagent.core.run.AgentMessage;
import com.deepagent.core.run.AgentRunner;
import com.deepagent.core.run.RunCancelledException;
import com.deepagent.core.run.RunContext;
import com.deepagent.core.run.RunEvent;
import com.deepagent.core.run.RunOutcome;
import com.deepagent.core.session.ChatMessage;
import com.deepagent.core.session.NoPendingInterruptException;
import com.deepagent.core.session.PendingInterruptException;
import com.deepagent.core.session.Session;
import com.deepagent.core.session.SessionBusyException;
import com.deepagent.core.session.SessionStatus;
import com.deepagent.core.session.SessionStore;
import com.deepagent.core.tools.Toolbox;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Session lifecycle and the per-session turn protocol.
 * <p>
 * {@code begin*} methods validate the request and take the session's turn permit on the
 * caller's thread, so protocol errors surface before any streaming starts. The returned
 * {@link Turn} is then run, usually on a worker thread, and always gives the permit back.
 */
@Service
public class ChatEngine {

    private static final Logger log = LoggerFactory.getLogger(ChatEngine.class);

    private final SessionStore sessionStore;
    private final BackendFactory backendFactory;
    private final AgentRunner agentRunner;
    private final InterruptPolicy interruptPolicy;
    private final LlmProperties llmProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AgentMetrics metrics;

    public ChatEngine(SessionStore sessionStore,
                      BackendFactory backendFactory,
                      AgentRunner agentRunner,
                      InterruptPolicy interruptPolicy,
                      LlmProperties llmProperties,
                      ObjectMapper objectMapper,
                      Clock clock,
                      @Autowired(required = false) AgentMetrics metrics) {
        this.sessionStore = sessionStore;
        this.backendFactory = backendFactory;
        this.agentRunner = agentRunner;
        this.interruptPolicy = interruptPolicy;
        this.llmProperties = llmProperties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.metrics = metrics;
    }

    public Session createSession(List<String> capabilities, String modelId, boolean hitlEnabled) {
        List<String> caps = capabilities == null ? List.of() : List.copyOf(capabilities);
        String model = resolveModel(modelId);
        String sessionId = UUID.randomUUID().toString();
        ExecutionBackend backend = backendFactory.create(caps, sessionId);
        var session = new Session(sessionId, model, caps, hitlEnabled, backend,
                "thread-" + sessionId, clock.instant());
        sessionStore.add(session);
        if (metrics != null) {
            metrics.recordSessionCreated(backend.kind().name().toLowerCase());
        }
        log.info("Session {} created (model={}, backend={}, hitl={})",
                sessionId, model, backend.id(), hitlEnabled);
        return session;
    }

    /**
     * Removes the session, tears its backend down and drops its run state. A turn still
     * in flight stops at its next step.
     */
    public void deleteSession(String sessionId) {
        Session session = sessionStore.remove(sessionId);
        agentRunner.discard(session.getThreadId());
        log.info("Session {} deleted", sessionId);
    }

    public Session getSession(String sessionId) {
        return sessionStore.require(sessionId);
    }

    public List<Session> listSessions() {
        return sessionStore.list();
    }

    /**
     * Seeds an earlier conversation into a fresh session's thread.
     */
    public void seedHistory(String sessionId, List<AgentMessage> history) {
        Session session = sessionStore.require(sessionId);
        agentRunner.seed(contextFor(session), history);
    }

    /**
     * @throws com.deepagent.core.session.SessionNotFoundException unknown id
     * @throws SessionBusyException      a turn is already running
     * @throws PendingInterruptException the session is waiting for a decision
     */
    public Turn beginMessage(String sessionId, String message) {
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message must not be empty");
        }
        Session session = sessionStore.require(sessionId);
        if (session.getPendingInterrupt() != null) {
            throw new PendingInterruptException(sessionId);
        }
        if (!session.tryBeginTurn()) {
            throw new SessionBusyException(sessionId);
        }
        if (session.getPendingInterrupt() != null) {
            session.endTurn();
            throw new PendingInterruptException(sessionId);
        }
        session.setStatus(SessionStatus.RUNNING);
        session.appendTranscript(ChatMessage.user(message, clock.instant()));
        log.debug("Session {} accepted a message ({} chars)", sessionId, message.length());
        return new Turn(session, sink -> agentRunner.start(contextFor(session), message, sink),
                () -> session.setStatus(SessionStatus.IDLE));
    }

    /**
     * @throws com.deepagent.core.session.SessionNotFoundException   unknown id
     * @throws SessionBusyException                                    a turn is already running
     * @throws NoPendingInterruptException                             nothing to decide on
     * @throws com.deepagent.core.session.DecisionMismatchException   wrong count or disallowed type
     */
    public Turn beginDecision(String sessionId, List<Decision> decisions) {
        Session session = sessionStore.require(sessionId);
        if (!session.tryBeginTurn()) {
            throw new SessionBusyException(sessionId);
        }
        try {
            PendingInterrupt pending = session.getPendingInterrupt();
            if (pending == null) {
                throw new NoPendingInterruptException(sessionId);
            }
            interruptPolicy.validate(sessionId, pending, decisions);
        } catch (RuntimeException e) {
            session.endTurn();
            throw e;
        }
        PendingInterrupt cleared = session.resumeFromInterrupt();
        if (metrics != null) {
            decisions.forEach(d -> metrics.recordDecision(d.type().wireName()));
        }
        log.info("Session {} resuming with decisions {}", sessionId,
                decisions.stream().map(d -> d.type().wireName()).toList());
        List<Decision> accepted = List.copyOf(decisions);
        return new Turn(session, sink -> agentRunner.resume(contextFor(session), accepted, sink),
                () -> session.interrupt(cleared));
    }

    /**
     * Begins and runs a message turn on the calling thread.
     */
    public void sendMessage(String sessionId, String message, Consumer<StreamEvent> sink) {
        beginMessage(sessionId, message).run(sink);
    }

    /**
     * Begins and runs a decision turn on the calling thread.
     */
    public void submitDecision(String sessionId, List<Decision> decisions, Consumer<StreamEvent> sink) {
        beginDecision(sessionId, decisions).run(sink);
    }

    private RunContext contextFor(Session session) {
        return new RunContext(
                session.getThreadId(),
                session.getModelId(),
                SystemPrompts.build(session.getCapabilities(), session.getModelId()),
                session.isHitlEnabled(),
                Toolbox.forBackend(session.getBackend()),
                session::isClosed);
    }

    private String resolveModel(String modelId) {
        String requested = modelId == null || modelId.isBlank() ? llmProperties.getDefaultModel() : modelId;
        if (ModelCatalog.findModel(requested) == null) {
            log.warn("Unknown model '{}', using {}", requested, llmProperties.getDefaultModel());
            return ModelCatalog.resolve(llmProperties.getDefaultModel()).id();
        }
        return requested;
    }

    /**
     * An accepted turn holding the session's permit until {@link #run} returns.
     */
    public final class Turn {

        private final Session session;
        private final Function<Consumer<RunEvent>, RunOutcome> body;
        private final Runnable rollback;

        private Turn(Session session, Function<Consumer<RunEvent>, RunOutcome> body, Runnable rollback) {
            this.session = session;
            this.body = body;
            this.rollback = rollback;
        }

        public String sessionId() {
            return session.getId();
        }

        /**
         * Runs the turn, forwarding translated events to {@code sink}. Never throws: a
         * failure becomes the terminal {@code error} event. The terminal event is delivered
         * only after the session state reflects it and the permit has been released, so a
         * client reacting to it immediately sees a consistent session.
         */
        public void run(Consumer<StreamEvent> sink) {
            var translator = new EventTranslator(objectMapper, clock);
            StreamEvent[] terminal = new StreamEvent[1];
            Consumer<RunEvent> runSink = event -> translator.translate(event).ifPresent(out -> {
                if (out.terminal()) {
                    terminal[0] = out;
                } else {
                    sink.accept(out);
                }
            });

            MdcContext.setRun(session.getId(), session.getThreadId());
            try {
                RunOutcome outcome = body.apply(runSink);
                if (outcome.isInterrupted()) {
                    session.interrupt(outcome.interrupt());
                    recordTurn("interrupted");
                } else {
                    session.appendTranscript(ChatMessage.assistant(outcome.finalText(), clock.instant()));
                    session.setStatus(SessionStatus.IDLE);
                    recordTurn("completed");
                }
            } catch (RunCancelledException e) {
                log.info("Turn for session {} stopped: session was deleted", session.getId());
                session.setStatus(SessionStatus.IDLE);
                terminal[0] = translator.failure(e).orElse(terminal[0]);
                recordTurn("cancelled");
            } catch (RuntimeException e) {
                log.error("Turn failed for session {}", session.getId(), e);
                session.setStatus(SessionStatus.IDLE);
                terminal[0] = translator.failure(e).orElse(terminal[0]);
                recordTurn("failed");
            } finally {
                if (session.isClosed()) {
                    agentRunner.discard(session.getThreadId());
                }
                session.endTurn();
                MdcContext.clear();
            }
            Optional.ofNullable(terminal[0]).ifPresent(sink);
        }

        /**
         * Gives the turn up without running it, restoring the state the session had before
         * it was accepted. Used when no worker is available to run it.
         */
        public void abandon() {
            rollback.run();
            session.endTurn();
            log.warn("Turn for session {} abandoned before it started", session.getId());
            recordTurn("rejected");
        }

        private void recordTurn(String outcome) {
            if (metrics != null) {
                metrics.recordTurn(outcome);
            }
        }
    }
}
