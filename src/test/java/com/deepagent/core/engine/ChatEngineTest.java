package com.deepagent.core.engine;

import com.deepagent.backend.BackendFactory;
import com.deepagent.backend.BackendKind;
import com.deepagent.backend.BackendProperties;
import com.deepagent.core.events.StreamEvent;
import com.deepagent.core.graph.AgentGraph;
import com.deepagent.core.hitl.Decision;
import com.deepagent.core.hitl.HitlProperties;
import com.deepagent.core.hitl.InterruptPolicy;
import com.deepagent.core.hitl.PendingInterrupt;
import com.deepagent.core.llm.LlmProperties;
import com.deepagent.core.metrics.AgentMetrics;
import com.deepagent.core.run.AgentMessage;
import com.deepagent.core.run.AgentRunner;
import com.deepagent.core.run.ScriptedModel;
import com.deepagent.core.run.ToolCall;
import com.deepagent.core.session.ChatMessage;
import com.deepagent.core.session.DecisionMismatchException;
import com.deepagent.core.session.NoPendingInterruptException;
import com.deepagent.core.session.PendingInterruptException;
import com.deepagent.core.session.Session;
import com.deepagent.core.session.SessionBusyException;
import com.deepagent.core.session.SessionNotFoundException;
import com.deepagent.core.session.SessionStatus;
import com.deepagent.core.session.SessionStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.bsc.langgraph4j.checkpoint.MemorySaver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class ChatEngineTest {

    @TempDir
    Path workspace;

    private ScriptedModel model;
    private SessionStore store;
    private AgentRunner runner;
    private SimpleMeterRegistry registry;
    private ChatEngine engine;
    private List<StreamEvent> events;

    @BeforeEach
    void setUp() {
        model = new ScriptedModel();
        registry = new SimpleMeterRegistry();
        var metrics = new AgentMetrics(registry);
        store = new SessionStore(metrics);

        var backendProperties = new BackendProperties();
        backendProperties.setRootDir(workspace.toString());
        var policy = new InterruptPolicy(new HitlProperties(), new ObjectMapper());
        var saver = new MemorySaver();
        var graph = new AgentGraph(model, policy, new EngineProperties(), saver, metrics);
        runner = new AgentRunner(graph, saver, metrics);
        engine = new ChatEngine(store, new BackendFactory(backendProperties, null, metrics), runner, policy,
                new LlmProperties(), new ObjectMapper(),
                Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC), metrics);
        events = new ArrayList<>();
    }

    private List<String> eventTypes() {
        return events.stream().map(StreamEvent::type).toList();
    }

    private double turns(String outcome) {
        var counter = registry.find("deepagent.turns.total").tag("outcome", outcome).counter();
        return counter == null ? 0 : counter.count();
    }

    @Nested
    @DisplayName("session lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("creation picks the backend from capabilities and registers the session")
        void create() {
            Session session = engine.createSession(List.of("fileio"), "nemotron", true);

            assertEquals("nemotron", session.getModelId());
            assertEquals(BackendKind.FILESYSTEM, session.getBackend().kind());
            assertEquals("thread-" + session.getId(), session.getThreadId());
            assertEquals(SessionStatus.IDLE, session.getStatus());
            assertEquals(Instant.parse("2026-01-01T00:00:00Z"), session.getCreatedAt());
            assertSame(session, engine.getSession(session.getId()));
            assertEquals(1.0, registry.get("deepagent.sessions.active").gauge().value());
        }

        @Test
        @DisplayName("unknown and missing models fall back to the default")
        void modelFallback() {
            assertEquals("llama", engine.createSession(List.of(), "gpt-9", true).getModelId());
            assertEquals("llama", engine.createSession(null, null, true).getModelId());
        }

        @Test
        @DisplayName("codeinterpreter gets a shell backend")
        void shellBackend() {
            Session session = engine.createSession(List.of("codeinterpreter"), null, true);
            assertEquals(BackendKind.LOCAL_SHELL, session.getBackend().kind());
        }

        @Test
        @DisplayName("deleting removes the session and its run state")
        void delete() {
            Session session = engine.createSession(List.of(), null, true);
            model.thenText("hi");
            engine.sendMessage(session.getId(), "hello", events::add);

            engine.deleteSession(session.getId());

            assertTrue(session.isClosed());
            assertTrue(runner.currentState(session.getThreadId()).isEmpty());
            assertThrows(SessionNotFoundException.class, () -> engine.getSession(session.getId()));
            assertThrows(SessionNotFoundException.class, () -> engine.deleteSession(session.getId()));
        }

        @Test
        @DisplayName("sessions list in creation order")
        void list() {
            Session a = engine.createSession(List.of(), null, true);
            Session b = engine.createSession(List.of(), null, true);
            assertEquals(2, engine.listSessions().size());
            assertTrue(engine.listSessions().containsAll(List.of(a, b)));
        }
    }

    @Nested
    @DisplayName("messages")
    class Messages {

        @Test
        @DisplayName("a completed turn ends with done and records both sides of the transcript")
        void completedTurn() {
            Session session = engine.createSession(List.of(), null, true);
            model.thenText("Hello there");

            engine.sendMessage(session.getId(), "hi", events::add);

            assertEquals(List.of("token", "token", "done"), eventTypes());
            assertEquals(SessionStatus.IDLE, session.getStatus());
            List<ChatMessage> transcript = session.getTranscript();
            assertEquals(2, transcript.size());
            assertEquals(ChatMessage.Role.USER, transcript.get(0).role());
            assertEquals("Hello there", transcript.get(1).content());
            assertEquals(1.0, turns("completed"));
        }

        @Test
        @DisplayName("tool calls stream start and end events around their execution")
        void toolEvents() throws Exception {
            Session session = engine.createSession(List.of("fileio"), null, true);
            Files.createDirectories(workspace.resolve(session.getId()));
            Files.writeString(workspace.resolve(session.getId()).resolve("notes.txt"), "n");
            model.thenCalls(new ToolCall("c1", "ls", Map.of("path", "/"))).thenText("One file.");

            engine.sendMessage(session.getId(), "what is here?", events::add);

            assertEquals(List.of("tool_start", "tool_end", "token", "token", "done"), eventTypes());
            var end = (StreamEvent.ToolEnd) events.get(1);
            assertEquals("/notes.txt", end.output());
        }

        @Test
        @DisplayName("blank messages are refused without taking the session")
        void blankMessage() {
            Session session = engine.createSession(List.of(), null, true);
            assertThrows(IllegalArgumentException.class, () -> engine.beginMessage(session.getId(), " "));
            assertTrue(session.tryBeginTurn());
        }

        @Test
        @DisplayName("a second turn is refused while one is in progress")
        void busy() {
            Session session = engine.createSession(List.of(), null, true);
            ChatEngine.Turn first = engine.beginMessage(session.getId(), "one");

            assertThrows(SessionBusyException.class, () -> engine.beginMessage(session.getId(), "two"));

            model.thenText("done");
            first.run(events::add);
            assertEquals(SessionStatus.IDLE, session.getStatus());
        }

        @Test
        @DisplayName("a model failure ends the turn with one error event and frees the session")
        void failure() {
            Session session = engine.createSession(List.of(), null, true);
            model.thenFail(new IllegalStateException("upstream 500"));

            engine.sendMessage(session.getId(), "hi", events::add);

            assertEquals(List.of("error"), eventTypes());
            assertEquals("upstream 500", ((StreamEvent.Error) events.get(0)).message());
            assertEquals(SessionStatus.IDLE, session.getStatus());
            assertEquals(1.0, turns("failed"));

            model.thenText("better");
            events.clear();
            engine.sendMessage(session.getId(), "again", events::add);
            assertEquals("done", events.get(events.size() - 1).type());
        }

        @Test
        @DisplayName("seeded history reaches the model ahead of the new message")
        void seeded() {
            Session session = engine.createSession(List.of(), null, false);
            engine.seedHistory(session.getId(), List.of(AgentMessage.user("earlier"), AgentMessage.assistant("reply", List.of())));
            model.thenText("ok");

            engine.sendMessage(session.getId(), "now", events::add);

            List<AgentMessage> sent = model.lastRequest().messages();
            assertEquals(List.of("earlier", "reply", "now"),
                    sent.subList(1, sent.size()).stream().map(AgentMessage::content).toList());
        }

        @Test
        @DisplayName("an abandoned turn leaves the session as it was")
        void abandon() {
            Session session = engine.createSession(List.of(), null, true);
            engine.beginMessage(session.getId(), "hi").abandon();

            assertEquals(SessionStatus.IDLE, session.getStatus());
            assertTrue(session.tryBeginTurn());
            assertEquals(1.0, turns("rejected"));
        }
    }

    @Nested
    @DisplayName("approvals")
    class Approvals {

        private Session session;

        @BeforeEach
        void interrupted() {
            session = engine.createSession(List.of("fileio"), null, true);
            model.thenCalls(new ToolCall("w1", "write_file", Map.of("file_path", "/out.txt", "content", "draft")));
            engine.sendMessage(session.getId(), "write it", events::add);
        }

        @Test
        @DisplayName("a gated call interrupts the turn and stores the pending request")
        void interrupt() {
            assertEquals(List.of("interrupt"), eventTypes());
            assertEquals(SessionStatus.INTERRUPTED, session.getStatus());
            assertEquals("w1", session.getPendingInterrupt().actionRequests().get(0).id());
            assertEquals(1, session.getTranscript().size());
            assertFalse(Files.exists(workspace.resolve(session.getId()).resolve("out.txt")));
        }

        @Test
        @DisplayName("new messages are refused until the interrupt is answered")
        void messageWhileInterrupted() {
            assertThrows(PendingInterruptException.class, () -> engine.beginMessage(session.getId(), "hello?"));
        }

        @Test
        @DisplayName("approval runs the call and finishes the turn")
        void approve() throws Exception {
            events.clear();
            model.thenText("Written.");

            engine.submitDecision(session.getId(), List.of(Decision.approve()), events::add);

            assertEquals(List.of("tool_start", "tool_end", "token", "done"), eventTypes());
            assertEquals("draft", Files.readString(workspace.resolve(session.getId()).resolve("out.txt")));
            assertNull(session.getPendingInterrupt());
            assertEquals(SessionStatus.IDLE, session.getStatus());
            assertEquals(1.0, registry.get("deepagent.decisions.total").tag("type", "approve").counter().count());
        }

        @Test
        @DisplayName("edited arguments are what runs")
        void edit() throws Exception {
            model.thenText("Written.");

            engine.submitDecision(session.getId(),
                    List.of(Decision.edit(Map.of("file_path", "/out.txt", "content", "final"))), events::add);

            assertEquals("final", Files.readString(workspace.resolve(session.getId()).resolve("out.txt")));
        }

        @Test
        @DisplayName("a mismatched decision list leaves the interrupt in place")
        void mismatch() {
            assertThrows(DecisionMismatchException.class, () -> engine.beginDecision(session.getId(),
                    List.of(Decision.approve(), Decision.approve())));

            assertEquals(SessionStatus.INTERRUPTED, session.getStatus());
            assertNotNull(session.getPendingInterrupt());
            assertTrue(session.tryBeginTurn());
        }

        @Test
        @DisplayName("an abandoned decision restores the interrupt")
        void abandonDecision() {
            engine.beginDecision(session.getId(), List.of(Decision.approve())).abandon();

            assertEquals(SessionStatus.INTERRUPTED, session.getStatus());
            assertEquals("w1", session.getPendingInterrupt().actionRequests().get(0).id());
        }

        @Test
        @DisplayName("decisions without an interrupt are refused")
        void noInterrupt() {
            model.thenText("ok");
            engine.submitDecision(session.getId(), List.of(Decision.reject("no")), events::add);

            assertThrows(NoPendingInterruptException.class,
                    () -> engine.beginDecision(session.getId(), List.of(Decision.approve())));
            assertTrue(session.tryBeginTurn());
        }
    }

    @Nested
    @DisplayName("concurrent sessions")
    class Concurrency {

        @Test
        @DisplayName("sessions created in parallel stay isolated from each other")
        void parallelSessionsStayIsolated() throws Exception {
            int count = 16;
            ExecutorService pool = Executors.newFixedThreadPool(8);
            List<Session> sessions = new ArrayList<>();
            try {
                var go = new CountDownLatch(1);
                var futures = new ArrayList<Future<Session>>();
                for (int i = 0; i < count; i++) {
                    Callable<Session> create = () -> {
                        go.await();
                        return engine.createSession(List.of("fileio"), null, true);
                    };
                    futures.add(pool.submit(create));
                }
                go.countDown();
                for (Future<Session> future : futures) {
                    sessions.add(future.get(10, TimeUnit.SECONDS));
                }
            } finally {
                pool.shutdownNow();
            }

            assertEquals(count, sessions.stream().map(Session::getId).distinct().count());
            assertEquals(count, sessions.stream().map(Session::getThreadId).distinct().count());
            assertEquals(count, sessions.stream().map(s -> s.getBackend().id()).distinct().count());
            assertEquals(count, engine.listSessions().size());
            assertEquals(count, registry.get("deepagent.sessions.active").gauge().value());

            Session a = sessions.get(0);
            Session b = sessions.get(1);
            model.thenText("hello a");
            engine.sendMessage(a.getId(), "hi", events::add);
            model.thenCalls(new ToolCall("w1", "write_file", Map.of("file_path", "/b.txt", "content", "bee")));
            engine.sendMessage(b.getId(), "write it", events::add);
            PendingInterrupt pending = b.getPendingInterrupt();
            List<ChatMessage> transcript = b.getTranscript();
            assertNotNull(pending);

            engine.deleteSession(a.getId());

            assertTrue(a.isClosed());
            assertFalse(b.isClosed());
            assertSame(b, engine.getSession(b.getId()));
            assertEquals(SessionStatus.INTERRUPTED, b.getStatus());
            assertEquals(pending, b.getPendingInterrupt());
            assertEquals(transcript, b.getTranscript());
            assertTrue(runner.currentState(a.getThreadId()).isEmpty());
            assertTrue(runner.currentState(b.getThreadId()).orElseThrow().awaitingReview());
            assertEquals(count - 1, engine.listSessions().size());

            model.thenText("written");
            events.clear();
            engine.submitDecision(b.getId(), List.of(Decision.approve()), events::add);

            assertEquals("done", events.get(events.size() - 1).type());
            assertEquals("bee", Files.readString(workspace.resolve(b.getId()).resolve("b.txt")));
        }
    }
}
