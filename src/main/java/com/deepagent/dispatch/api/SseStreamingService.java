package com.deepagent.dispatch.api;

import com.deepagent.core.engine.EngineProperties;
import com.deepagent.core.events.StreamEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wraps {@link SseEmitter}s for turn streams.
 * <p>
 * Each turn gets its own {@link TurnStream}. A client that disconnects early does not stop
 * the turn: sends to a dead emitter are dropped with a debug log and the turn still runs to
 * a consistent state. Idle streams receive a heartbeat comment so proxies keep them open
 * while a long tool call runs.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    private static final long HEARTBEAT_INTERVAL_SECONDS = 15;

    private final long timeoutMs;

    private final CopyOnWriteArrayList<TurnStream> activeStreams = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    public SseStreamingService(EngineProperties engineProperties) {
        this.timeoutMs = engineProperties.getStreamTimeoutMs();
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Opens a stream for one turn of {@code sessionId}.
     */
    public TurnStream open(String sessionId) {
        var stream = new TurnStream(sessionId, new SseEmitter(timeoutMs));
        activeStreams.add(stream);
        stream.emitter.onCompletion(() -> cleanup(stream));
        stream.emitter.onTimeout(() -> {
            log.debug("SSE stream timed out for session {}", sessionId);
            stream.disconnected.set(true);
            cleanup(stream);
        });
        stream.emitter.onError(ex -> {
            log.debug("SSE stream error for session {}: {}", sessionId, ex.getMessage());
            stream.disconnected.set(true);
            cleanup(stream);
        });
        log.debug("SSE stream opened for session {}", sessionId);
        return stream;
    }

    public int activeStreamCount() {
        return activeStreams.size();
    }

    private void sendHeartbeats() {
        for (TurnStream stream : activeStreams) {
            stream.heartbeat();
        }
    }

    private void cleanup(TurnStream stream) {
        activeStreams.remove(stream);
    }

    /**
     * One turn's event stream. {@link #send} and {@link #complete} are called from the
     * worker thread running the turn; the heartbeat comes from the scheduler.
     */
    public final class TurnStream {

        private final String sessionId;
        private final SseEmitter emitter;
        private final AtomicBoolean disconnected = new AtomicBoolean(false);
        private final AtomicBoolean completed = new AtomicBoolean(false);

        private TurnStream(String sessionId, SseEmitter emitter) {
            this.sessionId = sessionId;
            this.emitter = emitter;
        }

        public SseEmitter emitter() {
            return emitter;
        }

        public boolean isDisconnected() {
            return disconnected.get();
        }

        public void send(StreamEvent event) {
            if (disconnected.get() || completed.get()) {
                return;
            }
            try {
                synchronized (this) {
                    emitter.send(SseEmitter.event()
                            .name(event.type())
                            .data(event, MediaType.APPLICATION_JSON));
                }
            } catch (IOException | IllegalStateException e) {
                disconnected.set(true);
                log.debug("Dropped {} event for session {} (client gone): {}",
                        event.type(), sessionId, e.getMessage());
            }
        }

        public void complete() {
            if (!completed.compareAndSet(false, true)) {
                return;
            }
            activeStreams.remove(this);
            try {
                emitter.complete();
            } catch (IllegalStateException e) {
                log.debug("SSE stream for session {} already closed", sessionId);
            }
        }

        private void heartbeat() {
            if (disconnected.get() || completed.get()) {
                return;
            }
            try {
                synchronized (this) {
                    emitter.send(SseEmitter.event().comment("heartbeat"));
                }
            } catch (IOException | IllegalStateException e) {
                disconnected.set(true);
                log.debug("Heartbeat failed for session {}: {}", sessionId, e.getMessage());
            }
        }
    }
}
