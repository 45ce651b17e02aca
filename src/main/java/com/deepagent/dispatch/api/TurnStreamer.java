package com.deepagent.dispatch.api;

import com.deepagent.core.engine.ChatEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs accepted turns on the agent worker pool and streams their events over SSE.
 */
@Component
public class TurnStreamer {

    private static final Logger log = LoggerFactory.getLogger(TurnStreamer.class);

    private final SseStreamingService sseStreamingService;
    private final Executor executor;

    public TurnStreamer(SseStreamingService sseStreamingService,
                        @Qualifier("agentTaskExecutor") Executor executor) {
        this.sseStreamingService = sseStreamingService;
        this.executor = executor;
    }

    public SseEmitter stream(ChatEngine.Turn turn) {
        return stream(turn, () -> {});
    }

    /**
     * @param afterwards runs on the worker once the turn has finished and the stream is closed
     * @throws WorkersBusyException when the pool cannot take the turn; the turn is abandoned
     */
    public SseEmitter stream(ChatEngine.Turn turn, Runnable afterwards) {
        SseStreamingService.TurnStream stream = sseStreamingService.open(turn.sessionId());
        try {
            CompletableFuture.runAsync(() -> {
                try {
                    turn.run(stream::send);
                } finally {
                    stream.complete();
                    afterwards.run();
                }
            }, executor);
        } catch (RejectedExecutionException e) {
            log.warn("No worker available for session {}: {}", turn.sessionId(), e.getMessage());
            turn.abandon();
            stream.complete();
            afterwards.run();
            throw new WorkersBusyException();
        }
        return stream.emitter();
    }

    public static class WorkersBusyException extends RuntimeException {
        public WorkersBusyException() {
            super("All agent workers are busy, try again later");
        }
    }
}
