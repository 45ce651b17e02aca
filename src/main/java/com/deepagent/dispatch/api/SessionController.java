package com.deepagent.dispatch.api;

import com.deepagent.core.engine.ChatEngine;
import com.deepagent.core.session.DecisionMismatchException;
import com.deepagent.core.session.Session;
import com.deepagent.core.session.SessionException;
import com.deepagent.core.session.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for agent sessions: lifecycle, messages and approval decisions.
 * <p>
 * Message and decision endpoints answer with {@code text/event-stream}. Protocol errors are
 * detected before the stream opens and come back as plain JSON {@code {"error": ...}}.
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final ChatEngine chatEngine;
    private final TurnStreamer turnStreamer;

    public SessionController(ChatEngine chatEngine, TurnStreamer turnStreamer) {
        this.chatEngine = chatEngine;
        this.turnStreamer = turnStreamer;
    }

    /**
     * POST /api/sessions: Create a session and its backend.
     */
    @PostMapping
    public ResponseEntity<SessionResponse> createSession(@RequestBody(required = false) CreateSessionRequest request) {
        var body = request != null ? request : new CreateSessionRequest(List.of(), null, null);
        boolean hitl = body.hitlEnabled() == null || body.hitlEnabled();
        Session session = chatEngine.createSession(body.capabilities(), body.model(), hitl);
        return ResponseEntity.status(HttpStatus.CREATED).body(SessionResponse.summary(session));
    }

    @GetMapping
    public List<SessionResponse> listSessions() {
        return chatEngine.listSessions().stream().map(SessionResponse::summary).toList();
    }

    @GetMapping("/{id}")
    public ResponseEntity<?> getSession(@PathVariable String id) {
        try {
            return ResponseEntity.ok(SessionResponse.detail(chatEngine.getSession(id)));
        } catch (SessionException e) {
            return errorResponse(e);
        }
    }

    /**
     * DELETE /api/sessions/{id}: Tear down the session and its backend.
     */
    @DeleteMapping("/{id}")
    public ResponseEntity<?> deleteSession(@PathVariable String id) {
        try {
            chatEngine.deleteSession(id);
            return ResponseEntity.noContent().build();
        } catch (SessionException e) {
            return errorResponse(e);
        }
    }

    /**
     * POST /api/sessions/{id}/messages: Run one turn, streamed as SSE.
     */
    @PostMapping(value = "/{id}/messages", produces = {MediaType.TEXT_EVENT_STREAM_VALUE, MediaType.APPLICATION_JSON_VALUE})
    public ResponseEntity<?> sendMessage(@PathVariable String id, @RequestBody MessageRequest request) {
        if (request == null || request.message() == null || request.message().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "message is required"));
        }
        try {
            ChatEngine.Turn turn = chatEngine.beginMessage(id, request.message());
            return streamResponse(turn);
        } catch (SessionException e) {
            return errorResponse(e);
        } catch (TurnStreamer.WorkersBusyException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    /**
     * POST /api/sessions/{id}/decisions: Resume an interrupted turn, streamed as SSE.
     */
    @PostMapping(value = "/{id}/decisions", produces = {MediaType.TEXT_EVENT_STREAM_VALUE, MediaType.APPLICATION_JSON_VALUE})
    public ResponseEntity<?> submitDecisions(@PathVariable String id, @RequestBody DecisionRequest request) {
        try {
            ChatEngine.Turn turn = chatEngine.beginDecision(id, request.toDecisions());
            return streamResponse(turn);
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(Map.of("error", e.getMessage()));
        } catch (SessionException e) {
            return errorResponse(e);
        } catch (TurnStreamer.WorkersBusyException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        }
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, String>> unreadableBody(HttpMessageNotReadableException e) {
        Throwable cause = e.getMostSpecificCause();
        return ResponseEntity.badRequest()
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", "Malformed request body: " + cause.getMessage()));
    }

    static ResponseEntity<?> streamResponse(TurnStreamer turnStreamer, ChatEngine.Turn turn, Runnable afterwards) {
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_EVENT_STREAM)
                .header("Cache-Control", "no-cache")
                .header("X-Accel-Buffering", "no")
                .body(turnStreamer.stream(turn, afterwards));
    }

    private ResponseEntity<?> streamResponse(ChatEngine.Turn turn) {
        return streamResponse(turnStreamer, turn, () -> {});
    }

    static ResponseEntity<Map<String, String>> errorResponse(SessionException e) {
        HttpStatus status;
        if (e instanceof SessionNotFoundException) {
            status = HttpStatus.NOT_FOUND;
        } else if (e instanceof DecisionMismatchException) {
            status = HttpStatus.BAD_REQUEST;
        } else {
            status = HttpStatus.CONFLICT;
        }
        log.debug("Rejected request for session {}: {} {}", e.getSessionId(), status.value(), e.getMessage());
        return ResponseEntity.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(Map.of("error", e.getMessage()));
    }
}
