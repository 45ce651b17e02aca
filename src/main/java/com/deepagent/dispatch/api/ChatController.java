package com.deepagent.dispatch.api;

import com.deepagent.core.engine.ChatEngine;
import com.deepagent.core.run.AgentMessage;
import com.deepagent.core.session.Session;
import com.deepagent.core.session.SessionException;
import com.deepagent.core.session.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Stateless one-shot chat: a throwaway session without approval, seeded with the client's
 * history and deleted once the stream ends.
 */
@RestController
@RequestMapping("/api/chat")
public class ChatController {

    private static final Logger log = LoggerFactory.getLogger(ChatController.class);

    private final ChatEngine chatEngine;
    private final TurnStreamer turnStreamer;

    public ChatController(ChatEngine chatEngine, TurnStreamer turnStreamer) {
        this.chatEngine = chatEngine;
        this.turnStreamer = turnStreamer;
    }

    @PostMapping(produces = {MediaType.TEXT_EVENT_STREAM_VALUE, MediaType.APPLICATION_JSON_VALUE})
    public ResponseEntity<?> chat(@RequestBody ChatRequest request) {
        if (request == null || request.message() == null || request.message().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "message is required"));
        }
        Session session = chatEngine.createSession(request.skillIds(), request.modelId(), false);
        String sessionId = session.getId();
        try {
            chatEngine.seedHistory(sessionId, toHistory(request.history()));
            ChatEngine.Turn turn = chatEngine.beginMessage(sessionId, request.message());
            return SessionController.streamResponse(turnStreamer, turn, () -> discard(sessionId));
        } catch (SessionException e) {
            discard(sessionId);
            return SessionController.errorResponse(e);
        } catch (TurnStreamer.WorkersBusyException e) {
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(Map.of("error", e.getMessage()));
        } catch (RuntimeException e) {
            discard(sessionId);
            throw e;
        }
    }

    static List<AgentMessage> toHistory(List<ChatRequest.HistoryEntry> history) {
        var messages = new ArrayList<AgentMessage>();
        if (history == null) {
            return messages;
        }
        for (ChatRequest.HistoryEntry entry : history) {
            if (entry == null) {
                continue;
            }
            String role = entry.role() == null ? "user" : entry.role().toLowerCase(Locale.ROOT);
            String content = entry.content() == null ? "" : entry.content();
            switch (role) {
                case "agent", "assistant" -> messages.add(AgentMessage.assistant(content));
                case "system" -> messages.add(AgentMessage.system(content));
                default -> messages.add(AgentMessage.user(content));
            }
        }
        return messages;
    }

    private void discard(String sessionId) {
        try {
            chatEngine.deleteSession(sessionId);
        } catch (SessionNotFoundException e) {
            log.debug("Chat session {} already gone", sessionId);
        }
    }
}
