package com.deepagent.dispatch.api;

import com.deepagent.core.hitl.PendingInterrupt;
import com.deepagent.core.session.ChatMessage;
import com.deepagent.core.session.Session;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Locale;

/**
 * JSON view of a session. The list endpoint leaves out the transcript.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionResponse(
    @JsonProperty("session_id") String sessionId,
    String model,
    List<String> capabilities,
    String backend,
    @JsonProperty("backend_id") String backendId,
    @JsonProperty("hitl_enabled") boolean hitlEnabled,
    String status,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("pending_interrupt") PendingInterrupt pendingInterrupt,
    List<TranscriptEntry> transcript
) {

    public record TranscriptEntry(String role, String content, String timestamp) {

        static TranscriptEntry of(ChatMessage message) {
            return new TranscriptEntry(message.role().name().toLowerCase(Locale.ROOT),
                    message.content(), message.timestamp().toString());
        }
    }

    public static SessionResponse summary(Session session) {
        return from(session, null);
    }

    public static SessionResponse detail(Session session) {
        return from(session, session.getTranscript().stream().map(TranscriptEntry::of).toList());
    }

    private static SessionResponse from(Session session, List<TranscriptEntry> transcript) {
        return new SessionResponse(
                session.getId(),
                session.getModelId(),
                session.getCapabilities(),
                session.getBackend().kind().name().toLowerCase(Locale.ROOT),
                session.getBackend().id(),
                session.isHitlEnabled(),
                session.getStatus().name().toLowerCase(Locale.ROOT),
                session.getCreatedAt().toString(),
                session.getPendingInterrupt(),
                transcript);
    }
}
