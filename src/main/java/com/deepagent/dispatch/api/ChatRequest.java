package com.deepagent.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for the stateless POST /api/chat.
 *
 * @param message  the new user message
 * @param skillIds capabilities for the throwaway session; nullable
 * @param modelId  model catalogue id; nullable
 * @param history  earlier turns, oldest first; role {@code agent} is read as {@code assistant}
 */
public record ChatRequest(
    String message,
    @JsonProperty("skill_ids") List<String> skillIds,
    @JsonProperty("model_id") String modelId,
    List<HistoryEntry> history
) {

    public record HistoryEntry(String role, String content) {}
}
