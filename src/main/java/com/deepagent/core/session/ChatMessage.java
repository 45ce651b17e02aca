package com.deepagent.core.session;

import java.time.Instant;

/**
 * A transcript entry: what the user said, or the assistant's final answer for a turn.
 */
public record ChatMessage(Role role, String content, Instant timestamp) {

    public enum Role { USER, ASSISTANT }

    public static ChatMessage user(String content, Instant at) {
        return new ChatMessage(Role.USER, content, at);
    }

    public static ChatMessage assistant(String content, Instant at) {
        return new ChatMessage(Role.ASSISTANT, content, at);
    }
}
