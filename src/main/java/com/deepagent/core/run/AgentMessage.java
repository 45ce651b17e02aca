package com.deepagent.core.run;

import java.io.Serializable;
import java.util.List;

/**
 * One entry of a run's message thread, as handed to the model.
 */
public record AgentMessage(
    Role role,
    String content,
    List<ToolCall> toolCalls,
    String toolCallId,
    String toolName
) implements Serializable {

    public enum Role { SYSTEM, USER, ASSISTANT, TOOL }

    public AgentMessage {
        content = content == null ? "" : content;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static AgentMessage system(String content) {
        return new AgentMessage(Role.SYSTEM, content, List.of(), null, null);
    }

    public static AgentMessage user(String content) {
        return new AgentMessage(Role.USER, content, List.of(), null, null);
    }

    public static AgentMessage assistant(String content) {
        return new AgentMessage(Role.ASSISTANT, content, List.of(), null, null);
    }

    public static AgentMessage assistant(String content, List<ToolCall> toolCalls) {
        return new AgentMessage(Role.ASSISTANT, content, toolCalls, null, null);
    }

    public static AgentMessage tool(String toolCallId, String toolName, String content) {
        return new AgentMessage(Role.TOOL, content, List.of(), toolCallId, toolName);
    }

    public boolean hasToolCalls() {
        return !toolCalls.isEmpty();
    }
}
