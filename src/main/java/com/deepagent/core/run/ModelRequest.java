package com.deepagent.core.run;

import com.deepagent.core.tools.ToolSpec;

import java.util.List;

/**
 * @param modelId  catalogue key of the model to use
 * @param messages full thread, system prompt first
 * @param tools    tools the model may call this turn
 */
public record ModelRequest(String modelId, List<AgentMessage> messages, List<ToolSpec> tools) {

    public ModelRequest {
        messages = List.copyOf(messages);
        tools = List.copyOf(tools);
    }
}
