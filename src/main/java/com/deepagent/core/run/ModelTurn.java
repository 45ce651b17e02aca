package com.deepagent.core.run;

import java.util.List;

/**
 * What the model produced in one step: text, tool calls, or both.
 */
public record ModelTurn(String text, List<ToolCall> toolCalls) {

    public ModelTurn {
        text = text == null ? "" : text;
        toolCalls = toolCalls == null ? List.of() : List.copyOf(toolCalls);
    }

    public static ModelTurn text(String text) {
        return new ModelTurn(text, List.of());
    }

    public static ModelTurn calls(ToolCall... calls) {
        return new ModelTurn("", List.of(calls));
    }
}
