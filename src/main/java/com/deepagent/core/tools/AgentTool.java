package com.deepagent.core.tools;

import java.util.Map;

public interface AgentTool {

    ToolSpec spec();

    /**
     * Runs the tool and renders its result for the model.
     * @throws IllegalArgumentException when a required argument is missing or malformed
     */
    String execute(Map<String, Object> arguments);

    default String name() {
        return spec().name();
    }
}
