package com.deepagent.core.tools;

import com.deepagent.backend.ExecutionBackend;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The set of tools a session's agent may call, in the order they are advertised.
 */
public final class Toolbox {

    private final Map<String, AgentTool> tools;

    public Toolbox(List<AgentTool> tools) {
        var byName = new LinkedHashMap<String, AgentTool>();
        for (AgentTool tool : tools) {
            byName.put(tool.name(), tool);
        }
        this.tools = byName;
    }

    /**
     * File tools always; {@code execute} only when the backend can run commands.
     */
    public static Toolbox forBackend(ExecutionBackend backend) {
        var tools = new ArrayList<>(BackendTools.fileTools(backend));
        if (backend.supportsExecution()) {
            tools.add(BackendTools.execute(backend));
        }
        return new Toolbox(tools);
    }

    public Optional<AgentTool> find(String name) {
        return Optional.ofNullable(tools.get(name));
    }

    public List<ToolSpec> specs() {
        return tools.values().stream().map(AgentTool::spec).toList();
    }

    public List<String> names() {
        return List.copyOf(tools.keySet());
    }
}
