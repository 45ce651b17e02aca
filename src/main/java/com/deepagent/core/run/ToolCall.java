package com.deepagent.core.run;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A tool invocation proposed by the model.
 */
public record ToolCall(String id, String name, Map<String, Object> arguments) implements Serializable {

    public ToolCall {
        Objects.requireNonNull(id, "id cannot be null");
        Objects.requireNonNull(name, "name cannot be null");
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }

    public ToolCall withArguments(Map<String, Object> replacement) {
        return new ToolCall(id, name, replacement);
    }
}
