package com.deepagent.core.hitl;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A gated tool call awaiting a human decision.
 *
 * @param id          tool call id, correlates with the eventual {@code tool_start}/{@code tool_end}
 * @param name        tool name
 * @param arguments   arguments the model proposed
 * @param description human-readable summary shown to the reviewer
 */
public record ActionRequest(
    String id,
    String name,
    @JsonProperty("args") Map<String, Object> arguments,
    String description
) implements Serializable {
    public ActionRequest {
        arguments = arguments == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(arguments));
    }
}
