package com.deepagent.core.hitl;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

public record ReviewConfig(
    @JsonProperty("action_name") String actionName,
    @JsonProperty("allowed_decisions") List<DecisionType> allowedDecisions
) implements Serializable {
    public ReviewConfig {
        allowedDecisions = List.copyOf(allowedDecisions);
    }

    public boolean allows(DecisionType type) {
        return allowedDecisions.contains(type);
    }
}
