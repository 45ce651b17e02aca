package com.deepagent.core.hitl;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * The gated calls of one model turn, in the order the model proposed them.
 */
public record PendingInterrupt(
    @JsonProperty("action_requests") List<ActionRequest> actionRequests,
    @JsonProperty("review_configs") List<ReviewConfig> reviewConfigs
) implements Serializable {
    public PendingInterrupt {
        actionRequests = List.copyOf(actionRequests);
        reviewConfigs = List.copyOf(reviewConfigs);
    }

    public int size() {
        return actionRequests.size();
    }
}
