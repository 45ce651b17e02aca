package com.deepagent.dispatch.api;

import com.deepagent.core.hitl.Decision;
import com.deepagent.core.hitl.DecisionType;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Inbound JSON body for POST /api/sessions/{id}/decisions, one entry per pending action
 * request in the order they were presented.
 */
public record DecisionRequest(List<Entry> decisions) {

    /**
     * @param type       approve, edit or reject
     * @param editedArgs replacement arguments, required for edit
     * @param message    optional note for reject, passed back to the model
     */
    public record Entry(
        DecisionType type,
        @JsonProperty("edited_args") Map<String, Object> editedArgs,
        String message
    ) {}

    /**
     * @throws IllegalArgumentException for a missing type or an edit without arguments
     */
    public List<Decision> toDecisions() {
        if (decisions == null) {
            throw new IllegalArgumentException("decisions are required");
        }
        return decisions.stream().map(DecisionRequest::toDecision).toList();
    }

    private static Decision toDecision(Entry entry) {
        if (entry == null || entry.type() == null) {
            throw new IllegalArgumentException("Each decision needs a type");
        }
        return switch (entry.type()) {
            case APPROVE -> Decision.approve();
            case REJECT -> Decision.reject(entry.message());
            case EDIT -> {
                if (entry.editedArgs() == null) {
                    throw new IllegalArgumentException("An edit decision needs edited_args");
                }
                yield Decision.edit(entry.editedArgs());
            }
        };
    }
}
