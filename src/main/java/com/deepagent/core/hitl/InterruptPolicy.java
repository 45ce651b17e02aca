package com.deepagent.core.hitl;

import com.deepagent.core.run.ToolCall;
import com.deepagent.core.session.DecisionMismatchException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Decides which tool calls need review and checks reviewers' answers.
 */
@Component
public class InterruptPolicy {

    private final HitlProperties properties;
    private final ObjectMapper objectMapper;

    public InterruptPolicy(HitlProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    public boolean isGated(String toolName) {
        return Set.copyOf(properties.getGatedTools()).contains(toolName);
    }

    /**
     * Builds the interrupt for the gated members of one model step.
     *
     * @return the interrupt, or {@code null} when no call is gated
     */
    public PendingInterrupt intercept(List<ToolCall> toolCalls) {
        var requests = new ArrayList<ActionRequest>();
        var configs = new ArrayList<ReviewConfig>();
        for (ToolCall call : toolCalls) {
            if (!isGated(call.name())) {
                continue;
            }
            requests.add(new ActionRequest(call.id(), call.name(), call.arguments(), describe(call)));
            configs.add(new ReviewConfig(call.name(), properties.getAllowedDecisions()));
        }
        if (requests.isEmpty()) {
            return null;
        }
        return new PendingInterrupt(requests, configs);
    }

    /**
     * Checks that {@code decisions} answer {@code pending} one-for-one, in order, with
     * allowed decision types.
     *
     * @throws DecisionMismatchException on any mismatch; nothing is modified
     */
    public void validate(String sessionId, PendingInterrupt pending, List<Decision> decisions) {
        if (decisions == null || decisions.size() != pending.size()) {
            throw new DecisionMismatchException(sessionId, "Expected " + pending.size()
                    + " decision(s) but received " + (decisions == null ? 0 : decisions.size()));
        }
        for (int i = 0; i < decisions.size(); i++) {
            Decision decision = decisions.get(i);
            if (decision == null) {
                throw new DecisionMismatchException(sessionId, "Decision " + i + " is missing");
            }
            ReviewConfig config = pending.reviewConfigs().get(i);
            if (!config.allows(decision.type())) {
                throw new DecisionMismatchException(sessionId, "Decision '" + decision.type().wireName()
                        + "' is not allowed for " + config.actionName());
            }
        }
    }

    private String describe(ToolCall call) {
        String args;
        try {
            args = objectMapper.writeValueAsString(call.arguments());
        } catch (JsonProcessingException e) {
            args = call.arguments().toString();
        }
        return "Tool execution requires approval\n\nTool: " + call.name() + "\nArgs: " + args;
    }
}
