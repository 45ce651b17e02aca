package com.deepagent.core.events;

import com.deepagent.core.hitl.ActionRequest;
import com.deepagent.core.hitl.ReviewConfig;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * The client-facing event vocabulary. On the wire the SSE event name is {@link #type()}
 * and the data is the JSON form of the record.
 * <p>
 * Every turn's sequence ends with exactly one {@link Interrupt}, {@link Error} or {@link Done}.
 */
public sealed interface StreamEvent
        permits StreamEvent.Token, StreamEvent.ToolStart, StreamEvent.ToolEnd,
                StreamEvent.Interrupt, StreamEvent.Error, StreamEvent.Done {

    String type();

    default boolean terminal() {
        return false;
    }

    record Token(String content) implements StreamEvent {
        @Override
        public String type() {
            return "token";
        }
    }

    record ToolStart(
        String id,
        String name,
        @JsonProperty("skillId") String skillId,
        String icon,
        String action,
        String input
    ) implements StreamEvent {
        @Override
        public String type() {
            return "tool_start";
        }
    }

    /**
     * @param duration milliseconds since the matching {@link ToolStart}
     */
    record ToolEnd(String id, String name, String output, long duration) implements StreamEvent {
        @Override
        public String type() {
            return "tool_end";
        }
    }

    record Interrupt(
        @JsonProperty("action_requests") List<ActionRequest> actionRequests,
        @JsonProperty("review_configs") List<ReviewConfig> reviewConfigs
    ) implements StreamEvent {
        @Override
        public String type() {
            return "interrupt";
        }

        @Override
        public boolean terminal() {
            return true;
        }
    }

    record Error(String message) implements StreamEvent {
        @Override
        public String type() {
            return "error";
        }

        @Override
        public boolean terminal() {
            return true;
        }
    }

    record Done() implements StreamEvent {
        @Override
        public String type() {
            return "done";
        }

        @Override
        public boolean terminal() {
            return true;
        }
    }
}
