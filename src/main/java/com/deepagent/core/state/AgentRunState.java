package com.deepagent.core.state;

import com.deepagent.core.hitl.Decision;
import com.deepagent.core.hitl.PendingInterrupt;
import com.deepagent.core.run.AgentMessage;
import com.deepagent.core.run.ToolCall;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Graph state of one run thread.
 * <p>
 * {@code pendingCalls} holds the calls of the last model step that have not run yet.
 * While {@code awaitingReview} is set, {@code pendingInterrupt} describes the gated subset
 * and the thread waits for decisions keyed by call id in {@code decisions}.
 */
public class AgentRunState extends AgentState {

    public static final String MESSAGES = "messages";
    public static final String PENDING_CALLS = "pendingCalls";
    public static final String AWAITING_REVIEW = "awaitingReview";
    public static final String PENDING_INTERRUPT = "pendingInterrupt";
    public static final String DECISIONS = "decisions";
    public static final String MODEL_STEPS = "modelSteps";
    public static final String FINAL_TEXT = "finalText";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        Map.entry(MESSAGES,          Channels.base((Supplier<List<AgentMessage>>) List::of)),
        Map.entry(PENDING_CALLS,     Channels.base((Supplier<List<ToolCall>>) List::of)),
        Map.entry(AWAITING_REVIEW,   Channels.base(() -> false)),
        Map.entry(PENDING_INTERRUPT, Channels.base((Reducer<PendingInterrupt>) null)),
        Map.entry(DECISIONS,         Channels.base((Supplier<Map<String, Decision>>) Map::of)),
        Map.entry(MODEL_STEPS,       Channels.base(() -> 0)),
        Map.entry(FINAL_TEXT,        Channels.base(() -> ""))
    );

    public AgentRunState(Map<String, Object> initData) {
        super(initData);
    }

    public List<AgentMessage> messages() {
        return this.<List<AgentMessage>>value(MESSAGES).orElse(List.of());
    }

    public List<ToolCall> pendingCalls() {
        return this.<List<ToolCall>>value(PENDING_CALLS).orElse(List.of());
    }

    public boolean awaitingReview() {
        return this.<Boolean>value(AWAITING_REVIEW).orElse(false);
    }

    /**
     * The interrupt the thread is waiting on. Empty once decisions have been accepted.
     */
    public Optional<PendingInterrupt> pendingInterrupt() {
        if (!awaitingReview()) {
            return Optional.empty();
        }
        return this.value(PENDING_INTERRUPT);
    }

    public Map<String, Decision> decisions() {
        return this.<Map<String, Decision>>value(DECISIONS).orElse(Map.of());
    }

    public int modelSteps() {
        return this.<Integer>value(MODEL_STEPS).orElse(0);
    }

    public String finalText() {
        return this.<String>value(FINAL_TEXT).orElse("");
    }

    /**
     * The thread with every assistant tool call answered, so it can be handed to the model
     * again after a turn that stopped between calls.
     */
    public List<AgentMessage> settledMessages() {
        List<AgentMessage> messages = messages();
        Set<String> answered = new HashSet<>();
        for (AgentMessage m : messages) {
            if (m.role() == AgentMessage.Role.TOOL && m.toolCallId() != null) {
                answered.add(m.toolCallId());
            }
        }
        var repaired = new ArrayList<AgentMessage>(messages.size());
        for (AgentMessage m : messages) {
            repaired.add(m);
            for (ToolCall call : m.toolCalls()) {
                if (!answered.contains(call.id())) {
                    repaired.add(AgentMessage.tool(call.id(), call.name(),
                            "Tool call " + call.name() + " was not completed"));
                }
            }
        }
        return repaired;
    }
}
