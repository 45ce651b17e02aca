package com.deepagent.core.run;

import com.deepagent.core.graph.AgentGraph;
import com.deepagent.core.hitl.Decision;
import com.deepagent.core.hitl.PendingInterrupt;
import com.deepagent.core.metrics.AgentMetrics;
import com.deepagent.core.state.AgentRunState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.bsc.langgraph4j.checkpoint.Checkpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Runs agent turns on the {@link AgentGraph} and suspends or resumes them through the
 * checkpoint saver.
 * <p>
 * A turn that reaches a gated step ends at {@code await_review} with none of the step's
 * calls executed. {@link #resume} records the reviewer's decisions on the thread and
 * invokes the graph again under the same thread id: the step's calls run in their
 * original order and the loop continues without asking the model to replan.
 */
@Service
public class AgentRunner {

    private static final Logger log = LoggerFactory.getLogger(AgentRunner.class);

    private final AgentGraph agentGraph;
    private final BaseCheckpointSaver checkpointSaver;
    private final AgentMetrics metrics;

    public AgentRunner(AgentGraph agentGraph,
                       BaseCheckpointSaver checkpointSaver,
                       @Autowired(required = false) AgentMetrics metrics) {
        this.agentGraph = agentGraph;
        this.checkpointSaver = checkpointSaver;
        this.metrics = metrics;
    }

    /**
     * Replaces the thread with the system prompt followed by {@code history}, so a stateless
     * caller can continue an earlier conversation.
     */
    public void seed(RunContext ctx, List<AgentMessage> history) {
        var messages = new ArrayList<AgentMessage>();
        addSystemPrompt(ctx, messages);
        messages.addAll(history);
        var checkpoint = Checkpoint.builder()
                .id(UUID.randomUUID().toString())
                .state(turnInput(messages, List.of(), Map.of(), 0))
                .build();
        try {
            checkpointSaver.put(config(ctx.threadId()), checkpoint);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to seed thread " + ctx.threadId(), e);
        }
    }

    /**
     * Appends a user message to the thread and runs until the model answers without tool
     * calls or a gated call interrupts the run.
     *
     * @throws IllegalStateException when the thread is waiting for a decision
     */
    public RunOutcome start(RunContext ctx, String userMessage, Consumer<RunEvent> sink) {
        Optional<AgentRunState> existing = currentState(ctx.threadId());
        if (existing.isPresent() && existing.get().awaitingReview()) {
            throw new IllegalStateException("Thread " + ctx.threadId() + " is waiting for a decision");
        }

        var messages = new ArrayList<>(existing.map(AgentRunState::settledMessages).orElse(List.of()));
        if (messages.isEmpty()) {
            addSystemPrompt(ctx, messages);
        }
        messages.add(AgentMessage.user(userMessage));
        return run(ctx, turnInput(messages, List.of(), Map.of(), 0), sink);
    }

    /**
     * Resumes an interrupted thread with one decision per pending action request, in order.
     * Decisions are expected to have been validated against the interrupt already.
     *
     * @throws IllegalStateException when the thread has no pending interrupt
     */
    public RunOutcome resume(RunContext ctx, List<Decision> decisions, Consumer<RunEvent> sink) {
        AgentRunState state = currentState(ctx.threadId())
                .filter(AgentRunState::awaitingReview)
                .orElseThrow(() -> new IllegalStateException(
                        "Thread " + ctx.threadId() + " has no pending interrupt"));

        PendingInterrupt pending = state.pendingInterrupt().orElseThrow();
        if (decisions.size() != pending.size()) {
            throw new IllegalStateException("Expected " + pending.size() + " decision(s) but received "
                    + decisions.size());
        }
        Map<String, Decision> byCallId = new HashMap<>();
        for (int i = 0; i < decisions.size(); i++) {
            byCallId.put(pending.actionRequests().get(i).id(), decisions.get(i));
        }

        CompiledGraph<AgentRunState> graph = agentGraph.compile(ctx, sink, e -> {});
        // The pending slot is cleared before anything executes
        try {
            graph.updateState(config(ctx.threadId()),
                    Map.of(AgentRunState.AWAITING_REVIEW, false, AgentRunState.DECISIONS, byCallId), null);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to record decisions on thread " + ctx.threadId(), e);
        }
        log.info("Resuming thread {} with {} decision(s)", ctx.threadId(), decisions.size());

        return run(ctx, turnInput(state.messages(), state.pendingCalls(), byCallId, state.modelSteps()), sink);
    }

    /**
     * The thread's last committed state, if it has one.
     */
    public Optional<AgentRunState> currentState(String threadId) {
        return checkpointSaver.get(config(threadId)).map(cp -> new AgentRunState(cp.getState()));
    }

    public void discard(String threadId) {
        try {
            checkpointSaver.release(config(threadId));
        } catch (Exception e) {
            log.warn("Failed to release checkpoints of thread {}: {}", threadId, e.getMessage());
        }
    }

    private RunOutcome run(RunContext ctx, Map<String, Object> input, Consumer<RunEvent> sink) {
        var failure = new AtomicReference<RuntimeException>();
        CompiledGraph<AgentRunState> graph = agentGraph.compile(ctx, sink, failure::set);

        AgentRunState result;
        try {
            result = graph.invoke(input, config(ctx.threadId()))
                    .orElseThrow(() -> new IllegalStateException(
                            "Graph execution returned empty state for thread " + ctx.threadId()));
        } catch (RuntimeException e) {
            throw failure.get() != null ? failure.get() : e;
        }
        if (failure.get() != null) {
            throw failure.get();
        }

        Optional<PendingInterrupt> interrupt = result.pendingInterrupt();
        if (interrupt.isPresent()) {
            log.info("Thread {} interrupted for review of {} action(s)", ctx.threadId(), interrupt.get().size());
            if (metrics != null) {
                metrics.recordInterrupt(interrupt.get().size());
            }
            sink.accept(new RunEvent.Interrupted(interrupt.get()));
            return RunOutcome.interrupted(interrupt.get());
        }
        log.debug("Thread {} completed after {} model step(s)", ctx.threadId(), result.modelSteps());
        sink.accept(new RunEvent.Completed(result.finalText()));
        return RunOutcome.completed(result.finalText());
    }

    private static Map<String, Object> turnInput(List<AgentMessage> messages, List<ToolCall> pendingCalls,
                                                 Map<String, Decision> decisions, int modelSteps) {
        var input = new LinkedHashMap<String, Object>();
        input.put(AgentRunState.MESSAGES, List.copyOf(messages));
        input.put(AgentRunState.PENDING_CALLS, List.copyOf(pendingCalls));
        input.put(AgentRunState.DECISIONS, Map.copyOf(decisions));
        input.put(AgentRunState.AWAITING_REVIEW, false);
        input.put(AgentRunState.MODEL_STEPS, modelSteps);
        input.put(AgentRunState.FINAL_TEXT, "");
        return input;
    }

    private static RunnableConfig config(String threadId) {
        return RunnableConfig.builder()
                .threadId(threadId)
                .build();
    }

    private static void addSystemPrompt(RunContext ctx, List<AgentMessage> messages) {
        if (ctx.systemPrompt() != null && !ctx.systemPrompt().isBlank()) {
            messages.add(AgentMessage.system(ctx.systemPrompt()));
        }
    }
}
