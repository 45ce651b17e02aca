package com.deepagent.core.graph;

import com.deepagent.core.engine.EngineProperties;
import com.deepagent.core.hitl.Decision;
import com.deepagent.core.hitl.InterruptPolicy;
import com.deepagent.core.hitl.PendingInterrupt;
import com.deepagent.core.logging.MdcContext;
import com.deepagent.core.metrics.AgentMetrics;
import com.deepagent.core.run.AgentMessage;
import com.deepagent.core.run.AgentModel;
import com.deepagent.core.run.ModelRequest;
import com.deepagent.core.run.ModelTurn;
import com.deepagent.core.run.RunCancelledException;
import com.deepagent.core.run.RunContext;
import com.deepagent.core.run.RunEvent;
import com.deepagent.core.run.RunLimitExceededException;
import com.deepagent.core.run.ToolCall;
import com.deepagent.core.state.AgentRunState;
import com.deepagent.core.tools.AgentTool;
import org.bsc.langgraph4j.CompileConfig;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.bsc.langgraph4j.action.NodeAction;
import org.bsc.langgraph4j.checkpoint.BaseCheckpointSaver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * Builds the LangGraph4j {@link StateGraph} that drives one agent turn.
 * <pre>
 *   START -> [routeFromStart]
 *            -> agent -> [routeAfterAgent]
 *                        -> END           (no tool calls: turn complete)
 *                        -> await_review -> END   (a gated call needs a decision)
 *                        -> tools
 *            -> tools -> [routeAfterTools]
 *                        -> tools         (next call of the same step)
 *                        -> agent         (step finished, results go back to the model)
 * </pre>
 * The {@code tools} node runs one call per visit so that every finished call is
 * checkpointed. A resumed thread enters at {@code tools} because its step's calls are
 * still pending.
 * <p>
 * Nodes close over the turn's tools and event sink, so a graph is compiled per turn.
 * All compiled graphs share the one checkpoint saver, which keys state by thread id.
 */
@Component
public class AgentGraph {

    private static final Logger log = LoggerFactory.getLogger(AgentGraph.class);

    static final String AGENT = "agent";
    static final String AWAIT_REVIEW = "await_review";
    static final String TOOLS = "tools";

    private static final int RECURSION_LIMIT = 500;

    private final AgentModel model;
    private final InterruptPolicy interruptPolicy;
    private final BaseCheckpointSaver checkpointSaver;
    private final AgentMetrics metrics;
    private final int maxModelSteps;

    public AgentGraph(AgentModel model,
                      InterruptPolicy interruptPolicy,
                      EngineProperties engineProperties,
                      BaseCheckpointSaver checkpointSaver,
                      @Autowired(required = false) AgentMetrics metrics) {
        this.model = model;
        this.interruptPolicy = interruptPolicy;
        this.checkpointSaver = checkpointSaver;
        this.metrics = metrics;
        this.maxModelSteps = engineProperties.getMaxModelSteps();
    }

    /**
     * Compiles the graph for one turn.
     *
     * @param sink      receives tokens and tool events as nodes produce them
     * @param onFailure receives any exception a node throws, before it reaches the graph runtime
     */
    public CompiledGraph<AgentRunState> compile(RunContext ctx, Consumer<RunEvent> sink,
                                                Consumer<RuntimeException> onFailure) {
        try {
            var graph = new StateGraph<>(AgentRunState.SCHEMA, AgentRunState::new)
                    .addNode(AGENT, node_async(guarded(state -> callModel(ctx, state, sink), onFailure)))
                    .addNode(AWAIT_REVIEW, node_async(guarded(this::awaitReview, onFailure)))
                    .addNode(TOOLS, node_async(guarded(state -> executeNextCall(ctx, state, sink), onFailure)))
                    .addConditionalEdges(START,
                            edge_async(this::routeFromStart),
                            Map.of(AGENT, AGENT, TOOLS, TOOLS))
                    .addConditionalEdges(AGENT,
                            edge_async(state -> routeAfterAgent(ctx, state)),
                            Map.of(END, END, AWAIT_REVIEW, AWAIT_REVIEW, TOOLS, TOOLS))
                    .addEdge(AWAIT_REVIEW, END)
                    .addConditionalEdges(TOOLS,
                            edge_async(this::routeAfterTools),
                            Map.of(TOOLS, TOOLS, AGENT, AGENT));

            return graph.compile(CompileConfig.builder()
                    .checkpointSaver(checkpointSaver)
                    .recursionLimit(RECURSION_LIMIT)
                    .build());
        } catch (GraphStateException e) {
            throw new IllegalStateException("Cannot build the agent graph", e);
        }
    }

    /**
     * Resumed threads still have calls of the reviewed step to run.
     */
    String routeFromStart(AgentRunState state) {
        return state.pendingCalls().isEmpty() ? AGENT : TOOLS;
    }

    /**
     * A step without tool calls ends the turn. A step with a gated call stops before any
     * of its calls run.
     */
    String routeAfterAgent(RunContext ctx, AgentRunState state) {
        if (state.pendingCalls().isEmpty()) {
            return END;
        }
        if (ctx.hitlEnabled() && interruptPolicy.intercept(state.pendingCalls()) != null) {
            return AWAIT_REVIEW;
        }
        return TOOLS;
    }

    String routeAfterTools(AgentRunState state) {
        return state.pendingCalls().isEmpty() ? AGENT : TOOLS;
    }

    Map<String, Object> callModel(RunContext ctx, AgentRunState state, Consumer<RunEvent> sink) {
        ensureActive(ctx);
        int steps = state.modelSteps();
        if (steps >= maxModelSteps) {
            throw new RunLimitExceededException(maxModelSteps);
        }
        List<AgentMessage> messages = state.messages();
        ModelTurn turn = model.next(
                new ModelRequest(ctx.modelId(), messages, ctx.toolbox().specs()),
                token -> {
                    if (token != null && !token.isEmpty()) {
                        sink.accept(new RunEvent.TokenEmitted(token));
                    }
                });
        var updated = new ArrayList<>(messages);
        updated.add(AgentMessage.assistant(turn.text(), turn.toolCalls()));
        log.debug("Thread {} model step {} proposed {} tool call(s)",
                ctx.threadId(), steps + 1, turn.toolCalls().size());
        return Map.of(
                AgentRunState.MESSAGES, updated,
                AgentRunState.PENDING_CALLS, turn.toolCalls(),
                AgentRunState.MODEL_STEPS, steps + 1,
                AgentRunState.FINAL_TEXT, turn.text());
    }

    Map<String, Object> awaitReview(AgentRunState state) {
        PendingInterrupt interrupt = interruptPolicy.intercept(state.pendingCalls());
        return Map.of(
                AgentRunState.AWAITING_REVIEW, true,
                AgentRunState.PENDING_INTERRUPT, interrupt);
    }

    Map<String, Object> executeNextCall(RunContext ctx, AgentRunState state, Consumer<RunEvent> sink) {
        ensureActive(ctx);
        List<ToolCall> pending = state.pendingCalls();
        ToolCall call = pending.get(0);
        Decision decision = state.decisions().get(call.id());

        ToolCall effective = call;
        if (decision instanceof Decision.Edit edit) {
            effective = call.withArguments(edit.editedArguments());
            log.info("Executing {} ({}) with edited arguments", call.name(), call.id());
        }

        sink.accept(new RunEvent.ToolStarted(effective.id(), effective.name(), effective.arguments()));
        String output;
        if (decision instanceof Decision.Reject reject) {
            output = rejection(call, reject);
            log.info("Skipped rejected call {} ({})", call.name(), call.id());
        } else {
            output = invoke(ctx, effective);
        }
        sink.accept(new RunEvent.ToolFinished(effective.id(), effective.name(), output));

        var messages = new ArrayList<>(state.messages());
        messages.add(AgentMessage.tool(call.id(), call.name(), output));
        List<ToolCall> remaining = List.copyOf(pending.subList(1, pending.size()));
        return Map.of(
                AgentRunState.MESSAGES, messages,
                AgentRunState.PENDING_CALLS, remaining,
                AgentRunState.DECISIONS, remaining.isEmpty() ? Map.of() : state.decisions());
    }

    private String invoke(RunContext ctx, ToolCall call) {
        MdcContext.setTool(call.name());
        long start = System.nanoTime();
        try {
            Optional<AgentTool> tool = ctx.toolbox().find(call.name());
            if (tool.isEmpty()) {
                return "Error: " + call.name() + " is not a valid tool, try one of " + ctx.toolbox().names() + ".";
            }
            return tool.get().execute(call.arguments());
        } catch (RuntimeException e) {
            log.warn("Tool {} failed: {}", call.name(), e.getMessage());
            return "Error executing tool " + call.name() + ": " + e.getMessage();
        } finally {
            if (metrics != null) {
                metrics.recordToolDuration(call.name(), (System.nanoTime() - start) / 1_000_000);
            }
            MdcContext.clearTool();
        }
    }

    private static String rejection(ToolCall call, Decision.Reject reject) {
        String base = "User rejected the tool call for `" + call.name() + "` with id " + call.id();
        String message = reject.message();
        return message == null || message.isBlank() ? base : base + ": " + message;
    }

    private static void ensureActive(RunContext ctx) {
        if (ctx.cancelled() != null && ctx.cancelled().getAsBoolean()) {
            throw new RunCancelledException(ctx.threadId());
        }
    }

    private static NodeAction<AgentRunState> guarded(NodeAction<AgentRunState> action,
                                                     Consumer<RuntimeException> onFailure) {
        return state -> {
            try {
                return action.apply(state);
            } catch (RuntimeException e) {
                onFailure.accept(e);
                throw e;
            }
        };
    }
}
