package com.deepagent.core.run;

import com.deepagent.core.tools.Toolbox;

import java.util.function.BooleanSupplier;

/**
 * Per-turn inputs to {@link AgentRunner}.
 *
 * @param threadId     checkpoint key
 * @param modelId      catalogue key of the model
 * @param systemPrompt prompt placed at the head of a new thread
 * @param hitlEnabled  whether gated tools pause for review
 * @param toolbox      tools bound to the session's backend
 * @param cancelled    polled between steps; {@code true} aborts the run
 */
public record RunContext(
    String threadId,
    String modelId,
    String systemPrompt,
    boolean hitlEnabled,
    Toolbox toolbox,
    BooleanSupplier cancelled
) {}
