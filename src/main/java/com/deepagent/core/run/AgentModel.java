package com.deepagent.core.run;

import java.util.function.Consumer;

/**
 * The language model as seen by the run loop.
 */
public interface AgentModel {

    /**
     * Produces the next assistant step for the thread in {@code request}.
     *
     * @param tokenSink receives incremental text as it streams; may be called zero times
     * @return the completed step, whose text equals the concatenation of streamed tokens
     */
    ModelTurn next(ModelRequest request, Consumer<String> tokenSink);
}
