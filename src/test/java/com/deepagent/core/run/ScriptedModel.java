package com.deepagent.core.run;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * {@link AgentModel} that replays scripted steps and records every request it receives.
 * Step text is streamed word by word.
 */
public class ScriptedModel implements AgentModel {

    private final Deque<Function<ModelRequest, ModelTurn>> steps = new ArrayDeque<>();
    private final List<ModelRequest> requests = new ArrayList<>();

    public ScriptedModel then(ModelTurn turn) {
        steps.add(request -> turn);
        return this;
    }

    public ScriptedModel then(Function<ModelRequest, ModelTurn> step) {
        steps.add(step);
        return this;
    }

    public ScriptedModel thenText(String text) {
        return then(ModelTurn.text(text));
    }

    public ScriptedModel thenCalls(ToolCall... calls) {
        return then(ModelTurn.calls(calls));
    }

    public ScriptedModel thenFail(RuntimeException error) {
        steps.add(request -> {
            throw error;
        });
        return this;
    }

    @Override
    public synchronized ModelTurn next(ModelRequest request, Consumer<String> tokenSink) {
        requests.add(request);
        Function<ModelRequest, ModelTurn> step = steps.poll();
        if (step == null) {
            throw new AssertionError("Model called more often than scripted (" + requests.size() + " calls)");
        }
        ModelTurn turn = step.apply(request);
        String text = turn.text();
        int start = 0;
        while (start < text.length()) {
            int space = text.indexOf(' ', start);
            int end = space < 0 ? text.length() : space + 1;
            tokenSink.accept(text.substring(start, end));
            start = end;
        }
        return turn;
    }

    public synchronized List<ModelRequest> requests() {
        return List.copyOf(requests);
    }

    public synchronized int callCount() {
        return requests.size();
    }

    public synchronized ModelRequest lastRequest() {
        return requests.get(requests.size() - 1);
    }
}
