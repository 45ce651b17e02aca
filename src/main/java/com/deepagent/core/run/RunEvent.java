package com.deepagent.core.run;

import com.deepagent.core.hitl.PendingInterrupt;

import java.util.Map;

/**
 * Internal events produced by {@link AgentRunner}, before translation for clients.
 */
public sealed interface RunEvent
        permits RunEvent.TokenEmitted, RunEvent.ToolStarted, RunEvent.ToolFinished,
                RunEvent.Interrupted, RunEvent.Completed {

    record TokenEmitted(String text) implements RunEvent {}

    record ToolStarted(String callId, String name, Map<String, Object> arguments) implements RunEvent {}

    record ToolFinished(String callId, String name, String output) implements RunEvent {}

    record Interrupted(PendingInterrupt interrupt) implements RunEvent {}

    record Completed(String finalText) implements RunEvent {}
}
