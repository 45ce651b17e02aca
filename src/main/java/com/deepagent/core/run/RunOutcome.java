package com.deepagent.core.run;

import com.deepagent.core.hitl.PendingInterrupt;

/**
 * How a call to {@link AgentRunner#start} or {@link AgentRunner#resume} ended.
 */
public record RunOutcome(Status status, String finalText, PendingInterrupt interrupt) {

    public enum Status { COMPLETED, INTERRUPTED }

    public static RunOutcome completed(String finalText) {
        return new RunOutcome(Status.COMPLETED, finalText, null);
    }

    public static RunOutcome interrupted(PendingInterrupt interrupt) {
        return new RunOutcome(Status.INTERRUPTED, null, interrupt);
    }

    public boolean isInterrupted() {
        return status == Status.INTERRUPTED;
    }
}
