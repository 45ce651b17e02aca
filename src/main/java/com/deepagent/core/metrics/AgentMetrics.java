package com.deepagent.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Centralised Micrometer metrics for sessions, tool calls and approvals.
 */
@Service
public class AgentMetrics {

    private final MeterRegistry registry;
    private final AtomicInteger activeSessions = new AtomicInteger();

    public AgentMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("deepagent.sessions.active", activeSessions, AtomicInteger::get)
                .description("Sessions currently held in the store")
                .register(registry);
    }

    public void recordSessionCreated(String backendKind) {
        Counter.builder("deepagent.sessions.created")
                .tag("backend", backendKind)
                .register(registry)
                .increment();
    }

    public void setActiveSessions(int count) {
        activeSessions.set(count);
    }

    public void recordToolDuration(String tool, long ms) {
        Timer.builder("deepagent.tool.duration")
                .tag("tool", tool)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordInterrupt(int actionCount) {
        Counter.builder("deepagent.interrupts.total")
                .description("Runs paused for human review")
                .register(registry)
                .increment();
    }

    /**
     * @param type "approve", "reject" or "edit"
     */
    public void recordDecision(String type) {
        Counter.builder("deepagent.decisions.total")
                .tag("type", type)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "completed", "interrupted" or "failed"
     */
    public void recordTurn(String outcome) {
        Counter.builder("deepagent.turns.total")
                .tag("outcome", outcome)
                .register(registry)
                .increment();
    }

    public void recordSandboxFallback(String fallbackKind) {
        Counter.builder("deepagent.sandbox.fallbacks")
                .description("Sandbox creations that fell back to a host backend")
                .tag("fallback", fallbackKind)
                .register(registry)
                .increment();
    }
}
