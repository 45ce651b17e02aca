package com.deepagent.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class AgentMetricsTest {

    private SimpleMeterRegistry registry;
    private AgentMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new AgentMetrics(registry);
    }

    @Test
    void recordsSessionCounts() {
        metrics.recordSessionCreated("sandbox");
        metrics.recordSessionCreated("sandbox");
        metrics.setActiveSessions(3);

        assertEquals(2.0, registry.get("deepagent.sessions.created").tag("backend", "sandbox").counter().count());
        assertEquals(3.0, registry.get("deepagent.sessions.active").gauge().value());
    }

    @Test
    void recordsToolDurations() {
        metrics.recordToolDuration("execute", 250);

        var timer = registry.get("deepagent.tool.duration").tag("tool", "execute").timer();
        assertEquals(1, timer.count());
        assertEquals(250.0, timer.totalTime(TimeUnit.MILLISECONDS));
    }

    @Test
    void recordsApprovalFlow() {
        metrics.recordInterrupt(2);
        metrics.recordDecision("approve");
        metrics.recordDecision("reject");
        metrics.recordTurn("interrupted");

        assertEquals(1.0, registry.get("deepagent.interrupts.total").counter().count());
        assertEquals(1.0, registry.get("deepagent.decisions.total").tag("type", "reject").counter().count());
        assertEquals(1.0, registry.get("deepagent.turns.total").tag("outcome", "interrupted").counter().count());
    }
}
