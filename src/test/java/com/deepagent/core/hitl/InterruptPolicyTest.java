package com.deepagent.core.hitl;

import com.deepagent.core.run.ToolCall;
import com.deepagent.core.session.DecisionMismatchException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InterruptPolicyTest {

    private HitlProperties properties;
    private InterruptPolicy policy;

    @BeforeEach
    void setUp() {
        properties = new HitlProperties();
        policy = new InterruptPolicy(properties, new ObjectMapper());
    }

    @Test
    @DisplayName("write, edit and execute are gated by default")
    void defaultGates() {
        assertTrue(policy.isGated("write_file"));
        assertTrue(policy.isGated("edit_file"));
        assertTrue(policy.isGated("execute"));
        assertFalse(policy.isGated("read_file"));
        assertFalse(policy.isGated("ls"));
    }

    @Test
    @DisplayName("only gated calls become action requests, in proposal order")
    void intercept() {
        PendingInterrupt pending = policy.intercept(List.of(
                new ToolCall("a", "read_file", Map.of("file_path", "/x")),
                new ToolCall("b", "execute", Map.of("command", "rm -rf build")),
                new ToolCall("c", "write_file", Map.of("file_path", "/y", "content", "z"))));

        assertNotNull(pending);
        assertEquals(List.of("b", "c"), pending.actionRequests().stream().map(ActionRequest::id).toList());
        assertEquals("execute", pending.reviewConfigs().get(0).actionName());
        assertEquals(List.of(DecisionType.APPROVE, DecisionType.REJECT, DecisionType.EDIT),
                pending.reviewConfigs().get(0).allowedDecisions());
        assertEquals("Tool execution requires approval\n\nTool: execute\nArgs: {\"command\":\"rm -rf build\"}",
                pending.actionRequests().get(0).description());
    }

    @Test
    @DisplayName("a step with no gated call needs no review")
    void nothingGated() {
        assertNull(policy.intercept(List.of(new ToolCall("a", "ls", Map.of()))));
    }

    @Test
    @DisplayName("gated tools follow configuration")
    void configuredGates() {
        properties.setGatedTools(List.of("ls"));
        assertTrue(policy.isGated("ls"));
        assertFalse(policy.isGated("execute"));
    }

    @Test
    @DisplayName("null argument values survive into the request")
    void nullArguments() {
        var args = new java.util.HashMap<String, Object>();
        args.put("file_path", null);
        PendingInterrupt pending = policy.intercept(List.of(new ToolCall("a", "write_file", args)));
        assertTrue(pending.actionRequests().get(0).arguments().containsKey("file_path"));
    }

    @Test
    @DisplayName("decisions must match the pending requests one for one")
    void validateCount() {
        PendingInterrupt pending = policy.intercept(List.of(
                new ToolCall("a", "write_file", Map.of()), new ToolCall("b", "execute", Map.of())));

        assertThrows(DecisionMismatchException.class,
                () -> policy.validate("s", pending, List.of(Decision.approve())));
        assertThrows(DecisionMismatchException.class,
                () -> policy.validate("s", pending, Collections.nCopies(3, Decision.approve())));
        assertDoesNotThrow(() -> policy.validate("s", pending, List.of(Decision.approve(), Decision.reject(null))));
    }

    @Test
    @DisplayName("a decision type outside the allowed set is refused")
    void validateAllowed() {
        properties.setAllowedDecisions(List.of(DecisionType.APPROVE, DecisionType.REJECT));
        PendingInterrupt pending = policy.intercept(List.of(new ToolCall("a", "execute", Map.of())));

        var e = assertThrows(DecisionMismatchException.class,
                () -> policy.validate("s", pending, List.of(Decision.edit(Map.of("command", "ls")))));
        assertEquals("s", e.getSessionId());
        assertTrue(e.getMessage().contains("'edit'"));
    }

    @Test
    @DisplayName("decision types parse from their lowercase wire names")
    void decisionWireNames() {
        assertEquals(DecisionType.EDIT, DecisionType.fromWire("edit"));
        assertEquals(DecisionType.APPROVE, DecisionType.fromWire(" Approve "));
        assertEquals("reject", DecisionType.REJECT.wireName());
        assertThrows(IllegalArgumentException.class, () -> DecisionType.fromWire("maybe"));
    }
}
