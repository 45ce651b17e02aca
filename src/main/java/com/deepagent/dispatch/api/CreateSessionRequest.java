package com.deepagent.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Inbound JSON body for POST /api/sessions.
 *
 * @param capabilities skill ids such as {@code sandbox}, {@code codeinterpreter}, {@code fileio}; nullable
 * @param model        model catalogue id; nullable, defaults to the configured model
 * @param hitlEnabled  pause gated tool calls for review; nullable, defaults to true
 */
public record CreateSessionRequest(
    List<String> capabilities,
    String model,
    @JsonProperty("hitl_enabled") Boolean hitlEnabled
) {}
