package com.deepagent.dispatch.api;

/**
 * Inbound JSON body for POST /api/sessions/{id}/messages.
 */
public record MessageRequest(String message) {}
