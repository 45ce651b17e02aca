package com.deepagent.core.tools;

import java.util.Map;

/**
 * Name, description and JSON-schema of a tool as advertised to the model.
 */
public record ToolSpec(String name, String description, Map<String, Object> inputSchema) {}
