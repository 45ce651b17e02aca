package com.deepagent.core.events;

import java.util.Map;

/**
 * How a tool is presented to clients: the capability it belongs to and its icon.
 */
public record ToolDisplay(String skillId, String icon) {

    static final ToolDisplay DEFAULT = new ToolDisplay("api", "🔧");

    private static final Map<String, ToolDisplay> BY_TOOL = Map.of(
            "tavily_search_results", new ToolDisplay("websearch", "🌐"),
            "execute", new ToolDisplay("codeinterpreter", "💻"),
            "read_file", new ToolDisplay("fileio", "📁"),
            "write_file", new ToolDisplay("fileio", "📁"),
            "edit_file", new ToolDisplay("fileio", "📁"),
            "ls", new ToolDisplay("fileio", "📁"),
            "grep", new ToolDisplay("fileio", "🔍"),
            "glob", new ToolDisplay("fileio", "🔍"));

    public static ToolDisplay of(String toolName) {
        return BY_TOOL.getOrDefault(toolName, DEFAULT);
    }

    /** {@code write_file} becomes {@code write file}. */
    public static String action(String toolName) {
        return toolName.replace('_', ' ');
    }
}
