package com.deepagent.backend;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single line matched by {@code grep}.
 */
public record GrepMatch(
    String path,
    @JsonProperty("line_number") int lineNumber,
    String content
) {
    public String render() {
        return path + ":" + lineNumber + ":" + content;
    }
}
