package com.deepagent.backend;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a command execution. Timeouts and output caps are reported here,
 * never raised.
 *
 * @param output    combined stdout/stderr, capped and marked when truncated
 * @param exitCode  process exit code; {@link #TIMEOUT_EXIT_CODE} when the deadline was exceeded
 * @param truncated whether the output was cut at the byte budget
 */
public record ExecuteResult(
    String output,
    @JsonProperty("exit_code") int exitCode,
    boolean truncated
) {

    /** Exit code reported for commands killed at their deadline (same as coreutils {@code timeout}). */
    public static final int TIMEOUT_EXIT_CODE = 124;

    public static final String TRUNCATION_MARKER = "\n... (truncated)";

    public static String timeoutMarker(long seconds) {
        return "[command timed out after " + seconds + "s]";
    }

    public boolean succeeded() {
        return exitCode == 0;
    }
}
