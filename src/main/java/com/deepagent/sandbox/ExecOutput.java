package com.deepagent.sandbox;

/**
 * Raw result of one exec inside a sandbox container.
 *
 * @param exitCode  exit code reported by the runtime, or -1 when unavailable
 * @param stdout    captured stdout (capped)
 * @param stderr    captured stderr (capped)
 * @param truncated whether either stream hit the byte cap
 * @param timedOut  whether the exec was abandoned at its deadline
 */
public record ExecOutput(int exitCode, String stdout, String stderr, boolean truncated, boolean timedOut) {

    public boolean succeeded() {
        return exitCode == 0 && !timedOut;
    }
}
