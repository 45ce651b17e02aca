package com.deepagent.backend;

import java.util.Collection;
import java.util.Locale;

/**
 * Capability ids a session may be created with. Unknown ids are accepted and ignored.
 */
public final class Capabilities {

    public static final String SANDBOX = "sandbox";
    public static final String CODE_INTERPRETER = "codeinterpreter";
    public static final String FILE_IO = "fileio";
    public static final String WEB_SEARCH = "websearch";

    private Capabilities() {}

    public static boolean has(Collection<String> capabilities, String capability) {
        if (capabilities == null) {
            return false;
        }
        for (String c : capabilities) {
            if (c != null && capability.equals(c.trim().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Whether the session should be offered the {@code execute} tool.
     */
    public static boolean wantsExecution(Collection<String> capabilities) {
        return has(capabilities, SANDBOX) || has(capabilities, CODE_INTERPRETER);
    }
}
