package com.deepagent.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing deep-agent MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String sessionId, String threadId) {
        MDC.put("sessionId", sessionId);
        MDC.put("threadId", threadId);
    }

    public static void setTool(String toolName) {
        MDC.put("tool", toolName);
    }

    public static void clearTool() {
        MDC.remove("tool");
    }

    public static void clear() {
        MDC.remove("sessionId");
        MDC.remove("threadId");
        MDC.remove("tool");
    }
}
