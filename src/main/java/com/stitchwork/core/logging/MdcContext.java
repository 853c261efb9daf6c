package com.stitchwork.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing run-scoped MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setNode(String runId, String nodeId, int attempt) {
        MDC.put("runId", runId);
        MDC.put("nodeId", nodeId);
        MDC.put("attempt", String.valueOf(attempt));
    }

    public static void clearNode() {
        MDC.remove("nodeId");
        MDC.remove("attempt");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("nodeId");
        MDC.remove("attempt");
    }
}
