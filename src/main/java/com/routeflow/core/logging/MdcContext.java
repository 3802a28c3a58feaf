package com.routeflow.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing RouteFlow-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put("runId", runId);
    }

    public static void setStage(String runId, String stage) {
        MDC.put("runId", runId);
        MDC.put("stage", stage);
    }

    public static void setSpecialist(String runId, String specialistId) {
        MDC.put("runId", runId);
        MDC.put("specialist", specialistId);
    }

    public static void clearStage() {
        MDC.remove("stage");
    }

    public static void clear() {
        MDC.remove("runId");
        MDC.remove("stage");
        MDC.remove("specialist");
    }
}
