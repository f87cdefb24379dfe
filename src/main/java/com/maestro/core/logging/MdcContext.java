package com.maestro.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing Maestro-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setWorkflow(String workflowId) {
        MDC.put("workflowId", workflowId);
    }

    public static void setTask(String workflowId, String taskId, String agent) {
        MDC.put("workflowId", workflowId);
        MDC.put("taskId", taskId);
        MDC.put("agent", agent);
    }

    public static void setBatch(String workflowId, int batchNumber) {
        MDC.put("workflowId", workflowId);
        MDC.put("batchNumber", String.valueOf(batchNumber));
    }

    public static void clear() {
        MDC.remove("workflowId");
        MDC.remove("taskId");
        MDC.remove("agent");
        MDC.remove("batchNumber");
    }
}
