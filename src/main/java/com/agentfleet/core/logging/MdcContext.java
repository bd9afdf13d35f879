package com.agentfleet.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing AgentFleet MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setWorkflow(String workflowId) {
        MDC.put("workflowId", workflowId);
    }

    public static void setTask(String workflowId, String taskId) {
        MDC.put("workflowId", workflowId);
        MDC.put("taskId", taskId);
    }

    public static void setAgent(String agentId) {
        MDC.put("agentId", agentId);
    }

    public static void clearTask() {
        MDC.remove("taskId");
    }

    public static void clear() {
        MDC.remove("workflowId");
        MDC.remove("taskId");
        MDC.remove("agentId");
    }
}
