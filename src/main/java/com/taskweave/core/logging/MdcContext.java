package com.taskweave.core.logging;

import org.slf4j.MDC;

/**
 * Utility for managing taskweave MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setWorkflow(String workflowId) {
        MDC.put("workflowId", workflowId);
    }

    public static void setTask(String workflowId, String taskId, String workerId) {
        MDC.put("workflowId", workflowId);
        MDC.put("taskId", taskId);
        MDC.put("workerId", workerId);
    }

    public static void setStep(String workflowId, int stepNumber) {
        MDC.put("workflowId", workflowId);
        MDC.put("stepNumber", String.valueOf(stepNumber));
    }

    public static void clearTask() {
        MDC.remove("taskId");
        MDC.remove("workerId");
    }

    public static void clear() {
        MDC.remove("workflowId");
        MDC.remove("taskId");
        MDC.remove("workerId");
        MDC.remove("stepNumber");
    }
}
