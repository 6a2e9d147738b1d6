package com.sitedigest.core.logging;

import com.sitedigest.core.model.WorkflowNode;
import org.slf4j.MDC;

/**
 * Utility for managing Sitedigest-specific MDC keys for structured logging.
 */
public final class MdcContext {

    private MdcContext() {}

    public static void setJob(String jobId) {
        MDC.put("jobId", jobId);
    }

    public static void setStep(String jobId, WorkflowNode step) {
        MDC.put("jobId", jobId);
        MDC.put("step", step.name());
    }

    public static void clearStep() {
        MDC.remove("step");
    }

    public static void clear() {
        MDC.remove("jobId");
        MDC.remove("step");
    }
}
