package com.sitedigest.core.logging;

import com.sitedigest.core.model.WorkflowNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.junit.jupiter.api.Assertions.*;

class MdcContextTest {

    @AfterEach
    void tearDown() {
        MdcContext.clear();
    }

    @Test
    @DisplayName("setJob puts jobId in MDC")
    void setJob() {
        MdcContext.setJob("job-42");
        assertEquals("job-42", MDC.get("jobId"));
    }

    @Test
    @DisplayName("setStep puts jobId and step in MDC")
    void setStep() {
        MdcContext.setStep("job-42", WorkflowNode.RETRIEVAL);
        assertEquals("job-42", MDC.get("jobId"));
        assertEquals("RETRIEVAL", MDC.get("step"));
    }

    @Test
    @DisplayName("clearStep keeps the job but drops the step")
    void clearStep() {
        MdcContext.setStep("job-42", WorkflowNode.DISCOVERY);
        MdcContext.clearStep();
        assertEquals("job-42", MDC.get("jobId"));
        assertNull(MDC.get("step"));
    }

    @Test
    @DisplayName("clear removes all sitedigest MDC keys")
    void clear() {
        MdcContext.setStep("job-42", WorkflowNode.PERSISTENCE);
        MdcContext.clear();
        assertNull(MDC.get("jobId"));
        assertNull(MDC.get("step"));
    }
}
