package com.sitedigest.core.graph;

import com.sitedigest.core.model.WorkflowNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import static org.junit.jupiter.api.Assertions.*;

class WorkflowRouterTest {

    private final WorkflowRouter router = new WorkflowRouter(3);

    @Test
    @DisplayName("success walks the linear pipeline")
    void successPath() {
        assertEquals(WorkflowNode.DISCOVERY, router.next(WorkflowNode.INITIALIZE, StepOutcome.SUCCESS, 0));
        assertEquals(WorkflowNode.RETRIEVAL, router.next(WorkflowNode.DISCOVERY, StepOutcome.SUCCESS, 0));
        assertEquals(WorkflowNode.TRANSFORMATION, router.next(WorkflowNode.RETRIEVAL, StepOutcome.SUCCESS, 2));
        assertEquals(WorkflowNode.PERSISTENCE, router.next(WorkflowNode.TRANSFORMATION, StepOutcome.SUCCESS, 0));
        assertEquals(WorkflowNode.COMPLETE, router.next(WorkflowNode.PERSISTENCE, StepOutcome.SUCCESS, 0));
    }

    @ParameterizedTest
    @EnumSource(value = WorkflowNode.class, names = {"DISCOVERY", "RETRIEVAL", "TRANSFORMATION", "PERSISTENCE"})
    @DisplayName("retryable failures go to error recovery until the budget is spent")
    void retryableFailure(WorkflowNode node) {
        assertEquals(WorkflowNode.ERROR_RECOVERY, router.next(node, StepOutcome.RETRYABLE_FAILURE, 0));
        assertEquals(WorkflowNode.ERROR_RECOVERY, router.next(node, StepOutcome.RETRYABLE_FAILURE, 2));
        assertEquals(WorkflowNode.COMPLETE, router.next(node, StepOutcome.RETRYABLE_FAILURE, 3));
    }

    @ParameterizedTest
    @EnumSource(value = WorkflowNode.class, names = {"DISCOVERY", "RETRIEVAL", "TRANSFORMATION", "PERSISTENCE"})
    @DisplayName("terminal failures go straight to complete and recovery returns to the failed node")
    void terminalFailureAndRecovery(WorkflowNode node) {
        assertEquals(WorkflowNode.COMPLETE, router.next(node, StepOutcome.TERMINAL_FAILURE, 0));
        assertEquals(node, router.afterRecovery(node));
    }

    @Test
    @DisplayName("rejects transitions that cannot happen")
    void rejectsImpossibleTransitions() {
        assertThrows(IllegalArgumentException.class,
                () -> router.next(WorkflowNode.INITIALIZE, StepOutcome.RETRYABLE_FAILURE, 0));
        assertThrows(IllegalArgumentException.class,
                () -> router.next(WorkflowNode.COMPLETE, StepOutcome.SUCCESS, 0));
        assertThrows(IllegalArgumentException.class,
                () -> router.afterRecovery(WorkflowNode.COMPLETE));
        assertThrows(IllegalArgumentException.class, () -> new WorkflowRouter(-1));
    }

    @Test
    @DisplayName("max retries 0 never routes to recovery")
    void zeroRetries() {
        var strict = new WorkflowRouter(0);
        assertEquals(WorkflowNode.COMPLETE, strict.next(WorkflowNode.RETRIEVAL, StepOutcome.RETRYABLE_FAILURE, 0));
    }

    @Test
    @DisplayName("node execution bound covers every retry of every working node")
    void maxNodeExecutions() {
        assertEquals(2 + 4 * 7, router.maxNodeExecutions());
    }
}
