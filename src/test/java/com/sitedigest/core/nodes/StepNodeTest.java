package com.sitedigest.core.nodes;

import com.sitedigest.core.events.EventBus;
import com.sitedigest.core.events.PipelineEvent;
import com.sitedigest.core.graph.WorkflowRouter;
import com.sitedigest.core.metrics.PipelineMetrics;
import com.sitedigest.core.model.StepError;
import com.sitedigest.core.model.WorkflowNode;
import com.sitedigest.core.model.WorkflowStatus;
import com.sitedigest.core.state.WorkflowState;
import com.sitedigest.core.steps.StepFailure;
import com.sitedigest.core.steps.StepResult;
import com.sitedigest.core.steps.WorkflowStep;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class StepNodeTest {

    private WorkflowStep step;
    private EventBus eventBus;
    private List<PipelineEvent> events;
    private StepNode node;

    @BeforeEach
    void setUp() throws StepFailure {
        step = mock(WorkflowStep.class);
        when(step.node()).thenReturn(WorkflowNode.RETRIEVAL);
        eventBus = new EventBus();
        events = new ArrayList<>();
        eventBus.subscribeAll(events::add);
        node = new StepNode(step, new WorkflowRouter(2), eventBus, new PipelineMetrics(new SimpleMeterRegistry()));
    }

    private static WorkflowState state(int retryCount) {
        return new WorkflowState(Map.of(
                WorkflowState.JOB_ID, "job-1",
                WorkflowState.RETRY_COUNT, retryCount));
    }

    @Test
    @DisplayName("success merges updates, appends skips and resets the retry count")
    void success() throws StepFailure {
        var skip = StepError.now(WorkflowNode.RETRIEVAL, "skipped one");
        when(step.execute(any())).thenReturn(new StepResult(
                Map.of(WorkflowState.SCRAPED_CONTENT, Map.of("u", "t")), List.of(skip)));

        var updates = node.apply(state(1));

        assertEquals(Map.of("u", "t"), updates.get(WorkflowState.SCRAPED_CONTENT));
        assertEquals(List.of(skip), updates.get(WorkflowState.ERRORS));
        assertEquals(0, updates.get(WorkflowState.RETRY_COUNT));
        assertEquals(WorkflowNode.TRANSFORMATION.name(), updates.get(WorkflowState.NEXT_NODE));
        assertEquals(WorkflowNode.RETRIEVAL.name(), updates.get(WorkflowState.CURRENT_STEP));
        assertEquals(List.of("step.started", "step.completed"),
                events.stream().map(PipelineEvent::eventType).toList());
    }

    @Test
    @DisplayName("a retryable failure within budget parks the error for recovery")
    void retryableWithinBudget() throws StepFailure {
        when(step.execute(any())).thenThrow(StepFailure.retryable(WorkflowNode.RETRIEVAL, "timeout"));

        var updates = node.apply(state(1));

        assertEquals(WorkflowNode.ERROR_RECOVERY.name(), updates.get(WorkflowState.NEXT_NODE));
        assertEquals(2, updates.get(WorkflowState.RETRY_COUNT));
        assertEquals("timeout", ((StepError) updates.get(WorkflowState.PENDING_FAILURE)).message());
        assertFalse(updates.containsKey(WorkflowState.ERRORS));
        assertFalse(updates.containsKey(WorkflowState.STATUS));
    }

    @Test
    @DisplayName("a retryable failure with no budget left fails the run")
    void retryableExhausted() throws StepFailure {
        when(step.execute(any())).thenThrow(StepFailure.retryable(WorkflowNode.RETRIEVAL, "timeout"));

        var updates = node.apply(state(2));

        assertEquals(WorkflowNode.COMPLETE.name(), updates.get(WorkflowState.NEXT_NODE));
        assertEquals(WorkflowStatus.FAILED.name(), updates.get(WorkflowState.STATUS));
        @SuppressWarnings("unchecked")
        var errors = (List<StepError>) updates.get(WorkflowState.ERRORS);
        assertEquals("[RETRIEVAL] timeout", errors.get(0).toString());
        assertTrue(events.stream().anyMatch(e -> e.eventType().equals("step.failed")));
    }

    @Test
    @DisplayName("partial updates of a failed step are kept")
    void keepsPartialUpdates() throws StepFailure {
        var partial = StepResult.of(Map.of(WorkflowState.SCRAPED_CONTENT, Map.of("a", "text")));
        when(step.execute(any())).thenThrow(
                new StepFailure(WorkflowNode.RETRIEVAL, "batch 2 failed", true, partial, null));

        var updates = node.apply(state(0));

        assertEquals(Map.of("a", "text"), updates.get(WorkflowState.SCRAPED_CONTENT));
    }

    @Test
    @DisplayName("an unexpected exception is recorded as a terminal failure")
    void unexpectedException() throws StepFailure {
        when(step.execute(any())).thenThrow(new IllegalStateException("boom"));

        var updates = node.apply(state(0));

        assertEquals(WorkflowNode.COMPLETE.name(), updates.get(WorkflowState.NEXT_NODE));
        assertEquals(WorkflowStatus.FAILED.name(), updates.get(WorkflowState.STATUS));
    }
}
