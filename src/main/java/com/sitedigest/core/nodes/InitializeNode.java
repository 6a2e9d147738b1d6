package com.sitedigest.core.nodes;

import com.sitedigest.core.graph.StepOutcome;
import com.sitedigest.core.graph.WorkflowRouter;
import com.sitedigest.core.model.WorkflowNode;
import com.sitedigest.core.model.WorkflowStatus;
import com.sitedigest.core.state.WorkflowState;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Entry node: puts a freshly seeded state into its running shape.
 * Pure state construction, it cannot fail.
 */
@Component
public class InitializeNode {

    private final WorkflowRouter router;

    public InitializeNode(WorkflowRouter router) {
        this.router = router;
    }

    public Map<String, Object> apply(WorkflowState state) {
        return Map.of(
                WorkflowState.STATUS, WorkflowStatus.RUNNING.name(),
                WorkflowState.RETRY_COUNT, 0,
                WorkflowState.CURRENT_STEP, WorkflowNode.INITIALIZE.name(),
                WorkflowState.NEXT_NODE, router.next(WorkflowNode.INITIALIZE, StepOutcome.SUCCESS, 0).name()
        );
    }
}
