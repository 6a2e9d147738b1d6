package com.sitedigest.core.steps;

import com.sitedigest.core.model.WorkflowNode;
import com.sitedigest.core.state.WorkflowState;

/**
 * A working node of the pipeline wrapping one external capability.
 * <p>
 * Implementations read the state and return updates for the channels they own.
 * They never touch {@code errors}, {@code retryCount} or routing channels; the
 * engine does that after observing the outcome.
 */
public interface WorkflowStep {

    WorkflowNode node();

    /**
     * @throws StepFailure if the step cannot complete
     */
    StepResult execute(WorkflowState state) throws StepFailure;
}
