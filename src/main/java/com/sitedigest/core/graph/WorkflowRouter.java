package com.sitedigest.core.graph;

import com.sitedigest.core.config.PipelineProperties;
import com.sitedigest.core.model.WorkflowNode;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Transition table of the pipeline: {@code (node, outcome, retryCount) -> nextNode}.
 * <p>
 * <pre>
 *   INITIALIZE -> DISCOVERY -> RETRIEVAL -> TRANSFORMATION -> PERSISTENCE -> COMPLETE
 *   any working node, retryable failure, retryCount &lt; maxRetries -> ERROR_RECOVERY
 *   any working node, terminal failure or retries exhausted       -> COMPLETE (failed)
 *   ERROR_RECOVERY -> the node that failed
 * </pre>
 * Pure: no state, no side effects, so the table can be tested without a graph.
 */
@Component
public class WorkflowRouter {

    private final int maxRetries;

    @Autowired
    public WorkflowRouter(PipelineProperties properties) {
        this(properties.getMaxRetries());
    }

    public WorkflowRouter(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0, was " + maxRetries);
        }
        this.maxRetries = maxRetries;
    }

    public int maxRetries() {
        return maxRetries;
    }

    /**
     * Next node after {@code node} finished with {@code outcome}.
     *
     * @param retryCount retries already spent on {@code node}
     * @throws IllegalArgumentException for outcomes a node cannot produce
     *         (a failure of INITIALIZE, anything leaving COMPLETE or ERROR_RECOVERY)
     */
    public WorkflowNode next(WorkflowNode node, StepOutcome outcome, int retryCount) {
        if (!node.isWorking()) {
            if (node == WorkflowNode.INITIALIZE && outcome == StepOutcome.SUCCESS) {
                return WorkflowNode.DISCOVERY;
            }
            throw new IllegalArgumentException("No transition from " + node + " on " + outcome);
        }
        return switch (outcome) {
            case SUCCESS -> successor(node);
            case RETRYABLE_FAILURE -> retryCount < maxRetries ? WorkflowNode.ERROR_RECOVERY : WorkflowNode.COMPLETE;
            case TERMINAL_FAILURE -> WorkflowNode.COMPLETE;
        };
    }

    /**
     * Error recovery always re-enters the node that failed.
     */
    public WorkflowNode afterRecovery(WorkflowNode failedNode) {
        if (!failedNode.isWorking()) {
            throw new IllegalArgumentException("Cannot recover into " + failedNode);
        }
        return failedNode;
    }

    /**
     * Upper bound on node executions for one run, used as the graph's recursion limit.
     */
    public int maxNodeExecutions() {
        // initialize + complete, plus per working node one attempt and
        // (recovery + re-entry) per retry
        return 2 + 4 * (1 + 2 * maxRetries);
    }

    private static WorkflowNode successor(WorkflowNode node) {
        return switch (node) {
            case DISCOVERY -> WorkflowNode.RETRIEVAL;
            case RETRIEVAL -> WorkflowNode.TRANSFORMATION;
            case TRANSFORMATION -> WorkflowNode.PERSISTENCE;
            case PERSISTENCE -> WorkflowNode.COMPLETE;
            default -> throw new IllegalArgumentException("No successor for " + node);
        };
    }
}
