package com.sitedigest.core.nodes;

import com.sitedigest.core.events.EventBus;
import com.sitedigest.core.events.PipelineEvent;
import com.sitedigest.core.graph.StepOutcome;
import com.sitedigest.core.graph.WorkflowRouter;
import com.sitedigest.core.logging.MdcContext;
import com.sitedigest.core.metrics.PipelineMetrics;
import com.sitedigest.core.model.StepError;
import com.sitedigest.core.model.WorkflowNode;
import com.sitedigest.core.model.WorkflowStatus;
import com.sitedigest.core.state.WorkflowState;
import com.sitedigest.core.steps.StepFailure;
import com.sitedigest.core.steps.StepResult;
import com.sitedigest.core.steps.WorkflowStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * LangGraph4j node that runs one {@link WorkflowStep} and applies the
 * engine's bookkeeping to its outcome.
 * <p>
 * On success the step's updates are merged, per-item skips are appended to
 * {@code errors}, {@code retryCount} is reset and the router picks the next
 * node. On failure any partial updates are kept; a retryable failure within
 * budget bumps {@code retryCount} and parks the error for
 * {@link ErrorRecoveryNode}, anything else is recorded and marks the run
 * failed.
 */
public class StepNode {

    private static final Logger log = LoggerFactory.getLogger(StepNode.class);

    private final WorkflowStep step;
    private final WorkflowRouter router;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    public StepNode(WorkflowStep step, WorkflowRouter router, EventBus eventBus, PipelineMetrics metrics) {
        this.step = step;
        this.router = router;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    public WorkflowNode node() {
        return step.node();
    }

    public Map<String, Object> apply(WorkflowState state) {
        WorkflowNode node = step.node();
        int retryCount = state.retryCount();
        MdcContext.setStep(state.jobId(), node);
        log.info("Entering {} (retryCount={})", node, retryCount);
        eventBus.publish(PipelineEvent.of("step.started", state.jobId(), node.name(),
                Map.of("retryCount", retryCount)));
        long start = System.currentTimeMillis();
        try {
            StepResult result = step.execute(state);
            long elapsed = System.currentTimeMillis() - start;

            var updates = new HashMap<String, Object>(result.updates());
            appendErrors(updates, result.skipped());
            updates.put(WorkflowState.RETRY_COUNT, 0);
            updates.put(WorkflowState.CURRENT_STEP, node.name());
            updates.put(WorkflowState.NEXT_NODE, router.next(node, StepOutcome.SUCCESS, retryCount).name());

            metrics.recordStepExecution(node.name(), "success", elapsed);
            metrics.recordSkippedItems(node.name(), result.skipped().size());
            eventBus.publish(PipelineEvent.of("step.completed", state.jobId(), node.name(),
                    Map.of("elapsedMs", elapsed, "skipped", result.skipped().size())));
            return updates;
        } catch (StepFailure failure) {
            return onFailure(state, node, retryCount, failure, System.currentTimeMillis() - start);
        } catch (RuntimeException e) {
            log.error("{} threw unexpectedly", node, e);
            return onFailure(state, node, retryCount, StepFailure.from(node, e, null),
                    System.currentTimeMillis() - start);
        } finally {
            MdcContext.clearStep();
        }
    }

    private Map<String, Object> onFailure(WorkflowState state, WorkflowNode node, int retryCount,
                                          StepFailure failure, long elapsed) {
        var outcome = failure.isRetryable() ? StepOutcome.RETRYABLE_FAILURE : StepOutcome.TERMINAL_FAILURE;
        WorkflowNode next = router.next(node, outcome, retryCount);
        StepError error = StepError.now(node, failure.getMessage());

        var updates = new HashMap<String, Object>(failure.partial().updates());
        var errors = new ArrayList<>(failure.partial().skipped());
        updates.put(WorkflowState.CURRENT_STEP, node.name());
        updates.put(WorkflowState.NEXT_NODE, next.name());

        if (next == WorkflowNode.ERROR_RECOVERY) {
            log.warn("{} failed (retryable, attempt {} of {}): {}",
                    node, retryCount + 1, router.maxRetries() + 1, failure.getMessage());
            updates.put(WorkflowState.RETRY_COUNT, retryCount + 1);
            updates.put(WorkflowState.PENDING_FAILURE, error);
            metrics.recordStepExecution(node.name(), "retry", elapsed);
        } else {
            log.error("{} failed{}: {}", node,
                    failure.isRetryable() ? " after " + retryCount + " retries" : " (terminal)",
                    failure.getMessage());
            errors.add(error);
            updates.put(WorkflowState.STATUS, WorkflowStatus.FAILED.name());
            metrics.recordStepExecution(node.name(), "failed", elapsed);
            eventBus.publish(PipelineEvent.of("step.failed", state.jobId(), node.name(),
                    Map.of("error", error.message(), "retryable", failure.isRetryable())));
        }
        metrics.recordSkippedItems(node.name(), failure.partial().skipped().size());
        appendErrors(updates, errors);
        return updates;
    }

    private static void appendErrors(Map<String, Object> updates, List<StepError> errors) {
        if (!errors.isEmpty()) {
            updates.put(WorkflowState.ERRORS, List.copyOf(errors));
        }
    }
}
