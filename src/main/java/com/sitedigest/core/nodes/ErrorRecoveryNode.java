package com.sitedigest.core.nodes;

import com.sitedigest.core.config.PipelineProperties;
import com.sitedigest.core.events.EventBus;
import com.sitedigest.core.events.PipelineEvent;
import com.sitedigest.core.graph.WorkflowRouter;
import com.sitedigest.core.metrics.PipelineMetrics;
import com.sitedigest.core.model.StepError;
import com.sitedigest.core.model.WorkflowNode;
import com.sitedigest.core.state.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Records the failure parked by the failing node, waits
 * {@code backoffMillis * retryCount}, and routes back into the node that failed.
 */
@Component
public class ErrorRecoveryNode {

    private static final Logger log = LoggerFactory.getLogger(ErrorRecoveryNode.class);

    /** Blocking delay, replaceable in tests. */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final WorkflowRouter router;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;
    private final long backoffMillis;
    private final Sleeper sleeper;

    @Autowired
    public ErrorRecoveryNode(WorkflowRouter router, EventBus eventBus, PipelineMetrics metrics,
                             PipelineProperties properties) {
        this(router, eventBus, metrics, properties.getBackoffMillis(), Thread::sleep);
    }

    public ErrorRecoveryNode(WorkflowRouter router, EventBus eventBus, PipelineMetrics metrics,
                             long backoffMillis, Sleeper sleeper) {
        this.router = router;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.backoffMillis = backoffMillis;
        this.sleeper = sleeper;
    }

    public Map<String, Object> apply(WorkflowState state) {
        WorkflowNode failed = state.currentStep();
        int retryCount = state.retryCount();
        StepError error = state.pendingFailure()
                .orElseGet(() -> StepError.now(failed, "unknown failure"));

        long delay = backoffMillis * retryCount;
        log.info("Retrying {} in {} ms (retry {} of {}): {}",
                failed, delay, retryCount, router.maxRetries(), error.message());
        metrics.recordRetry(failed.name());
        eventBus.publish(PipelineEvent.of("step.retrying", state.jobId(), failed.name(),
                Map.of("retryCount", retryCount, "delayMs", delay, "error", error.message())));

        if (delay > 0) {
            try {
                sleeper.sleep(delay);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Backoff before retrying {} was interrupted; retrying immediately", failed);
            }
        }

        var updates = new HashMap<String, Object>();
        updates.put(WorkflowState.ERRORS, List.of(error));
        updates.put(WorkflowState.NEXT_NODE, router.afterRecovery(failed).name());
        return updates;
    }
}
