package com.sitedigest.core.nodes;

import com.sitedigest.core.events.EventBus;
import com.sitedigest.core.events.PipelineEvent;
import com.sitedigest.core.model.WorkflowNode;
import com.sitedigest.core.model.WorkflowStatus;
import com.sitedigest.core.state.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Terminal node reached on both success and give-up failure.
 * A run that arrives here still {@code RUNNING} has succeeded.
 */
@Component
public class CompleteNode {

    private static final Logger log = LoggerFactory.getLogger(CompleteNode.class);

    private final EventBus eventBus;

    public CompleteNode(EventBus eventBus) {
        this.eventBus = eventBus;
    }

    public Map<String, Object> apply(WorkflowState state) {
        WorkflowStatus finalStatus = state.status() == WorkflowStatus.FAILED
                ? WorkflowStatus.FAILED
                : WorkflowStatus.COMPLETED;

        if (finalStatus == WorkflowStatus.COMPLETED) {
            log.info("Pipeline complete: {} eligible, {} retrieved, {} summarized, {} error(s) recorded",
                    state.eligibleUrls().size(), state.scrapedContent().size(),
                    state.formattedResults().size(), state.errors().size());
        } else {
            log.info("Pipeline failed at {}: {} summarized before failure, {} error(s) recorded",
                    state.currentStep(), state.formattedResults().size(), state.errors().size());
        }

        var payload = new HashMap<String, Object>();
        payload.put("status", finalStatus.name());
        payload.put("summaries", state.formattedResults().size());
        payload.put("errors", state.errors().size());
        eventBus.publish(PipelineEvent.of("pipeline.finished", state.jobId(), WorkflowNode.COMPLETE.name(), payload));

        return Map.of(
                WorkflowState.STATUS, finalStatus.name(),
                WorkflowState.NEXT_NODE, WorkflowNode.COMPLETE.name()
        );
    }
}
