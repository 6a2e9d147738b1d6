package com.sitedigest.core.steps;

import com.sitedigest.core.capability.ResultSink;
import com.sitedigest.core.model.ScrapeResult;
import com.sitedigest.core.model.WorkflowNode;
import com.sitedigest.core.state.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Hands the summaries and source URL to the configured {@link ResultSink}.
 */
@Component
public class PersistenceStep implements WorkflowStep {

    private static final Logger log = LoggerFactory.getLogger(PersistenceStep.class);

    private final ResultSink resultSink;

    public PersistenceStep(ResultSink resultSink) {
        this.resultSink = resultSink;
    }

    @Override
    public WorkflowNode node() {
        return WorkflowNode.PERSISTENCE;
    }

    @Override
    public StepResult execute(WorkflowState state) throws StepFailure {
        var result = new ScrapeResult(state.seedUrl(), state.formattedResults());
        try {
            resultSink.persist(state.jobId(), result);
        } catch (RuntimeException e) {
            throw StepFailure.from(node(), e, null);
        }
        log.info("Persisted {} summar{} for {}", result.data().size(),
                result.data().size() == 1 ? "y" : "ies", result.sourceUrl());
        return StepResult.empty();
    }
}
