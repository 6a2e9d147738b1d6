package com.sitedigest.core.engine;

import com.sitedigest.core.events.EventBus;
import com.sitedigest.core.events.PipelineEvent;
import com.sitedigest.core.graph.PipelineGraph;
import com.sitedigest.core.logging.MdcContext;
import com.sitedigest.core.metrics.PipelineMetrics;
import com.sitedigest.core.model.ScrapeResult;
import com.sitedigest.core.model.StepError;
import com.sitedigest.core.model.WorkflowNode;
import com.sitedigest.core.model.WorkflowStatus;
import com.sitedigest.core.state.WorkflowState;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Runs one pipeline execution for a seed URL on the compiled graph and hands
 * back the terminal state.
 * <p>
 * Never throws for a failed run: node failures are already folded into the
 * state by the graph, and anything that escapes the graph runtime itself is
 * converted into a {@link WorkflowStatus#FAILED} state.
 */
@Service
public class WorkflowEngine {

    private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

    private final PipelineGraph pipelineGraph;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    public WorkflowEngine(PipelineGraph pipelineGraph, EventBus eventBus, PipelineMetrics metrics) {
        this.pipelineGraph = pipelineGraph;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Executes the pipeline for {@code seedUrl}, blocking until it reaches
     * the terminal node.
     *
     * @param jobId   identifier used for logging, events and the persisted artifact
     * @param seedUrl page to start discovery from
     * @return the terminal state; {@code status} is COMPLETED or FAILED
     */
    public WorkflowState run(String jobId, String seedUrl) {
        MdcContext.setJob(jobId);
        long start = System.currentTimeMillis();
        try {
            log.info("Starting pipeline for {}", seedUrl);

            var input = new HashMap<String, Object>();
            input.put(WorkflowState.JOB_ID, jobId);
            input.put(WorkflowState.SEED_URL, seedUrl);

            var config = RunnableConfig.builder()
                    .threadId(jobId)
                    .build();

            WorkflowState state;
            try {
                state = pipelineGraph.getCompiledGraph()
                        .invoke(Map.copyOf(input), config)
                        .orElseGet(() -> failedState(jobId, seedUrl, "Graph execution returned empty state"));
            } catch (Exception e) {
                log.error("Pipeline execution aborted", e);
                state = failedState(jobId, seedUrl, "Pipeline execution aborted: " + rootCauseMessage(e));
            }

            if (!state.status().isTerminal()) {
                // Graph ended without passing through complete
                state = failedState(jobId, seedUrl, "Pipeline stopped before completion at " + state.currentStep());
            }

            long elapsed = System.currentTimeMillis() - start;
            metrics.recordJobResult(state.status().name());
            metrics.recordPagesRetrieved(state.scrapedContent().size());
            log.info("Pipeline for {} finished {} in {}s ({} summaries, {} error(s))",
                    seedUrl, state.status(), String.format("%.1f", elapsed / 1000.0),
                    state.formattedResults().size(), state.errors().size());
            return state;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Runs the pipeline inline under a fresh job id and returns its result.
     *
     * @throws ScrapeFailedException if the run failed or produced no summaries
     */
    public ScrapeResult runSync(String seedUrl) {
        String jobId = UUID.randomUUID().toString();
        WorkflowState state = run(jobId, seedUrl);
        if (state.status() == WorkflowStatus.FAILED) {
            String error = state.lastError().map(StepError::toString).orElse("Unknown error");
            throw new ScrapeFailedException("Scraping failed: " + error);
        }
        if (state.formattedResults().isEmpty()) {
            throw new ScrapeFailedException("Scraping completed but no data was returned");
        }
        return new ScrapeResult(state.seedUrl(), state.formattedResults());
    }

    private WorkflowState failedState(String jobId, String seedUrl, String message) {
        eventBus.publish(PipelineEvent.of("pipeline.aborted", jobId, null, Map.of("error", message)));
        return new WorkflowState(Map.of(
                WorkflowState.JOB_ID, jobId,
                WorkflowState.SEED_URL, seedUrl,
                WorkflowState.STATUS, WorkflowStatus.FAILED.name(),
                WorkflowState.CURRENT_STEP, WorkflowNode.INITIALIZE.name(),
                WorkflowState.ERRORS, List.of(StepError.now(WorkflowNode.COMPLETE, message))
        ));
    }

    private static String rootCauseMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
