package com.sitedigest.core.steps;

import com.sitedigest.core.capability.ContentRetrievalClient;
import com.sitedigest.core.config.PipelineProperties;
import com.sitedigest.core.model.WorkflowNode;
import com.sitedigest.core.scheduler.BatchScheduler;
import com.sitedigest.core.state.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Retrieves page content for the eligible URLs, one provider call per batch.
 * <p>
 * Batches run sequentially and in order. URLs that already have content are
 * not planned again, so a retry after a failed batch resumes with that batch.
 * A batch that yields no usable text is not a failure.
 */
@Component
public class RetrievalStep implements WorkflowStep {

    private static final Logger log = LoggerFactory.getLogger(RetrievalStep.class);

    private final ContentRetrievalClient retrievalClient;
    private final BatchScheduler batchScheduler;
    private final PipelineProperties properties;

    public RetrievalStep(ContentRetrievalClient retrievalClient, BatchScheduler batchScheduler,
                         PipelineProperties properties) {
        this.retrievalClient = retrievalClient;
        this.batchScheduler = batchScheduler;
        this.properties = properties;
    }

    @Override
    public WorkflowNode node() {
        return WorkflowNode.RETRIEVAL;
    }

    @Override
    public StepResult execute(WorkflowState state) throws StepFailure {
        var scraped = new LinkedHashMap<>(state.scrapedContent());
        List<String> remaining = state.eligibleUrls().stream()
                .filter(url -> !scraped.containsKey(url))
                .toList();
        if (remaining.isEmpty()) {
            log.info("Nothing to retrieve ({} URL(s) already retrieved)", scraped.size());
            return StepResult.of(Map.of(WorkflowState.SCRAPED_CONTENT, scraped));
        }

        var batches = batchScheduler.plan(remaining, properties.getUrlLimit(), properties.getBatchLimit());
        for (int i = 0; i < batches.size(); i++) {
            var batch = batches.get(i);
            log.info("Retrieving batch {}/{} ({} URL(s))", i + 1, batches.size(), batch.size());
            Map<String, String> content;
            try {
                content = retrievalClient.retrieveContent(batch);
            } catch (RuntimeException e) {
                log.warn("Batch {}/{} failed: {}", i + 1, batches.size(), e.getMessage());
                throw StepFailure.from(node(), e,
                        StepResult.of(Map.of(WorkflowState.SCRAPED_CONTENT, Map.copyOf(scraped))));
            }
            int merged = merge(batch, content, scraped);
            if (merged == 0) {
                log.warn("Batch {}/{} returned no usable content", i + 1, batches.size());
            } else {
                log.debug("Batch {}/{} merged {} page(s)", i + 1, batches.size(), merged);
            }
        }

        log.info("Retrieved content for {} of {} eligible URL(s)", scraped.size(), state.eligibleUrls().size());
        return StepResult.of(Map.of(WorkflowState.SCRAPED_CONTENT, scraped));
    }

    /**
     * Merges the provider's answer, ignoring URLs that were not requested in
     * this batch and pages without text.
     */
    private static int merge(List<String> batch, Map<String, String> content, Map<String, String> scraped) {
        if (content == null || content.isEmpty()) {
            return 0;
        }
        var requested = new HashSet<>(batch);
        int merged = 0;
        for (var entry : content.entrySet()) {
            if (!requested.contains(entry.getKey())) {
                log.debug("Ignoring unrequested URL {} in batch response", entry.getKey());
                continue;
            }
            if (entry.getValue() == null || entry.getValue().isBlank()) {
                continue;
            }
            scraped.put(entry.getKey(), entry.getValue());
            merged++;
        }
        return merged;
    }
}
