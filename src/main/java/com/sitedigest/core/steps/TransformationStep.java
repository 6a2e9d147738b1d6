package com.sitedigest.core.steps;

import com.sitedigest.core.capability.SummarizationClient;
import com.sitedigest.core.capability.SummaryParseException;
import com.sitedigest.core.config.PipelineProperties;
import com.sitedigest.core.model.FormattedResult;
import com.sitedigest.core.model.StepError;
import com.sitedigest.core.model.WorkflowNode;
import com.sitedigest.core.state.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;

/**
 * Summarizes every retrieved page that has no summary yet.
 * <p>
 * Pages are processed in discovery order. A page whose summary cannot be
 * parsed is skipped and reported; the step only fails when the run has no
 * summary at all after this pass, or when the model call itself fails.
 */
@Component
public class TransformationStep implements WorkflowStep {

    private static final Logger log = LoggerFactory.getLogger(TransformationStep.class);

    private final SummarizationClient summarizationClient;
    private final PipelineProperties properties;

    public TransformationStep(SummarizationClient summarizationClient, PipelineProperties properties) {
        this.summarizationClient = summarizationClient;
        this.properties = properties;
    }

    @Override
    public WorkflowNode node() {
        return WorkflowNode.TRANSFORMATION;
    }

    @Override
    public StepResult execute(WorkflowState state) throws StepFailure {
        var content = state.scrapedContent();
        var done = new HashSet<String>();
        state.formattedResults().forEach(r -> done.add(r.url()));

        List<String> pending = state.eligibleUrls().stream()
                .filter(content::containsKey)
                .filter(url -> !done.contains(url))
                .toList();
        if (pending.isEmpty()) {
            log.info("No pages waiting for summarization");
            return StepResult.empty();
        }

        var formatted = new ArrayList<FormattedResult>();
        var skipped = new ArrayList<StepError>();
        for (String url : pending) {
            String text = truncate(content.get(url));
            try {
                var summary = summarizationClient.summarize(text);
                formatted.add(new FormattedResult(url, summary));
                log.debug("Summarized {}", url);
            } catch (SummaryParseException e) {
                log.warn("Skipping {}: {}", url, e.getMessage());
                skipped.add(StepError.now(node(), "Skipped " + url + ": " + e.getMessage()));
            } catch (RuntimeException e) {
                throw StepFailure.from(node(), e, partial(formatted, skipped));
            }
        }

        // Summaries kept from an earlier attempt still make this a partial success.
        if (formatted.isEmpty() && state.formattedResults().isEmpty()) {
            throw new StepFailure(node(),
                    "Summarization failed for all " + pending.size() + " pending page(s)",
                    false, partial(formatted, skipped), null);
        }
        log.info("Summarized {} page(s), skipped {}", formatted.size(), skipped.size());
        return partial(formatted, skipped);
    }

    private static StepResult partial(List<FormattedResult> formatted, List<StepError> skipped) {
        Map<String, Object> updates = formatted.isEmpty()
                ? Map.of()
                : Map.of(WorkflowState.FORMATTED_RESULTS, List.copyOf(formatted));
        return new StepResult(updates, skipped);
    }

    private String truncate(String text) {
        int limit = properties.getContentCharLimit();
        if (text == null) {
            return "";
        }
        return limit > 0 && text.length() > limit ? text.substring(0, limit) : text;
    }
}
