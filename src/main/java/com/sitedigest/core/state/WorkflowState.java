package com.sitedigest.core.state;

import com.sitedigest.core.model.FormattedResult;
import com.sitedigest.core.model.StepError;
import com.sitedigest.core.model.WorkflowNode;
import com.sitedigest.core.model.WorkflowStatus;
import org.bsc.langgraph4j.state.AgentState;
import org.bsc.langgraph4j.state.Channel;
import org.bsc.langgraph4j.state.Channels;
import org.bsc.langgraph4j.state.Reducer;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Graph state threaded through the content pipeline.
 * <p>
 * Extends LangGraph4j's {@link AgentState} with typed accessors. Nodes never
 * mutate this object; they return partial update maps which the graph runtime
 * merges through the channels declared in {@link #SCHEMA}. {@code formattedResults}
 * and {@code errors} use appender channels so entries accumulate across nodes
 * and retries.
 */
public class WorkflowState extends AgentState {

    public static final String JOB_ID = "jobId";
    public static final String SEED_URL = "seedUrl";
    public static final String STATUS = "status";
    public static final String CURRENT_STEP = "currentStep";
    public static final String NEXT_NODE = "nextNode";
    public static final String RETRY_COUNT = "retryCount";
    public static final String PENDING_FAILURE = "pendingFailure";
    public static final String DISCOVERED_URLS = "discoveredUrls";
    public static final String ELIGIBLE_URLS = "eligibleUrls";
    public static final String SCRAPED_CONTENT = "scrapedContent";
    public static final String FORMATTED_RESULTS = "formattedResults";
    public static final String ERRORS = "errors";

    public static final Map<String, Channel<?>> SCHEMA = Map.ofEntries(
        // ── Scalar channels ──────────────────────────────────────────
        Map.entry(JOB_ID,          Channels.base(() -> "")),
        Map.entry(SEED_URL,        Channels.base(() -> "")),
        Map.entry(STATUS,          Channels.base(() -> WorkflowStatus.RUNNING.name())),
        Map.entry(CURRENT_STEP,    Channels.base(() -> WorkflowNode.INITIALIZE.name())),
        Map.entry(NEXT_NODE,       Channels.base(() -> WorkflowNode.DISCOVERY.name())),
        Map.entry(RETRY_COUNT,     Channels.base(() -> 0)),
        Map.entry(PENDING_FAILURE, Channels.base((Reducer<StepError>) null)),

        // ── Collections replaced wholesale by their owning step ──────
        Map.entry(DISCOVERED_URLS, Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(ELIGIBLE_URLS,   Channels.base((Supplier<List<String>>) List::of)),
        Map.entry(SCRAPED_CONTENT, Channels.base((Supplier<Map<String, String>>) Map::of)),

        // ── Appender channels ────────────────────────────────────────
        Map.entry(FORMATTED_RESULTS, Channels.appender(ArrayList::new)),
        Map.entry(ERRORS,            Channels.appender(ArrayList::new))
    );

    public WorkflowState(Map<String, Object> initData) {
        super(initData);
    }

    public String jobId() {
        return this.<String>value(JOB_ID).orElse("");
    }

    public String seedUrl() {
        return this.<String>value(SEED_URL).orElse("");
    }

    public WorkflowStatus status() {
        String raw = this.<String>value(STATUS).orElse(WorkflowStatus.RUNNING.name());
        return WorkflowStatus.valueOf(raw);
    }

    public WorkflowNode currentStep() {
        String raw = this.<String>value(CURRENT_STEP).orElse(WorkflowNode.INITIALIZE.name());
        return WorkflowNode.valueOf(raw);
    }

    /** Routing decision written by the last executed node. */
    public WorkflowNode nextNode() {
        String raw = this.<String>value(NEXT_NODE).orElse(WorkflowNode.DISCOVERY.name());
        return WorkflowNode.valueOf(raw);
    }

    public int retryCount() {
        return this.<Number>value(RETRY_COUNT).map(Number::intValue).orElse(0);
    }

    /** Failure waiting to be recorded by the error recovery node. */
    public Optional<StepError> pendingFailure() {
        return value(PENDING_FAILURE);
    }

    /** Discovered links with set semantics; iteration follows discovery order. */
    public Set<String> discoveredUrls() {
        return new LinkedHashSet<>(this.<List<String>>value(DISCOVERED_URLS).orElse(List.of()));
    }

    public List<String> eligibleUrls() {
        return this.<List<String>>value(ELIGIBLE_URLS).orElse(List.of());
    }

    public Map<String, String> scrapedContent() {
        return this.<Map<String, String>>value(SCRAPED_CONTENT).orElse(Map.of());
    }

    public List<FormattedResult> formattedResults() {
        return this.<List<FormattedResult>>value(FORMATTED_RESULTS).orElse(List.of());
    }

    public List<StepError> errors() {
        return this.<List<StepError>>value(ERRORS).orElse(List.of());
    }

    /** The most recent error, used as the job's failure message. */
    public Optional<StepError> lastError() {
        var errors = errors();
        return errors.isEmpty() ? Optional.empty() : Optional.of(errors.get(errors.size() - 1));
    }
}
