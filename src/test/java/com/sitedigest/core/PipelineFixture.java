package com.sitedigest.core;

import com.sitedigest.core.capability.ContentRetrievalClient;
import com.sitedigest.core.capability.LinkDiscoveryClient;
import com.sitedigest.core.capability.ResultSink;
import com.sitedigest.core.capability.SummarizationClient;
import com.sitedigest.core.config.PipelineProperties;
import com.sitedigest.core.engine.WorkflowEngine;
import com.sitedigest.core.events.EventBus;
import com.sitedigest.core.events.PipelineEvent;
import com.sitedigest.core.filter.UrlFilter;
import com.sitedigest.core.graph.PipelineGraph;
import com.sitedigest.core.graph.WorkflowRouter;
import com.sitedigest.core.metrics.PipelineMetrics;
import com.sitedigest.core.model.PageSummary;
import com.sitedigest.core.model.ScrapeResult;
import com.sitedigest.core.nodes.CompleteNode;
import com.sitedigest.core.nodes.ErrorRecoveryNode;
import com.sitedigest.core.nodes.InitializeNode;
import com.sitedigest.core.scheduler.BatchScheduler;
import com.sitedigest.core.steps.DiscoveryStep;
import com.sitedigest.core.steps.PersistenceStep;
import com.sitedigest.core.steps.RetrievalStep;
import com.sitedigest.core.steps.TransformationStep;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

/**
 * Real pipeline graph wired to in-memory capabilities, for engine-level tests.
 * Backoff sleeps are recorded instead of performed.
 */
public class PipelineFixture {

    public final PipelineProperties properties = new PipelineProperties();
    public final EventBus eventBus = new EventBus();
    public final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    public final PipelineMetrics metrics = new PipelineMetrics(meterRegistry);
    public final List<PipelineEvent> events = new CopyOnWriteArrayList<>();
    public final List<Long> sleeps = new CopyOnWriteArrayList<>();
    public final List<List<String>> retrievalCalls = new CopyOnWriteArrayList<>();
    public final Map<String, ScrapeResult> persisted = new ConcurrentHashMap<>();

    public LinkDiscoveryClient discovery = seed -> new LinkedHashSet<>();
    public ContentRetrievalClient retrieval = batch -> batch.stream()
            .collect(Collectors.toMap(url -> url, url -> "Content of " + url));
    public SummarizationClient summarizer = text -> new PageSummary("Title", "Summary of " + text);
    public ResultSink sink = (jobId, result) -> persisted.put(jobId, result);

    public PipelineFixture() {
        properties.setBackoffMillis(10);
        eventBus.subscribeAll(events::add);
    }

    public WorkflowEngine engine() throws Exception {
        var router = new WorkflowRouter(properties);
        var scheduler = new BatchScheduler();
        ContentRetrievalClient recordingRetrieval = batch -> {
            retrievalCalls.add(List.copyOf(batch));
            return retrieval.retrieveContent(batch);
        };
        var graph = new PipelineGraph(
                new InitializeNode(router),
                new DiscoveryStep(seed -> discovery.discoverLinks(seed), new UrlFilter(properties), scheduler, properties),
                new RetrievalStep(recordingRetrieval, scheduler, properties),
                new TransformationStep(text -> summarizer.summarize(text), properties),
                new PersistenceStep((jobId, result) -> sink.persist(jobId, result)),
                new ErrorRecoveryNode(router, eventBus, metrics, properties.getBackoffMillis(), sleeps::add),
                new CompleteNode(eventBus),
                router,
                eventBus,
                metrics);
        return new WorkflowEngine(graph, eventBus, metrics);
    }

    public List<PipelineEvent> eventsOfType(String type) {
        var matching = new ArrayList<PipelineEvent>();
        for (var event : events) {
            if (event.eventType().equals(type)) {
                matching.add(event);
            }
        }
        return matching;
    }
}
