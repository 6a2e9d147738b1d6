package com.sitedigest.core.steps;

import com.sitedigest.core.capability.LinkDiscoveryClient;
import com.sitedigest.core.config.PipelineProperties;
import com.sitedigest.core.filter.UrlFilter;
import com.sitedigest.core.model.WorkflowNode;
import com.sitedigest.core.scheduler.BatchScheduler;
import com.sitedigest.core.state.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Discovers links on the seed page, then filters and caps them into the
 * ordered list of URLs the rest of the pipeline works on.
 */
@Component
public class DiscoveryStep implements WorkflowStep {

    private static final Logger log = LoggerFactory.getLogger(DiscoveryStep.class);

    private final LinkDiscoveryClient discoveryClient;
    private final UrlFilter urlFilter;
    private final BatchScheduler batchScheduler;
    private final PipelineProperties properties;

    public DiscoveryStep(LinkDiscoveryClient discoveryClient, UrlFilter urlFilter,
                         BatchScheduler batchScheduler, PipelineProperties properties) {
        this.discoveryClient = discoveryClient;
        this.urlFilter = urlFilter;
        this.batchScheduler = batchScheduler;
        this.properties = properties;
    }

    @Override
    public WorkflowNode node() {
        return WorkflowNode.DISCOVERY;
    }

    @Override
    public StepResult execute(WorkflowState state) throws StepFailure {
        String seedUrl = state.seedUrl();
        var origin = UrlFilter.resolve(seedUrl, null);
        if (origin.isEmpty()) {
            throw StepFailure.terminal(node(), "Seed URL is not an absolute http(s) URL: " + seedUrl);
        }

        Set<String> links;
        try {
            links = discoveryClient.discoverLinks(seedUrl);
        } catch (RuntimeException e) {
            throw StepFailure.from(node(), e, null);
        }
        if (links == null) {
            links = Set.of();
        }
        log.info("Discovered {} link(s) on {}", links.size(), seedUrl);

        // Store absolute forms so every eligible URL is also a discovered URL
        var discovered = new LinkedHashSet<String>();
        for (String link : links) {
            if (link == null) {
                continue;
            }
            discovered.add(UrlFilter.resolve(link, origin.get()).map(URI::toString).orElse(link.trim()));
        }

        var filtered = urlFilter.select(discovered, seedUrl);
        // No batching at this stage: a single "batch" as large as the cap
        var plan = batchScheduler.plan(filtered, properties.getUrlLimit(), properties.getUrlLimit());
        var eligible = new ArrayList<String>();
        plan.forEach(eligible::addAll);
        log.info("{} of {} link(s) eligible after filtering, {} kept under url-limit {}",
                filtered.size(), discovered.size(), eligible.size(), properties.getUrlLimit());

        return StepResult.of(Map.of(
                WorkflowState.DISCOVERED_URLS, new ArrayList<>(discovered),
                WorkflowState.ELIGIBLE_URLS, eligible
        ));
    }
}
