package com.sitedigest.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.sitedigest.core.engine.WorkflowEngine;
import com.sitedigest.core.events.EventBus;
import com.sitedigest.core.model.FormattedResult;
import com.sitedigest.core.model.ScrapeResult;
import com.sitedigest.core.model.WorkflowStatus;
import com.sitedigest.core.state.WorkflowState;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;

/**
 * CLI command: sitedigest scrape &lt;url&gt;
 * <p>
 * Runs the pipeline in the foreground and prints one summary per page.
 * Exits with 1 when the run fails.
 */
@Command(name = "scrape", mixinStandardHelpOptions = true,
        description = "Discover, retrieve and summarize the pages linked from a URL")
@Component
public class ScrapeCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Seed URL to start from")
    private String url;

    @Option(names = "--json", description = "Print the result as JSON instead of text")
    private boolean json;

    @Option(names = {"--verbose", "-v"}, description = "Show step progress and list skipped pages and retried failures")
    private boolean verbose;

    private final WorkflowEngine workflowEngine;
    private final EventBus eventBus;

    public ScrapeCommand(WorkflowEngine workflowEngine, EventBus eventBus) {
        this.workflowEngine = workflowEngine;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        if (!json) {
            ConsoleOutput.printBanner();
            ConsoleOutput.info("Scraping " + url + "...");
        }

        String jobId = UUID.randomUUID().toString();
        EventBus.Subscription progress = verbose && !json
                ? eventBus.subscribe(jobId, ConsoleOutput::progress)
                : null;
        long start = System.currentTimeMillis();
        WorkflowState state;
        try {
            state = workflowEngine.run(jobId, url);
        } finally {
            if (progress != null) {
                progress.unsubscribe();
            }
        }
        long elapsed = System.currentTimeMillis() - start;

        if (state.status() == WorkflowStatus.FAILED) {
            ConsoleOutput.error("Scrape failed: " + state.lastError()
                    .map(Object::toString)
                    .orElse("Unknown error"));
            if (verbose) {
                state.errors().forEach(ConsoleOutput::stepError);
            }
            return 1;
        }

        List<FormattedResult> results = state.formattedResults();
        if (json) {
            System.out.println(toJson(new ScrapeResult(state.seedUrl(), results)));
            return 0;
        }

        System.out.println();
        for (int i = 0; i < results.size(); i++) {
            ConsoleOutput.summary(i + 1, results.get(i));
        }
        ConsoleOutput.success(String.format("%d page(s) summarized from %d discovered link(s) in %s (job %s)",
                results.size(), state.discoveredUrls().size(),
                ConsoleOutput.formatDuration(elapsed), jobId));
        if (!state.errors().isEmpty()) {
            ConsoleOutput.info(state.errors().size() + " issue(s) recorded"
                    + (verbose ? ":" : " (use --verbose to list them)"));
            if (verbose) {
                state.errors().forEach(ConsoleOutput::stepError);
            }
        }
        return 0;
    }

    private static String toJson(ScrapeResult result) {
        try {
            return new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT).writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not render result as JSON", e);
        }
    }
}
