package com.sitedigest.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline execution.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordJobResult(String status) {
        Counter.builder("sitedigest.jobs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    /**
     * @param outcome "success", "retry" or "failed"
     */
    public void recordStepExecution(String step, String outcome, long ms) {
        Timer.builder("sitedigest.step.duration")
                .tag("step", step)
                .tag("outcome", outcome)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordRetry(String step) {
        Counter.builder("sitedigest.step.retries")
                .description("Automatic retries scheduled through error recovery")
                .tag("step", step)
                .register(registry)
                .increment();
    }

    public void recordSkippedItems(String step, int count) {
        if (count <= 0) return;
        Counter.builder("sitedigest.items.skipped")
                .description("Per-page problems that did not fail their step")
                .tag("step", step)
                .register(registry)
                .increment(count);
    }

    public void recordPagesRetrieved(int count) {
        DistributionSummary.builder("sitedigest.pages.retrieved")
                .description("Pages with content per job")
                .register(registry)
                .record(count);
    }
}
