package com.sitedigest.core.llm;

import com.sitedigest.core.capability.CapabilityException;
import com.sitedigest.core.capability.SummarizationClient;
import com.sitedigest.core.capability.SummaryParseException;
import com.sitedigest.core.config.PipelineProperties;
import com.sitedigest.core.model.PageSummary;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.stereotype.Service;
import org.springframework.web.client.ResourceAccessException;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * {@link SummarizationClient} backed by the chat model.
 * <p>
 * Each call is bounded by {@code sitedigest.pipeline.capability-timeout-seconds};
 * a call that overruns it is interrupted on a pool of {@code job-threads} workers.
 * Unreadable answers become {@link SummaryParseException} so only the one page
 * is skipped; timeouts and transient model errors are retryable.
 */
@Service
public class LlmSummarizationClient implements SummarizationClient {

    private static final Logger log = LoggerFactory.getLogger(LlmSummarizationClient.class);

    static final String SYSTEM_PROMPT = """
            You summarize web pages. Analyze the provided content and produce a structured summary.

            Rules:
            - "title": a short title summarizing the topic of the page.
            - "description": a two to three line summary of the first couple of paragraphs.
            - Use only information present in the content.
            - Return ONLY the JSON object, nothing else.
            """;

    private final LlmService llmService;
    private final long timeoutSeconds;
    private final ExecutorService executor;

    public LlmSummarizationClient(LlmService llmService, PipelineProperties properties) {
        this.llmService = llmService;
        this.timeoutSeconds = properties.getCapabilityTimeoutSeconds();
        // Jobs summarize one page at a time, so one worker per job thread is enough.
        var counter = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(Math.max(1, properties.getJobThreads()), r -> {
            Thread t = new Thread(r, "summarizer-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public PageSummary summarize(String text) {
        String userPrompt = "### Content:\n" + (text == null ? "" : text);
        Future<PageSummary> future = executor.submit(
                () -> llmService.structuredCall(SYSTEM_PROMPT, userPrompt, PageSummary.class));

        PageSummary summary;
        try {
            summary = future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (TimeoutException e) {
            // Interrupts the worker so it is free for the next page.
            future.cancel(true);
            throw CapabilityException.retryable("Summarization timed out after " + timeoutSeconds + "s", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw CapabilityException.retryable("Summarization interrupted", e);
        } catch (ExecutionException e) {
            throw translate(e.getCause() != null ? e.getCause() : e);
        }

        if (summary.title() == null || summary.title().isBlank()
                || summary.description() == null || summary.description().isBlank()) {
            throw new SummaryParseException("Summary is missing a title or description", null);
        }
        return summary;
    }

    private static RuntimeException translate(Throwable cause) {
        if (cause instanceof LlmParseException || cause instanceof LlmEmptyResponseException) {
            return new SummaryParseException(cause.getMessage(), cause);
        }
        if (cause instanceof TransientAiException || cause instanceof ResourceAccessException) {
            log.warn("Transient model error: {}", cause.getMessage());
            return CapabilityException.retryable("Model call failed: " + cause.getMessage(), cause);
        }
        return CapabilityException.terminal("Model call failed: " + cause.getMessage(), cause);
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
