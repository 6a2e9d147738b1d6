package com.sitedigest.core.llm;

import com.sitedigest.core.capability.CapabilityException;
import com.sitedigest.core.capability.SummaryParseException;
import com.sitedigest.core.config.PipelineProperties;
import com.sitedigest.core.model.PageSummary;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.retry.TransientAiException;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class LlmSummarizationClientTest {

    private LlmService llm;
    private LlmSummarizationClient client;

    @BeforeEach
    void setUp() {
        llm = mock(LlmService.class);
        var properties = new PipelineProperties();
        properties.setCapabilityTimeoutSeconds(1);
        client = new LlmSummarizationClient(llm, properties);
    }

    @AfterEach
    void tearDown() {
        client.shutdown();
    }

    @Test
    @DisplayName("sends the page text under a content heading with the summarization prompt")
    void summarizes() {
        when(llm.structuredCall(anyString(), anyString(), eq(PageSummary.class)))
                .thenReturn(new PageSummary("About", "Who we are."));

        var summary = client.summarize("We build tools.");

        assertEquals(new PageSummary("About", "Who we are."), summary);
        verify(llm).structuredCall(LlmSummarizationClient.SYSTEM_PROMPT,
                "### Content:\nWe build tools.", PageSummary.class);
    }

    @Test
    @DisplayName("unparsable and empty answers skip the page")
    void parseFailures() {
        when(llm.structuredCall(anyString(), anyString(), eq(PageSummary.class)))
                .thenThrow(new LlmParseException("Failed to parse"));
        assertThrows(SummaryParseException.class, () -> client.summarize("text"));

        reset(llm);
        when(llm.structuredCall(anyString(), anyString(), eq(PageSummary.class)))
                .thenThrow(new LlmEmptyResponseException("empty"));
        assertThrows(SummaryParseException.class, () -> client.summarize("text"));
    }

    @Test
    @DisplayName("a summary without a description skips the page")
    void blankFields() {
        when(llm.structuredCall(anyString(), anyString(), eq(PageSummary.class)))
                .thenReturn(new PageSummary("Title", " "));

        assertThrows(SummaryParseException.class, () -> client.summarize("text"));
    }

    @Test
    @DisplayName("transient model errors are retryable, others terminal")
    void classifiesModelErrors() {
        when(llm.structuredCall(anyString(), anyString(), eq(PageSummary.class)))
                .thenThrow(new TransientAiException("503 from provider"));
        var transientFailure = assertThrows(CapabilityException.class, () -> client.summarize("text"));
        assertTrue(transientFailure.isRetryable());
        assertFalse(transientFailure instanceof SummaryParseException);

        reset(llm);
        when(llm.structuredCall(anyString(), anyString(), eq(PageSummary.class)))
                .thenThrow(new IllegalStateException("invalid api key"));
        var terminal = assertThrows(CapabilityException.class, () -> client.summarize("text"));
        assertFalse(terminal.isRetryable());
    }

    @Test
    @DisplayName("a call exceeding the timeout is retryable")
    void timeout() {
        when(llm.structuredCall(anyString(), anyString(), eq(PageSummary.class))).thenAnswer(inv -> {
            Thread.sleep(3_000);
            return new PageSummary("late", "late");
        });

        var e = assertThrows(CapabilityException.class, () -> client.summarize("text"));

        assertTrue(e.isRetryable());
        assertTrue(e.getMessage().contains("timed out"));
    }

    @Test
    @DisplayName("a timed-out call is interrupted and frees its worker")
    void timeoutInterruptsWorker() throws Exception {
        var interrupted = new CountDownLatch(1);
        when(llm.structuredCall(anyString(), eq("### Content:\nslow"), eq(PageSummary.class))).thenAnswer(inv -> {
            try {
                Thread.sleep(30_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
            }
            return new PageSummary("late", "late");
        });
        when(llm.structuredCall(anyString(), eq("### Content:\nfast"), eq(PageSummary.class)))
                .thenReturn(new PageSummary("Fast", "Answered in time."));

        assertThrows(CapabilityException.class, () -> client.summarize("slow"));

        assertTrue(interrupted.await(5, TimeUnit.SECONDS));
        assertEquals("Fast", client.summarize("fast").title());
    }
}
