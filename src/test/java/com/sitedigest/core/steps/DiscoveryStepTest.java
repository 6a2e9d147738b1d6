package com.sitedigest.core.steps;

import com.sitedigest.core.capability.CapabilityException;
import com.sitedigest.core.capability.LinkDiscoveryClient;
import com.sitedigest.core.config.PipelineProperties;
import com.sitedigest.core.filter.UrlFilter;
import com.sitedigest.core.model.WorkflowNode;
import com.sitedigest.core.scheduler.BatchScheduler;
import com.sitedigest.core.state.WorkflowState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class DiscoveryStepTest {

    private static final String SEED = "https://example.com";

    private LinkDiscoveryClient client;
    private PipelineProperties properties;
    private DiscoveryStep step;

    @BeforeEach
    void setUp() {
        client = mock(LinkDiscoveryClient.class);
        properties = new PipelineProperties();
        step = new DiscoveryStep(client, new UrlFilter(properties), new BatchScheduler(), properties);
    }

    private static WorkflowState seeded(String seed) {
        return new WorkflowState(Map.of(WorkflowState.SEED_URL, seed));
    }

    @SuppressWarnings("unchecked")
    private static List<String> urls(StepResult result, String key) {
        return (List<String>) result.updates().get(key);
    }

    @Test
    @DisplayName("stores absolute discovered links and filtered eligible links")
    void filtersDiscoveredLinks() throws StepFailure {
        when(client.discoverLinks(SEED)).thenReturn(new LinkedHashSet<>(List.of(
                "/a", "https://example.com/b", "https://example.com/login", "https://other.org/x")));

        var result = step.execute(seeded(SEED));

        assertEquals(List.of("https://example.com/a", "https://example.com/b",
                        "https://example.com/login", "https://other.org/x"),
                urls(result, WorkflowState.DISCOVERED_URLS));
        assertEquals(List.of("https://example.com/a", "https://example.com/b"),
                urls(result, WorkflowState.ELIGIBLE_URLS));
        assertTrue(result.skipped().isEmpty());
    }

    @Test
    @DisplayName("eligible URLs are capped at the url limit, earliest first")
    void capsEligibleUrls() throws StepFailure {
        properties.setUrlLimit(2);
        when(client.discoverLinks(SEED)).thenReturn(new LinkedHashSet<>(List.of(
                "https://example.com/1", "https://example.com/2", "https://example.com/3")));

        var result = step.execute(seeded(SEED));

        assertEquals(List.of("https://example.com/1", "https://example.com/2"),
                urls(result, WorkflowState.ELIGIBLE_URLS));
        assertEquals(3, urls(result, WorkflowState.DISCOVERED_URLS).size());
    }

    @Test
    @DisplayName("a page without links yields empty lists")
    void noLinks() throws StepFailure {
        when(client.discoverLinks(SEED)).thenReturn(null);

        var result = step.execute(seeded(SEED));

        assertEquals(List.of(), urls(result, WorkflowState.DISCOVERED_URLS));
        assertEquals(List.of(), urls(result, WorkflowState.ELIGIBLE_URLS));
    }

    @Test
    @DisplayName("a non-http seed is a terminal failure and the client is never called")
    void rejectsBadSeed() {
        var failure = assertThrows(StepFailure.class, () -> step.execute(seeded("ftp://example.com")));

        assertFalse(failure.isRetryable());
        assertEquals(WorkflowNode.DISCOVERY, failure.step());
        verifyNoInteractions(client);
    }

    @Test
    @DisplayName("client failures keep their retry classification")
    void classifiesClientFailures() {
        when(client.discoverLinks(SEED)).thenThrow(CapabilityException.retryable("rate limited", null));
        var retryable = assertThrows(StepFailure.class, () -> step.execute(seeded(SEED)));
        assertTrue(retryable.isRetryable());
        assertEquals("rate limited", retryable.getMessage());

        reset(client);
        when(client.discoverLinks(SEED)).thenThrow(CapabilityException.terminal("unauthorized", null));
        var terminal = assertThrows(StepFailure.class, () -> step.execute(seeded(SEED)));
        assertFalse(terminal.isRetryable());
    }
}
