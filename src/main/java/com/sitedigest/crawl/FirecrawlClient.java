package com.sitedigest.crawl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sitedigest.core.capability.CapabilityException;
import com.sitedigest.core.capability.ContentRetrievalClient;
import com.sitedigest.core.capability.LinkDiscoveryClient;
import com.sitedigest.core.config.PipelineProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * HTTP client for the Firecrawl v1 REST API.
 * <p>
 * Link discovery scrapes the seed page with the {@code links} format. Content
 * retrieval starts a batch scrape with the {@code markdown} format and polls
 * it until the provider reports {@code completed} or {@code failed}, or until
 * the capability timeout runs out.
 * <p>
 * HTTP 429 and 5xx responses, I/O errors and timeouts are reported as
 * retryable {@link CapabilityException}s; every other 4xx is terminal.
 */
@Service
public class FirecrawlClient implements LinkDiscoveryClient, ContentRetrievalClient {

    private static final Logger log = LoggerFactory.getLogger(FirecrawlClient.class);

    private final FirecrawlProperties properties;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Autowired
    public FirecrawlClient(FirecrawlProperties properties, PipelineProperties pipelineProperties) {
        this(properties, Duration.ofSeconds(pipelineProperties.getCapabilityTimeoutSeconds()));
    }

    public FirecrawlClient(FirecrawlProperties properties, Duration timeout) {
        this.properties = properties;
        this.timeout = timeout;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.objectMapper = new ObjectMapper();
    }

    @Override
    public Set<String> discoverLinks(String seedUrl) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("url", seedUrl);
        body.putArray("formats").add("links");

        JsonNode response = post("/v1/scrape", body.toString());
        checkSuccess(response, "scrape " + seedUrl);

        var links = new LinkedHashSet<String>();
        JsonNode rawLinks = response.path("data").path("links");
        for (JsonNode link : rawLinks) {
            if (link.isTextual() && !link.asText().isBlank()) {
                links.add(link.asText());
            }
        }
        log.info("Firecrawl returned {} link(s) for {}", links.size(), seedUrl);
        return links;
    }

    @Override
    public Map<String, String> retrieveContent(List<String> batch) {
        if (batch.isEmpty()) {
            return Map.of();
        }
        ObjectNode body = objectMapper.createObjectNode();
        var urls = body.putArray("urls");
        batch.forEach(urls::add);
        body.putArray("formats").add("markdown");

        JsonNode started = post("/v1/batch/scrape", body.toString());
        checkSuccess(started, "batch scrape");
        String batchId = started.path("id").asText("");
        if (batchId.isBlank()) {
            throw CapabilityException.terminal("Firecrawl batch scrape returned no id: " + started, null);
        }
        log.debug("Started Firecrawl batch {} for {} URL(s)", batchId, batch.size());

        Instant deadline = Instant.now().plus(timeout);
        String path = "/v1/batch/scrape/" + batchId;
        while (true) {
            JsonNode status = get(properties.getBaseUrl() + path);
            String state = status.path("status").asText("");
            if ("completed".equals(state)) {
                return collectPages(batch, status, deadline);
            }
            if ("failed".equals(state)) {
                throw CapabilityException.retryable("Firecrawl batch " + batchId + " failed", null);
            }
            if (Instant.now().isAfter(deadline)) {
                throw CapabilityException.retryable("Firecrawl batch " + batchId + " did not complete within "
                        + timeout.toSeconds() + "s (status=" + state + ")", null);
            }
            pause();
        }
    }

    /**
     * Gathers markdown keyed by the requested URL, following {@code next}
     * pages of a large batch result.
     */
    private Map<String, String> collectPages(List<String> batch, JsonNode status, Instant deadline) {
        var requested = new HashSet<>(batch);
        var content = new LinkedHashMap<String, String>();
        JsonNode page = status;
        while (true) {
            for (JsonNode doc : page.path("data")) {
                String markdown = doc.path("markdown").asText("");
                String url = sourceUrl(doc, requested);
                if (url != null && !markdown.isBlank()) {
                    content.putIfAbsent(url, markdown);
                }
            }
            String next = page.path("next").asText("");
            if (next.isBlank()) {
                break;
            }
            if (Instant.now().isAfter(deadline)) {
                throw CapabilityException.retryable("Firecrawl batch result paging exceeded "
                        + timeout.toSeconds() + "s", null);
            }
            page = get(next);
        }
        log.debug("Firecrawl returned content for {}/{} URL(s)", content.size(), batch.size());
        return content;
    }

    private static String sourceUrl(JsonNode doc, Set<String> requested) {
        JsonNode metadata = doc.path("metadata");
        for (String field : List.of("sourceURL", "url")) {
            String candidate = metadata.path(field).asText("");
            if (requested.contains(candidate)) {
                return candidate;
            }
        }
        String fallback = metadata.path("sourceURL").asText("");
        return fallback.isBlank() ? null : fallback;
    }

    private static void checkSuccess(JsonNode response, String action) {
        if (response.has("success") && !response.path("success").asBoolean()) {
            throw CapabilityException.terminal("Firecrawl " + action + " failed: "
                    + response.path("error").asText("unknown error"), null);
        }
    }

    private void pause() {
        try {
            Thread.sleep(properties.getPollIntervalMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CapabilityException.retryable("Interrupted while polling Firecrawl", e);
        }
    }

    JsonNode post(String path, String body) {
        var request = authorized(HttpRequest.newBuilder()
                .uri(URI.create(properties.getBaseUrl() + path)))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return send(request, "POST " + path);
    }

    JsonNode get(String url) {
        var request = authorized(HttpRequest.newBuilder()
                .uri(URI.create(url)))
                .GET()
                .build();
        return send(request, "GET " + url);
    }

    private HttpRequest.Builder authorized(HttpRequest.Builder builder) {
        builder.timeout(timeout).header("Accept", "application/json");
        String apiKey = properties.getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
        return builder;
    }

    private JsonNode send(HttpRequest request, String description) {
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw CapabilityException.retryable("Firecrawl request failed: " + description, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw CapabilityException.retryable("Firecrawl request interrupted: " + description, e);
        }

        int code = response.statusCode();
        if (code >= 400) {
            boolean retryable = code == 429 || code >= 500;
            throw new CapabilityException("Firecrawl %s failed (HTTP %d): %s"
                    .formatted(description, code, response.body()), retryable);
        }
        try {
            return objectMapper.readTree(response.body());
        } catch (IOException e) {
            throw CapabilityException.terminal("Firecrawl returned unreadable JSON for " + description, e);
        }
    }
}
