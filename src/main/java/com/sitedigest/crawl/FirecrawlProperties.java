package com.sitedigest.crawl;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Firecrawl connection settings bound from {@code sitedigest.firecrawl.*}.
 */
@Component
@ConfigurationProperties(prefix = "sitedigest.firecrawl")
public class FirecrawlProperties {

    /** API root, e.g. https://api.firecrawl.dev or a self-hosted instance */
    private String baseUrl = "https://api.firecrawl.dev";

    /** Bearer token; may be empty for self-hosted instances without auth */
    private String apiKey = "";

    /** Delay between status polls of a batch scrape */
    private long pollIntervalMillis = 2000;

    public String getBaseUrl() { return baseUrl; }
    public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
    public String getApiKey() { return apiKey; }
    public void setApiKey(String apiKey) { this.apiKey = apiKey; }
    public long getPollIntervalMillis() { return pollIntervalMillis; }
    public void setPollIntervalMillis(long pollIntervalMillis) { this.pollIntervalMillis = pollIntervalMillis; }
}
