package com.sitedigest.dispatch.api;

/**
 * Inbound JSON body for POST /api/v1/scrape and /api/v1/scrape/sync.
 *
 * @param url absolute http(s) seed URL
 */
public record ScrapeRequest(String url) {}
