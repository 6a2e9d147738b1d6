package com.sitedigest.core.engine;

/**
 * A synchronous scrape ended without a usable result.
 */
public class ScrapeFailedException extends RuntimeException {

    public ScrapeFailedException(String message) {
        super(message);
    }
}
