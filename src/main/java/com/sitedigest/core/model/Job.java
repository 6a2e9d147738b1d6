package com.sitedigest.core.model;

import java.time.Instant;

/**
 * Caller-facing record of one scrape request.
 * <p>
 * Immutable; the job registry replaces the stored instance on every
 * lifecycle transition.
 *
 * @param id          unique job identifier
 * @param status      lifecycle status
 * @param url         submitted seed URL
 * @param createdAt   submission time
 * @param completedAt set once the job reaches a terminal status
 * @param result      final result on success; null otherwise
 * @param error       last unresolved failure on failure; null otherwise
 */
public record Job(
    String id,
    JobStatus status,
    String url,
    Instant createdAt,
    Instant completedAt,
    ScrapeResult result,
    String error
) {

    public static Job pending(String id, String url, Instant createdAt) {
        return new Job(id, JobStatus.PENDING, url, createdAt, null, null, null);
    }

    public Job running() {
        return new Job(id, JobStatus.RUNNING, url, createdAt, null, null, null);
    }

    public Job completed(ScrapeResult result, Instant at) {
        return new Job(id, JobStatus.COMPLETED, url, createdAt, at, result, null);
    }

    public Job failed(String error, Instant at) {
        return new Job(id, JobStatus.FAILED, url, createdAt, at, null, error);
    }
}
