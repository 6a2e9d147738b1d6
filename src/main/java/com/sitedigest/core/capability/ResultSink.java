package com.sitedigest.core.capability;

import com.sitedigest.core.model.ScrapeResult;

/**
 * Durable destination for the summaries of a finished job.
 * <p>
 * Implementations must be idempotent: writing the same result for the same
 * job twice produces identical stored output.
 */
public interface ResultSink {

    /**
     * @param jobId  job the result belongs to
     * @param result source URL plus summaries
     * @throws CapabilityException if the write fails
     */
    void persist(String jobId, ScrapeResult result);
}
