package com.sitedigest.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sitedigest.core.model.Job;
import com.sitedigest.core.model.JobStatus;
import com.sitedigest.core.model.ScrapeResult;

/**
 * Outbound JSON for a single job's status.
 */
public record JobStatusResponse(
    @JsonProperty("job_id") String jobId,
    JobStatus status,
    String url,
    @JsonProperty("created_at") String createdAt,
    @JsonProperty("completed_at") String completedAt,
    ScrapeResult result,
    String error
) {

    static JobStatusResponse from(Job job) {
        return new JobStatusResponse(
                job.id(),
                job.status(),
                job.url(),
                job.createdAt().toString(),
                job.completedAt() != null ? job.completedAt().toString() : null,
                job.result(),
                job.error()
        );
    }
}
