package com.sitedigest.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.sitedigest.core.model.Job;
import com.sitedigest.core.model.JobStatus;

/**
 * Acknowledgement returned when a scrape job is accepted.
 */
public record JobResponse(
    @JsonProperty("job_id") String jobId,
    JobStatus status,
    String message,
    @JsonProperty("created_at") String createdAt
) {

    static JobResponse accepted(Job job) {
        return new JobResponse(job.id(), job.status(), "Scraping job created successfully",
                job.createdAt().toString());
    }
}
