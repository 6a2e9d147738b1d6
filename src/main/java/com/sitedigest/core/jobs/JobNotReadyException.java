package com.sitedigest.core.jobs;

import com.sitedigest.core.model.JobStatus;

/**
 * A result was requested for a job that is still pending or running.
 */
public class JobNotReadyException extends RuntimeException {

    private final JobStatus status;

    public JobNotReadyException(String jobId, JobStatus status) {
        super("Job " + jobId + " is still " + status.wireName() + ". Please wait for completion.");
        this.status = status;
    }

    public JobStatus getStatus() {
        return status;
    }
}
