package com.sitedigest.core.jobs;

import com.sitedigest.core.engine.ScrapeFailedException;
import com.sitedigest.core.model.Job;
import com.sitedigest.core.model.JobStatus;
import com.sitedigest.core.model.ScrapeResult;
import com.sitedigest.core.state.WorkflowState;

import java.util.List;

/**
 * Owns job records and their lifecycle transitions.
 * <p>
 * Updates to a single job are serialized; distinct jobs are independent.
 * A durable store can be plugged in behind this interface without touching
 * the workflow engine.
 */
public interface JobRegistry {

    /**
     * Registers a pending job for {@code url} and schedules its execution.
     * Returns without waiting for the pipeline.
     */
    Job submit(String url);

    /**
     * Moves a pending job to running, runs the pipeline for it and records
     * the outcome. Blocks until the pipeline finishes.
     *
     * @throws JobNotFoundException if the job does not exist
     */
    Job start(String jobId);

    /**
     * Records the terminal state of a job's pipeline run.
     *
     * @throws JobNotFoundException  if the job does not exist
     * @throws IllegalStateException if the job is not running
     */
    Job complete(String jobId, WorkflowState state);

    /**
     * @throws JobNotFoundException if the job does not exist
     */
    Job get(String jobId);

    /**
     * The result of a completed job.
     *
     * @throws JobNotFoundException  if the job does not exist
     * @throws JobNotReadyException  if the job is pending or running
     * @throws ScrapeFailedException if the job failed
     */
    ScrapeResult result(String jobId);

    /**
     * Jobs ordered by creation time, most recent first.
     *
     * @param status optional filter; {@code null} for all
     * @param limit  maximum number of jobs to return
     */
    List<Job> list(JobStatus status, int limit);

    /**
     * @throws JobNotFoundException if the job does not exist
     */
    void delete(String jobId);
}
