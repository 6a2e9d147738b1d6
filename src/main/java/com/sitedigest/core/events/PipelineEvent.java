package com.sitedigest.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;

/**
 * An event emitted while a job moves through the pipeline.
 *
 * @param eventType event type (e.g. "job.created", "step.retrying", "job.completed")
 * @param jobId     the job this event belongs to
 * @param step      the workflow node this event relates to (nullable for job-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record PipelineEvent(
    String eventType,
    String jobId,
    String step,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static PipelineEvent of(String eventType, String jobId, String step, Map<String, Object> payload) {
        return new PipelineEvent(eventType, jobId, step, payload, Instant.now());
    }
}
