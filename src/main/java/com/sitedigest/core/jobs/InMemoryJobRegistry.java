package com.sitedigest.core.jobs;

import com.sitedigest.core.engine.ScrapeFailedException;
import com.sitedigest.core.engine.WorkflowEngine;
import com.sitedigest.core.events.EventBus;
import com.sitedigest.core.events.PipelineEvent;
import com.sitedigest.core.model.Job;
import com.sitedigest.core.model.JobStatus;
import com.sitedigest.core.model.ScrapeResult;
import com.sitedigest.core.model.StepError;
import com.sitedigest.core.model.WorkflowStatus;
import com.sitedigest.core.state.WorkflowState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.UnaryOperator;

/**
 * Job registry held in process memory.
 * <p>
 * Every transition goes through {@link ConcurrentHashMap#compute}, which
 * serializes updates per job id. Jobs are lost on restart.
 */
@Service
public class InMemoryJobRegistry implements JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(InMemoryJobRegistry.class);

    private final ConcurrentHashMap<String, Job> jobs = new ConcurrentHashMap<>();
    private final WorkflowEngine engine;
    private final EventBus eventBus;
    private final Executor executor;
    private final Clock clock;

    public InMemoryJobRegistry(WorkflowEngine engine, EventBus eventBus,
                               @Qualifier("jobExecutor") Executor executor) {
        this(engine, eventBus, executor, Clock.systemUTC());
    }

    InMemoryJobRegistry(WorkflowEngine engine, EventBus eventBus, Executor executor, Clock clock) {
        this.engine = engine;
        this.eventBus = eventBus;
        this.executor = executor;
        this.clock = clock;
    }

    @Override
    public Job submit(String url) {
        String jobId = UUID.randomUUID().toString();
        Job job = Job.pending(jobId, url, clock.instant());
        jobs.put(jobId, job);
        log.info("Accepted job {} for {}", jobId, url);
        eventBus.publish(PipelineEvent.of("job.created", jobId, null, Map.of("url", url)));

        try {
            executor.execute(() -> runDetached(jobId));
        } catch (RejectedExecutionException e) {
            log.error("Job {} could not be scheduled", jobId, e);
            return finish(jobId, current -> current.failed("Job could not be scheduled: " + e.getMessage(), clock.instant()));
        }
        return job;
    }

    private void runDetached(String jobId) {
        try {
            start(jobId);
        } catch (JobNotFoundException e) {
            log.info("Job {} was deleted before it started", jobId);
        } catch (RuntimeException e) {
            log.error("Job {} crashed outside the pipeline", jobId, e);
            jobs.computeIfPresent(jobId, (id, current) -> current.status().isTerminal()
                    ? current
                    : current.failed("Unexpected error: " + e.getMessage(), clock.instant()));
        }
    }

    @Override
    public Job start(String jobId) {
        Job running = jobs.compute(jobId, (id, current) -> {
            if (current == null) {
                throw new JobNotFoundException(id);
            }
            if (current.status() != JobStatus.PENDING) {
                throw new IllegalStateException("Job " + id + " is already " + current.status().wireName());
            }
            return current.running();
        });
        eventBus.publish(PipelineEvent.of("job.started", jobId, null, Map.of("url", running.url())));

        WorkflowState state = engine.run(jobId, running.url());
        return complete(jobId, state);
    }

    @Override
    public Job complete(String jobId, WorkflowState state) {
        Instant now = clock.instant();
        Job done;
        if (state.status() == WorkflowStatus.COMPLETED) {
            var result = new ScrapeResult(state.seedUrl(), state.formattedResults());
            done = finish(jobId, fromRunning(current -> current.completed(result, now)));
            log.info("Job {} completed with {} summaries", jobId, result.data().size());
            eventBus.publish(PipelineEvent.of("job.completed", jobId, null,
                    Map.of("summaries", result.data().size(), "errors", state.errors().size())));
        } else {
            String error = state.lastError().map(StepError::toString).orElse("Unknown error");
            done = finish(jobId, fromRunning(current -> current.failed(error, now)));
            log.warn("Job {} failed: {}", jobId, error);
            eventBus.publish(PipelineEvent.of("job.failed", jobId, null, Map.of("error", error)));
        }
        return done;
    }

    /** Only a running job may be finished by a pipeline result. */
    private static UnaryOperator<Job> fromRunning(UnaryOperator<Job> transition) {
        return current -> {
            if (current.status() != JobStatus.RUNNING) {
                throw new IllegalStateException("Job " + current.id() + " is " + current.status().wireName()
                        + ", not running");
            }
            return transition.apply(current);
        };
    }

    private Job finish(String jobId, UnaryOperator<Job> transition) {
        Job updated = jobs.computeIfPresent(jobId, (id, current) -> transition.apply(current));
        if (updated == null) {
            throw new JobNotFoundException(jobId);
        }
        return updated;
    }

    @Override
    public Job get(String jobId) {
        Job job = jobs.get(jobId);
        if (job == null) {
            throw new JobNotFoundException(jobId);
        }
        return job;
    }

    @Override
    public ScrapeResult result(String jobId) {
        Job job = get(jobId);
        if (!job.status().isTerminal()) {
            throw new JobNotReadyException(jobId, job.status());
        }
        if (job.status() == JobStatus.FAILED) {
            throw new ScrapeFailedException("Job failed: " + (job.error() != null ? job.error() : "Unknown error"));
        }
        if (job.result() == null) {
            throw new JobNotFoundException(jobId);
        }
        return job.result();
    }

    @Override
    public List<Job> list(JobStatus status, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1, was " + limit);
        }
        return jobs.values().stream()
                .filter(job -> status == null || job.status() == status)
                .sorted(Comparator.comparing(Job::createdAt).reversed())
                .limit(limit)
                .toList();
    }

    @Override
    public void delete(String jobId) {
        if (jobs.remove(jobId) == null) {
            throw new JobNotFoundException(jobId);
        }
        log.info("Deleted job {}", jobId);
    }
}
