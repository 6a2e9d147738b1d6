package com.sitedigest.dispatch.api;

import com.sitedigest.core.engine.ScrapeFailedException;
import com.sitedigest.core.engine.WorkflowEngine;
import com.sitedigest.core.jobs.JobNotFoundException;
import com.sitedigest.core.jobs.JobNotReadyException;
import com.sitedigest.core.jobs.JobRegistry;
import com.sitedigest.core.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * REST controller for scrape jobs.
 */
@RestController
@RequestMapping("/api/v1")
public class JobController {

    private static final Logger log = LoggerFactory.getLogger(JobController.class);

    static final int MAX_LIST_LIMIT = 100;

    private final JobRegistry jobRegistry;
    private final WorkflowEngine workflowEngine;

    public JobController(JobRegistry jobRegistry, WorkflowEngine workflowEngine) {
        this.jobRegistry = jobRegistry;
        this.workflowEngine = workflowEngine;
    }

    /**
     * POST /api/v1/scrape: Submit a job. Runs in the background.
     */
    @PostMapping("/scrape")
    public ResponseEntity<?> submit(@RequestBody ScrapeRequest request) {
        String invalid = validateUrl(request);
        if (invalid != null) {
            return detail(HttpStatus.BAD_REQUEST, invalid);
        }
        var job = jobRegistry.submit(request.url().trim());
        return ResponseEntity.accepted().body(JobResponse.accepted(job));
    }

    /**
     * GET /api/v1/jobs/{id}: Job status.
     */
    @GetMapping("/jobs/{id}")
    public ResponseEntity<?> status(@PathVariable String id) {
        try {
            return ResponseEntity.ok(JobStatusResponse.from(jobRegistry.get(id)));
        } catch (JobNotFoundException e) {
            return detail(HttpStatus.NOT_FOUND, "Job not found");
        }
    }

    /**
     * GET /api/v1/jobs/{id}/result: Result of a completed job.
     * 425 while the job is pending or running, 500 when it failed.
     */
    @GetMapping("/jobs/{id}/result")
    public ResponseEntity<?> result(@PathVariable String id) {
        try {
            return ResponseEntity.ok(jobRegistry.result(id));
        } catch (JobNotFoundException e) {
            return detail(HttpStatus.NOT_FOUND, "Job not found");
        } catch (JobNotReadyException e) {
            return detail(HttpStatus.TOO_EARLY, "Job is still " + e.getStatus().wireName()
                    + ". Please wait for completion.");
        } catch (ScrapeFailedException e) {
            return detail(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    /**
     * POST /api/v1/scrape/sync: Run the pipeline inline and return its result.
     */
    @PostMapping("/scrape/sync")
    public ResponseEntity<?> scrapeSync(@RequestBody ScrapeRequest request) {
        String invalid = validateUrl(request);
        if (invalid != null) {
            return detail(HttpStatus.BAD_REQUEST, invalid);
        }
        try {
            return ResponseEntity.ok(workflowEngine.runSync(request.url().trim()));
        } catch (ScrapeFailedException e) {
            log.warn("Synchronous scrape of {} failed: {}", request.url(), e.getMessage());
            return detail(HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage());
        }
    }

    /**
     * GET /api/v1/jobs: Most recent jobs, optionally filtered by status.
     */
    @GetMapping("/jobs")
    public ResponseEntity<?> list(@RequestParam(required = false) String status,
                                  @RequestParam(defaultValue = "10") int limit) {
        if (limit < 1 || limit > MAX_LIST_LIMIT) {
            return detail(HttpStatus.BAD_REQUEST, "limit must be between 1 and " + MAX_LIST_LIMIT);
        }
        JobStatus filter = null;
        if (status != null && !status.isBlank()) {
            try {
                filter = JobStatus.parse(status);
            } catch (IllegalArgumentException e) {
                return detail(HttpStatus.BAD_REQUEST, "Invalid status: " + status);
            }
        }
        var jobs = jobRegistry.list(filter, limit).stream()
                .map(JobStatusResponse::from)
                .toList();
        var body = new LinkedHashMap<String, Object>();
        body.put("total", jobs.size());
        body.put("jobs", jobs);
        return ResponseEntity.ok(body);
    }

    /**
     * DELETE /api/v1/jobs/{id}: Forget a job.
     */
    @DeleteMapping("/jobs/{id}")
    public ResponseEntity<?> delete(@PathVariable String id) {
        try {
            jobRegistry.delete(id);
        } catch (JobNotFoundException e) {
            return detail(HttpStatus.NOT_FOUND, "Job not found");
        }
        var body = new LinkedHashMap<String, String>();
        body.put("message", "Job deleted successfully");
        body.put("job_id", id);
        return ResponseEntity.ok(body);
    }

    static String validateUrl(ScrapeRequest request) {
        if (request == null || request.url() == null || request.url().isBlank()) {
            return "url is required";
        }
        try {
            URI uri = new URI(request.url().trim());
            String scheme = uri.getScheme();
            if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                    || uri.getHost() == null) {
                return "Invalid URL: " + request.url();
            }
            return null;
        } catch (URISyntaxException e) {
            return "Invalid URL: " + request.url();
        }
    }

    private static ResponseEntity<Map<String, String>> detail(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(Map.of("detail", message));
    }
}
