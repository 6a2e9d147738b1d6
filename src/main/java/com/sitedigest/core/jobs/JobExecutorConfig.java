package com.sitedigest.core.jobs;

import com.sitedigest.core.config.PipelineProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Worker pool that runs submitted jobs in the background.
 */
@Configuration
public class JobExecutorConfig {

    @Bean(name = "jobExecutor", destroyMethod = "shutdownNow")
    public ExecutorService jobExecutor(PipelineProperties properties) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getJobThreads()), r -> {
            Thread t = new Thread(r, "job-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }
}
