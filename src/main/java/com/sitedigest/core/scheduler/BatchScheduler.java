package com.sitedigest.core.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits an ordered URL list into retrieval batches.
 * <p>
 * The input is first truncated to {@code urlLimit} entries (earlier entries
 * win), then cut into contiguous chunks of at most {@code batchSize}; only the
 * last chunk may be shorter. The plan is a pure function of its arguments.
 */
@Service
public class BatchScheduler {

    private static final Logger log = LoggerFactory.getLogger(BatchScheduler.class);

    /**
     * Plan retrieval batches.
     *
     * @param urls      URLs in discovery order
     * @param urlLimit  maximum number of URLs kept overall
     * @param batchSize maximum number of URLs per batch
     * @return batches in order; empty when {@code urls} is empty
     * @throws IllegalArgumentException if {@code urlLimit} or {@code batchSize} is not positive
     */
    public List<List<String>> plan(List<String> urls, int urlLimit, int batchSize) {
        if (urlLimit <= 0) {
            throw new IllegalArgumentException("urlLimit must be > 0, was " + urlLimit);
        }
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0, was " + batchSize);
        }
        var kept = truncate(urls, urlLimit);
        var batches = new ArrayList<List<String>>();
        for (int i = 0; i < kept.size(); i += batchSize) {
            batches.add(List.copyOf(kept.subList(i, Math.min(i + batchSize, kept.size()))));
        }
        log.debug("Planned {} batch(es) for {} URL(s) (limit={}, batchSize={})",
                batches.size(), kept.size(), urlLimit, batchSize);
        return List.copyOf(batches);
    }

    /**
     * First {@code urlLimit} entries of {@code urls}, in order.
     */
    public List<String> truncate(List<String> urls, int urlLimit) {
        if (urls == null || urls.isEmpty()) {
            return List.of();
        }
        if (urls.size() > urlLimit) {
            log.info("URL cap binds: keeping first {} of {} URLs", urlLimit, urls.size());
        }
        return List.copyOf(urls.subList(0, Math.min(urlLimit, urls.size())));
    }
}
