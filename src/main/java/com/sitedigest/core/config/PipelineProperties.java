package com.sitedigest.core.config;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Tuning knobs for the content pipeline, bound from {@code sitedigest.pipeline.*}.
 */
@Component
@ConfigurationProperties(prefix = "sitedigest.pipeline")
public class PipelineProperties {

    private int urlLimit = 50;
    private int batchLimit = 10;
    private int maxRetries = 3;
    private long backoffMillis = 1000;
    private int contentCharLimit = 2000;
    private int capabilityTimeoutSeconds = 60;
    private int jobThreads = 4;
    private String outputDir = "./output";
    private List<Exclusion> excludedPatterns = new ArrayList<>(defaultExclusions());

    /**
     * Fails fast on settings the pipeline cannot run with.
     */
    @PostConstruct
    public void validate() {
        if (urlLimit <= 0) {
            throw new IllegalStateException("sitedigest.pipeline.url-limit must be > 0, was " + urlLimit);
        }
        if (batchLimit <= 0) {
            throw new IllegalStateException("sitedigest.pipeline.batch-limit must be > 0, was " + batchLimit);
        }
        if (maxRetries < 0) {
            throw new IllegalStateException("sitedigest.pipeline.max-retries must be >= 0, was " + maxRetries);
        }
        if (backoffMillis < 0) {
            throw new IllegalStateException("sitedigest.pipeline.backoff-millis must be >= 0, was " + backoffMillis);
        }
        if (capabilityTimeoutSeconds <= 0) {
            throw new IllegalStateException("sitedigest.pipeline.capability-timeout-seconds must be > 0");
        }
        for (var exclusion : excludedPatterns) {
            try {
                Pattern.compile(exclusion.getPattern());
            } catch (PatternSyntaxException | NullPointerException e) {
                throw new IllegalStateException("Invalid excluded pattern for category '"
                        + exclusion.getCategory() + "': " + exclusion.getPattern(), e);
            }
        }
    }

    /**
     * Built-in exclusion categories, evaluated in this order against the
     * lower-cased path and query of a candidate link.
     */
    public static List<Exclusion> defaultExclusions() {
        return List.of(
                new Exclusion("auth", "/(login|logout|log-in|log-out|signin|sign-in|signup|sign-up|signout|sign-out|register|auth|oauth2?|sso)\\b"),
                new Exclusion("account", "/(account|accounts|my-account|profile|profiles|settings|preferences)\\b"),
                new Exclusion("commerce", "/(cart|basket|checkout|payment|payments|billing|orders?)\\b"),
                new Exclusion("admin", "/(admin|administrator|wp-admin|wp-login\\.php|dashboard)\\b"),
                new Exclusion("legal", "/(legal|privacy|privacy-policy|terms|terms-of-service|terms-and-conditions|tos|cookies?|cookie-policy|gdpr|disclaimer|imprint)\\b"),
                new Exclusion("download", "\\.(pdf|zip|rar|7z|tar|gz|tgz|exe|dmg|msi|apk|iso|docx?|xlsx?|pptx?|csv|jpe?g|png|gif|svg|webp|ico|mp3|mp4|avi|mov|wav|woff2?|ttf)(\\?|$)")
        );
    }

    public int getUrlLimit() { return urlLimit; }
    public void setUrlLimit(int urlLimit) { this.urlLimit = urlLimit; }
    public int getBatchLimit() { return batchLimit; }
    public void setBatchLimit(int batchLimit) { this.batchLimit = batchLimit; }
    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
    public long getBackoffMillis() { return backoffMillis; }
    public void setBackoffMillis(long backoffMillis) { this.backoffMillis = backoffMillis; }
    public int getContentCharLimit() { return contentCharLimit; }
    public void setContentCharLimit(int contentCharLimit) { this.contentCharLimit = contentCharLimit; }
    public int getCapabilityTimeoutSeconds() { return capabilityTimeoutSeconds; }
    public void setCapabilityTimeoutSeconds(int capabilityTimeoutSeconds) { this.capabilityTimeoutSeconds = capabilityTimeoutSeconds; }
    public int getJobThreads() { return jobThreads; }
    public void setJobThreads(int jobThreads) { this.jobThreads = jobThreads; }
    public String getOutputDir() { return outputDir; }
    public void setOutputDir(String outputDir) { this.outputDir = outputDir; }
    public List<Exclusion> getExcludedPatterns() { return excludedPatterns; }
    public void setExcludedPatterns(List<Exclusion> excludedPatterns) { this.excludedPatterns = excludedPatterns; }

    /**
     * One excluded-link category and the regex that identifies it.
     */
    public static class Exclusion {
        private String category;
        private String pattern;

        public Exclusion() {
        }

        public Exclusion(String category, String pattern) {
            this.category = category;
            this.pattern = pattern;
        }

        public String getCategory() { return category; }
        public void setCategory(String category) { this.category = category; }
        public String getPattern() { return pattern; }
        public void setPattern(String pattern) { this.pattern = pattern; }
    }
}
