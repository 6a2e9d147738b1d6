package com.sitedigest.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Caller-visible lifecycle status of a scrape job.
 */
public enum JobStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /**
     * Parses a status name case-insensitively ("completed", "COMPLETED").
     *
     * @throws IllegalArgumentException if the name matches no status
     */
    public static JobStatus parse(String raw) {
        return JobStatus.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
