package com.sitedigest.core.model;

import java.io.Serializable;

/**
 * Structured summary of one page as produced by the summarization model.
 */
public record PageSummary(
    String title,
    String description
) implements Serializable {}
