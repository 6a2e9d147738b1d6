package com.sitedigest.core.capability;

import com.sitedigest.core.model.PageSummary;

/**
 * Produces a structured summary of raw page text.
 */
public interface SummarizationClient {

    /**
     * @throws SummaryParseException if the model's answer is not a usable summary
     * @throws CapabilityException   if the model call itself fails
     */
    PageSummary summarize(String text);
}
