package com.sitedigest.core.capability;

/**
 * The summarization model answered, but the answer could not be read as a
 * title and description. Affects a single page only.
 */
public class SummaryParseException extends CapabilityException {

    public SummaryParseException(String message, Throwable cause) {
        super(message, false, cause);
    }
}
