package com.sitedigest.core.llm;

/**
 * Thrown when model output cannot be read as the requested type.
 */
public class LlmParseException extends RuntimeException {

    public LlmParseException(String message) {
        super(message);
    }

    public LlmParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
