package com.sitedigest.core.capability;

/**
 * Thrown by an external capability (link discovery, content retrieval,
 * summarization, result persistence) when a call fails.
 * <p>
 * {@link #isRetryable()} separates transient failures (network errors,
 * timeouts, rate limiting, temporary unavailability) from failures that will
 * not go away by trying again (bad input, bad credentials, bad configuration).
 */
public class CapabilityException extends RuntimeException {

    private final boolean retryable;

    public CapabilityException(String message, boolean retryable) {
        super(message);
        this.retryable = retryable;
    }

    public CapabilityException(String message, boolean retryable, Throwable cause) {
        super(message, cause);
        this.retryable = retryable;
    }

    public static CapabilityException retryable(String message, Throwable cause) {
        return new CapabilityException(message, true, cause);
    }

    public static CapabilityException terminal(String message, Throwable cause) {
        return new CapabilityException(message, false, cause);
    }

    public boolean isRetryable() {
        return retryable;
    }
}
