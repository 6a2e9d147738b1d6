package com.sitedigest.core.graph;

/**
 * How a working node finished, as seen by the router.
 */
public enum StepOutcome {
    SUCCESS,
    RETRYABLE_FAILURE,
    TERMINAL_FAILURE
}
