package com.sitedigest.core.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Entry in the append-only error trail of a workflow execution.
 *
 * @param step      the node that produced the error
 * @param message   human-readable description
 * @param timestamp when the error was observed
 */
public record StepError(
    WorkflowNode step,
    String message,
    Instant timestamp
) implements Serializable {

    public static StepError now(WorkflowNode step, String message) {
        return new StepError(step, message, Instant.now());
    }

    @Override
    public String toString() {
        return "[" + step + "] " + message;
    }
}
