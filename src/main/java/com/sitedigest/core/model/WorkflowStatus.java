package com.sitedigest.core.model;

/**
 * Status of a single workflow execution.
 */
public enum WorkflowStatus {
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
