package com.sitedigest.core.steps;

import com.sitedigest.core.capability.CapabilityException;
import com.sitedigest.core.model.WorkflowNode;

import java.net.http.HttpTimeoutException;
import java.util.concurrent.TimeoutException;

/**
 * A working step could not finish.
 * <p>
 * Carries whether the failure is worth retrying and any state updates the step
 * managed to produce before failing (for example batches retrieved before the
 * failing one), so a retry resumes instead of starting over.
 */
public class StepFailure extends Exception {

    private final WorkflowNode step;
    private final boolean retryable;
    private final StepResult partial;

    public StepFailure(WorkflowNode step, String message, boolean retryable, StepResult partial, Throwable cause) {
        super(message, cause);
        this.step = step;
        this.retryable = retryable;
        this.partial = partial == null ? StepResult.empty() : partial;
    }

    public static StepFailure retryable(WorkflowNode step, String message) {
        return new StepFailure(step, message, true, null, null);
    }

    public static StepFailure terminal(WorkflowNode step, String message) {
        return new StepFailure(step, message, false, null, null);
    }

    /**
     * Wraps an exception raised by a capability call, classifying it as
     * retryable (transient) or terminal.
     */
    public static StepFailure from(WorkflowNode step, Throwable cause, StepResult partial) {
        return new StepFailure(step, describe(cause), isTransient(cause), partial, cause);
    }

    public static boolean isTransient(Throwable t) {
        if (t instanceof CapabilityException ce) {
            return ce.isRetryable();
        }
        for (Throwable c = t; c != null; c = c.getCause()) {
            if (c instanceof HttpTimeoutException || c instanceof TimeoutException
                    || c instanceof java.io.IOException) {
                return true;
            }
        }
        return false;
    }

    private static String describe(Throwable t) {
        String message = t.getMessage();
        return message != null && !message.isBlank() ? message : t.getClass().getSimpleName();
    }

    public WorkflowNode step() {
        return step;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public StepResult partial() {
        return partial;
    }
}
