package com.sitedigest.core.steps;

import com.sitedigest.core.model.StepError;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a successful (or partially successful) step execution.
 *
 * @param updates state channel updates to merge into the workflow state
 * @param skipped per-item problems that did not fail the step; the engine
 *                appends them to the error trail
 */
public record StepResult(
    Map<String, Object> updates,
    List<StepError> skipped
) {

    public StepResult {
        updates = updates == null ? Map.of() : Map.copyOf(updates);
        skipped = skipped == null ? List.of() : List.copyOf(skipped);
    }

    public static StepResult empty() {
        return new StepResult(Map.of(), List.of());
    }

    public static StepResult of(Map<String, Object> updates) {
        return new StepResult(updates, List.of());
    }
}
