package io.promptrelay.model;

import java.time.Instant;
import java.util.List;

/**
 * Settled outcome of one execution, kept on the prompt after the tracker row is gone.
 */
public record PromptExecutionRecord(
        String executionId,
        Instant startedAt,
        Instant completedAt,
        PromptStatus status,
        String output,
        String error,
        List<StepResult> stepResults
) {
    public PromptExecutionRecord {
        stepResults = stepResults == null ? List.of() : List.copyOf(stepResults);
    }
}
