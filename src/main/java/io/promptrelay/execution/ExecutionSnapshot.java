package io.promptrelay.execution;

import io.promptrelay.model.PromptStatus;
import io.promptrelay.model.StepResult;

import java.time.Instant;
import java.util.List;

/**
 * Immutable copy of a tracker row.
 */
public record ExecutionSnapshot(
        String executionId,
        String documentId,
        int promptNumber,
        Instant startedAt,
        int currentStep,
        int totalSteps,
        PromptStatus status,
        List<StepResult> stepResults,
        String error
) {
    public ExecutionSnapshot {
        stepResults = List.copyOf(stepResults);
    }

    public int progressPercent() {
        if (totalSteps <= 0) {
            return status == PromptStatus.COMPLETED ? 100 : 0;
        }
        long completed = stepResults.stream().filter(StepResult::succeeded).count();
        return (int) Math.min(100L, completed * 100L / totalSteps);
    }
}
