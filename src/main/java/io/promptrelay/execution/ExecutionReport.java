package io.promptrelay.execution;

import io.promptrelay.model.PromptStatus;
import io.promptrelay.model.StepResult;

import java.time.Instant;
import java.util.List;

/**
 * Final outcome of an execution, available after its tracker row is gone.
 */
public record ExecutionReport(
        String executionId,
        String documentId,
        int promptNumber,
        PromptStatus status,
        String output,
        String error,
        List<StepResult> stepResults,
        Instant startedAt,
        Instant completedAt
) {
    public ExecutionReport {
        stepResults = List.copyOf(stepResults);
    }

    public List<StepResult> completedSteps() {
        return stepResults.stream().filter(StepResult::succeeded).toList();
    }

    public long failedAttempts() {
        return stepResults.stream().filter(r -> !r.succeeded()).count();
    }
}
