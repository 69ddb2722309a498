package io.promptrelay.execution;

import io.promptrelay.model.PromptStatus;
import io.promptrelay.model.StepResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable tracker row for one in-flight execution. Step results are append-only and stop being
 * accepted once the row is terminal.
 */
final class ActiveExecution {
    private final String executionId;
    private final String documentId;
    private final int promptNumber;
    private final int totalSteps;
    private final Instant startedAt;
    private final List<StepResult> stepResults = new ArrayList<>();
    private int currentStep;
    private PromptStatus status;
    private String error;

    ActiveExecution(String executionId, String documentId, int promptNumber, int totalSteps, Instant startedAt) {
        this.executionId = executionId;
        this.documentId = documentId;
        this.promptNumber = promptNumber;
        this.totalSteps = totalSteps;
        this.startedAt = startedAt;
        this.currentStep = 1;
        this.status = PromptStatus.RUNNING;
    }

    String executionId() {
        return executionId;
    }

    synchronized boolean append(StepResult result) {
        if (status.terminal()) {
            return false;
        }
        stepResults.add(result);
        return true;
    }

    synchronized boolean advanceTo(int stepNumber) {
        if (status.terminal()) {
            return false;
        }
        currentStep = stepNumber;
        return true;
    }

    synchronized boolean settle(PromptStatus terminalStatus, String error) {
        if (status.terminal()) {
            return false;
        }
        this.status = terminalStatus;
        this.error = error;
        return true;
    }

    synchronized ExecutionSnapshot snapshot() {
        return new ExecutionSnapshot(
                executionId,
                documentId,
                promptNumber,
                startedAt,
                currentStep,
                totalSteps,
                status,
                new ArrayList<>(stepResults),
                error
        );
    }
}
