package io.promptrelay.execution;

import io.promptrelay.error.InvalidStateException;
import io.promptrelay.error.NotFoundException;
import io.promptrelay.model.PromptStatus;
import io.promptrelay.model.StepResult;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory table of running executions. A row exists from registration until the execution
 * completes, fails or is cancelled; whichever of the terminal transitions removes the row first
 * wins, later ones see an absent row.
 */
public final class ExecutionTracker {
    private final Map<String, ActiveExecution> rows = new ConcurrentHashMap<>();

    public ExecutionSnapshot register(String executionId, String documentId, int promptNumber, int totalSteps) {
        ActiveExecution row = new ActiveExecution(executionId, documentId, promptNumber, totalSteps, Instant.now());
        if (rows.putIfAbsent(executionId, row) != null) {
            throw new InvalidStateException("Execution already registered: " + executionId);
        }
        return row.snapshot();
    }

    public ExecutionSnapshot get(String executionId) {
        return find(executionId).orElseThrow(() -> NotFoundException.execution(executionId));
    }

    public Optional<ExecutionSnapshot> find(String executionId) {
        if (executionId == null) {
            return Optional.empty();
        }
        ActiveExecution row = rows.get(executionId);
        return row == null ? Optional.empty() : Optional.of(row.snapshot());
    }

    /**
     * @return false when the row is gone or already terminal; the result is then dropped
     */
    public boolean recordStepResult(String executionId, StepResult result) {
        ActiveExecution row = rows.get(executionId);
        return row != null && row.append(result);
    }

    public boolean advanceCursor(String executionId, int stepNumber) {
        ActiveExecution row = rows.get(executionId);
        return row != null && row.advanceTo(stepNumber);
    }

    /**
     * Settles the row with a terminal status and removes it.
     *
     * @return the final snapshot, or empty when another transition already removed the row
     */
    public Optional<ExecutionSnapshot> removeOnTerminal(String executionId, PromptStatus status, String error) {
        if (!status.terminal()) {
            throw new IllegalArgumentException("not a terminal status: " + status);
        }
        ActiveExecution row = rows.remove(executionId);
        if (row == null || !row.settle(status, error)) {
            return Optional.empty();
        }
        return Optional.of(row.snapshot());
    }

    public ExecutionSnapshot cancel(String executionId) {
        return removeOnTerminal(executionId, PromptStatus.CANCELLED, "cancelled")
                .orElseThrow(() -> NotFoundException.execution(executionId));
    }

    public List<ExecutionSnapshot> listActive() {
        return rows.values().stream()
                .map(ActiveExecution::snapshot)
                .sorted(Comparator.comparing(ExecutionSnapshot::startedAt).thenComparing(ExecutionSnapshot::executionId))
                .toList();
    }

    public int activeCount() {
        return rows.size();
    }
}
