package io.promptrelay.execution;

import io.promptrelay.model.PromptStatus;

import java.time.Instant;
import java.util.List;

public record SequenceSnapshot(
        String sequenceId,
        String documentId,
        List<Integer> promptNumbers,
        boolean stopOnError,
        SequenceStatus status,
        Integer currentPrompt,
        List<Entry> entries,
        Instant startedAt,
        Instant completedAt
) {
    public SequenceSnapshot {
        promptNumbers = List.copyOf(promptNumbers);
        entries = List.copyOf(entries);
    }

    public enum SequenceStatus {
        RUNNING,
        COMPLETED,
        FAILED
    }

    public record Entry(int promptNumber, String executionId, PromptStatus status, String error) {
    }
}
