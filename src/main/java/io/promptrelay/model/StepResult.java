package io.promptrelay.model;

import java.time.Duration;

public record StepResult(
        int stepNumber,
        int attempt,
        StepStatus status,
        String output,
        String error,
        FailureKind failureKind,
        Duration duration
) {
    public enum FailureKind {
        RETRYABLE,
        TERMINAL
    }

    public static StepResult completed(int stepNumber, int attempt, String output, Duration duration) {
        return new StepResult(stepNumber, attempt, StepStatus.COMPLETED, output == null ? "" : output, null, null, duration);
    }

    public static StepResult failed(int stepNumber, int attempt, String error, boolean retryable, Duration duration) {
        return new StepResult(
                stepNumber,
                attempt,
                StepStatus.FAILED,
                "",
                error,
                retryable ? FailureKind.RETRYABLE : FailureKind.TERMINAL,
                duration
        );
    }

    public boolean succeeded() {
        return status == StepStatus.COMPLETED;
    }
}
