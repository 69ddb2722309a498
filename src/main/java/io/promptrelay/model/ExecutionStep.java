package io.promptrelay.model;

import java.util.Objects;

public final class ExecutionStep {
    private final int stepNumber;
    private final String description;
    private final StepAction action;
    private final String expectedOutput;
    private volatile StepStatus status;

    public ExecutionStep(int stepNumber, String description, StepAction action, String expectedOutput) {
        if (stepNumber < 1) {
            throw new IllegalArgumentException("step number must be >= 1: " + stepNumber);
        }
        this.stepNumber = stepNumber;
        this.description = description == null ? "" : description;
        this.action = Objects.requireNonNull(action, "action");
        this.expectedOutput = expectedOutput;
        this.status = StepStatus.PENDING;
    }

    public int stepNumber() {
        return stepNumber;
    }

    public String description() {
        return description;
    }

    public StepAction action() {
        return action;
    }

    public ActionType actionType() {
        return action.type();
    }

    public String expectedOutput() {
        return expectedOutput;
    }

    public StepStatus status() {
        return status;
    }

    public void status(StepStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }
}
