package io.promptrelay.error;

import io.promptrelay.model.PromptStatus;

public final class UnsatisfiedDependencyException extends PromptRelayException {
    private final int promptNumber;
    private final int dependencyNumber;
    private final PromptStatus dependencyStatus;

    public UnsatisfiedDependencyException(int promptNumber, int dependencyNumber, PromptStatus dependencyStatus) {
        super(
                ErrorKind.UNSATISFIED_DEPENDENCY,
                "Dependency not satisfied: prompt " + dependencyNumber + " (status: " + dependencyStatus
                        + ") must be completed before prompt " + promptNumber
        );
        this.promptNumber = promptNumber;
        this.dependencyNumber = dependencyNumber;
        this.dependencyStatus = dependencyStatus;
    }

    public int promptNumber() {
        return promptNumber;
    }

    public int dependencyNumber() {
        return dependencyNumber;
    }

    public PromptStatus dependencyStatus() {
        return dependencyStatus;
    }
}
