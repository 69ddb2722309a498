package io.promptrelay.action;

import io.promptrelay.error.StepExecutionException;
import io.promptrelay.model.ActionType;
import io.promptrelay.model.ExecutionStep;
import io.promptrelay.model.StepAction;

import java.nio.file.Files;
import java.nio.file.Path;

public final class ValidationHandler implements ActionHandler {
    @Override
    public ActionType type() {
        return ActionType.VALIDATION;
    }

    @Override
    public String execute(ExecutionStep step, StepContext context) {
        StepAction.Validation action = (StepAction.Validation) step.action();
        return switch (action.validationType()) {
            case FILE_EXISTS -> fileExists(context.resolve(action.target()));
        };
    }

    private static String fileExists(Path target) {
        if (!Files.exists(target)) {
            throw StepExecutionException.retryable("Validation failed: " + target + " does not exist");
        }
        return "Validation passed: " + target + " exists";
    }
}
