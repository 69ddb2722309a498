package io.promptrelay.action;

import io.promptrelay.error.StepExecutionException;
import io.promptrelay.model.ActionType;
import io.promptrelay.model.ExecutionStep;
import io.promptrelay.model.StepAction;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class CreateDirectoryHandler implements ActionHandler {
    @Override
    public ActionType type() {
        return ActionType.CREATE_DIRECTORY;
    }

    @Override
    public String execute(ExecutionStep step, StepContext context) {
        StepAction.CreateDirectory action = (StepAction.CreateDirectory) step.action();
        Path target = context.resolve(action.directory());
        try {
            Files.createDirectories(target);
        } catch (FileAlreadyExistsException e) {
            throw StepExecutionException.terminal("path exists and is not a directory: " + target, e);
        } catch (IOException e) {
            throw StepExecutionException.retryable("failed to create directory " + target + ": " + e.getMessage(), e);
        }
        return "Created directory: " + target;
    }
}
