package io.promptrelay.action;

import io.promptrelay.error.StepExecutionException;
import io.promptrelay.model.ActionType;
import io.promptrelay.model.ExecutionStep;
import io.promptrelay.model.StepAction;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends to an existing file. Without explicit content a marker line naming the step is
 * appended; richer edits belong to a dedicated handler registered for this type.
 */
public final class ModifyFileHandler implements ActionHandler {
    @Override
    public ActionType type() {
        return ActionType.MODIFY_FILE;
    }

    @Override
    public String execute(ExecutionStep step, StepContext context) {
        StepAction.ModifyFile action = (StepAction.ModifyFile) step.action();
        Path target = context.resolve(action.file());
        if (!Files.isRegularFile(target)) {
            throw StepExecutionException.terminal("File does not exist: " + target);
        }
        String appended = action.content() != null
                ? action.content()
                : "\n// Modified by promptrelay: " + step.description() + "\n";
        try {
            Files.writeString(target, appended, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw StepExecutionException.retryable("failed to modify file " + target + ": " + e.getMessage(), e);
        }
        return "Modified file: " + target;
    }
}
