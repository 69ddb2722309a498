package io.promptrelay.action;

import io.promptrelay.error.StepExecutionException;
import io.promptrelay.model.ActionType;
import io.promptrelay.model.ExecutionStep;
import io.promptrelay.model.StepAction;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AccessDeniedException;
import java.nio.file.FileSystemException;
import java.nio.file.Files;
import java.nio.file.Path;

public final class CreateFileHandler implements ActionHandler {
    @Override
    public ActionType type() {
        return ActionType.CREATE_FILE;
    }

    @Override
    public String execute(ExecutionStep step, StepContext context) {
        StepAction.CreateFile action = (StepAction.CreateFile) step.action();
        Path target = context.resolve(action.file());
        String content = action.content() != null
                ? action.content()
                : defaultContent(context.documentTitle(), step.description());
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (AccessDeniedException e) {
            throw StepExecutionException.terminal("path is not writable: " + target, e);
        } catch (FileSystemException e) {
            // Not-a-directory, read-only file system and friends will not heal on retry.
            throw StepExecutionException.terminal("cannot write file " + target + ": " + e.getMessage(), e);
        } catch (IOException e) {
            throw StepExecutionException.retryable("failed to write file " + target + ": " + e.getMessage(), e);
        }
        return "Created file: " + target;
    }

    static String defaultContent(String documentTitle, String stepDescription) {
        return "// Generated by promptrelay for " + documentTitle + "\n"
                + "// Step: " + stepDescription + "\n";
    }
}
