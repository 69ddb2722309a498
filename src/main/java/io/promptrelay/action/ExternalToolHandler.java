package io.promptrelay.action;

import io.promptrelay.error.StepExecutionException;
import io.promptrelay.model.ActionType;
import io.promptrelay.model.ExecutionStep;
import io.promptrelay.model.StepAction;

import java.util.List;

/**
 * Drives an editor-style command line tool ({@code code} by default).
 */
public final class ExternalToolHandler implements ActionHandler {
    private final ProcessRunner runner;
    private final String toolCommand;

    public ExternalToolHandler(ProcessRunner runner, String toolCommand) {
        if (toolCommand == null || toolCommand.isBlank()) {
            throw new IllegalArgumentException("external tool command cannot be empty");
        }
        this.runner = runner;
        this.toolCommand = toolCommand.trim();
    }

    @Override
    public ActionType type() {
        return ActionType.EXTERNAL_TOOL_ACTION;
    }

    @Override
    public String execute(ExecutionStep step, StepContext context) throws InterruptedException {
        StepAction.ExternalToolAction action = (StepAction.ExternalToolAction) step.action();
        List<String> command = switch (action.action()) {
            case OPEN -> List.of(toolCommand, context.resolve(action.path()).toString());
            case INSTALL_EXTENSION -> List.of(toolCommand, "--install-extension", action.extension());
        };
        ProcessRunner.ProcessOutcome outcome = runner.run(command, context.workingDirectory(), context.timeout());
        if (!outcome.succeeded()) {
            throw StepExecutionException.retryable(outcome.failureMessage(toolCommand));
        }
        return switch (action.action()) {
            case OPEN -> "Opened " + action.path() + " in " + toolCommand;
            case INSTALL_EXTENSION -> "Installed extension: " + action.extension();
        };
    }
}
