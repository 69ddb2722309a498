package io.promptrelay.action;

import io.promptrelay.error.StepExecutionException;
import io.promptrelay.model.ActionType;
import io.promptrelay.model.ExecutionStep;
import io.promptrelay.model.StepAction;

public final class ExecuteCommandHandler implements ActionHandler {
    private final ProcessRunner runner;

    public ExecuteCommandHandler(ProcessRunner runner) {
        this.runner = runner;
    }

    @Override
    public ActionType type() {
        return ActionType.EXECUTE_COMMAND;
    }

    @Override
    public String execute(ExecutionStep step, StepContext context) throws InterruptedException {
        StepAction.ExecuteCommand action = (StepAction.ExecuteCommand) step.action();
        ProcessRunner.ProcessOutcome outcome = runner.runShell(action.command(), context.workingDirectory(), context.timeout());
        if (!outcome.succeeded()) {
            throw StepExecutionException.retryable(outcome.failureMessage("command"));
        }
        return outcome.stdout();
    }
}
