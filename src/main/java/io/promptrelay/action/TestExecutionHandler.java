package io.promptrelay.action;

import io.promptrelay.error.StepExecutionException;
import io.promptrelay.model.ActionType;
import io.promptrelay.model.ExecutionStep;
import io.promptrelay.model.StepAction;

public final class TestExecutionHandler implements ActionHandler {
    private final ProcessRunner runner;

    public TestExecutionHandler(ProcessRunner runner) {
        this.runner = runner;
    }

    @Override
    public ActionType type() {
        return ActionType.TEST_EXECUTION;
    }

    @Override
    public String execute(ExecutionStep step, StepContext context) throws InterruptedException {
        StepAction.TestExecution action = (StepAction.TestExecution) step.action();
        ProcessRunner.ProcessOutcome outcome = runner.runShell(action.command(), context.workingDirectory(), context.timeout());
        if (!outcome.succeeded()) {
            throw StepExecutionException.retryable(outcome.failureMessage("tests failed:"));
        }
        return "Tests passed:\n" + outcome.stdout();
    }
}
