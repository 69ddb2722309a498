package io.promptrelay.action;

import io.promptrelay.error.StepExecutionException;
import io.promptrelay.model.ActionType;
import io.promptrelay.model.ExecutionStep;
import io.promptrelay.model.StepAction;

import java.util.ArrayList;
import java.util.List;

public final class GitOperationHandler implements ActionHandler {
    static final String DEFAULT_COMMIT_MESSAGE = "promptrelay automated commit";

    private final ProcessRunner runner;

    public GitOperationHandler(ProcessRunner runner) {
        this.runner = runner;
    }

    @Override
    public ActionType type() {
        return ActionType.GIT_OPERATION;
    }

    @Override
    public String execute(ExecutionStep step, StepContext context) throws InterruptedException {
        StepAction.GitOperation action = (StepAction.GitOperation) step.action();
        List<String> command = command(action);
        ProcessRunner.ProcessOutcome outcome = runner.run(command, context.workingDirectory(), context.timeout());
        if (!outcome.succeeded()) {
            throw StepExecutionException.retryable(outcome.failureMessage("git " + command.get(1)));
        }
        return "Git " + command.get(1) + " completed:\n" + outcome.stdout();
    }

    static List<String> command(StepAction.GitOperation action) {
        List<String> command = new ArrayList<>();
        command.add("git");
        switch (action.operation()) {
            case INIT -> command.add("init");
            case STATUS -> command.add("status");
            case ADD -> {
                command.add("add");
                String files = action.files() == null || action.files().isBlank() ? "." : action.files();
                for (String file : files.trim().split("\\s+")) {
                    command.add(file);
                }
            }
            case COMMIT -> {
                command.add("commit");
                command.add("-m");
                command.add(action.message() == null || action.message().isBlank()
                        ? DEFAULT_COMMIT_MESSAGE
                        : action.message());
            }
        }
        return command;
    }
}
