package io.promptrelay.action;

import io.promptrelay.error.StepExecutionException;
import io.promptrelay.model.ActionType;
import io.promptrelay.model.ExecutionStep;

public interface ActionHandler {
    ActionType type();

    /**
     * Performs the step's side effect and returns its output text.
     *
     * @throws StepExecutionException when the operation fails; {@link StepExecutionException#retryable()}
     *                                tells the caller whether another attempt may succeed
     * @throws InterruptedException   when the step was cancelled or timed out while waiting
     */
    String execute(ExecutionStep step, StepContext context) throws InterruptedException;
}
