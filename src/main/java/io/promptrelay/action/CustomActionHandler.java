package io.promptrelay.action;

import io.promptrelay.model.ActionType;
import io.promptrelay.model.ExecutionStep;
import io.promptrelay.model.StepAction;

public final class CustomActionHandler implements ActionHandler {
    @Override
    public ActionType type() {
        return ActionType.CUSTOM;
    }

    @Override
    public String execute(ExecutionStep step, StepContext context) {
        StepAction.Custom action = (StepAction.Custom) step.action();
        return "Custom action '" + action.name() + "' executed: " + step.description();
    }
}
