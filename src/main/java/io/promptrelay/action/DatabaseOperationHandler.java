package io.promptrelay.action;

import io.promptrelay.model.ActionType;
import io.promptrelay.model.ExecutionStep;
import io.promptrelay.model.StepAction;

public final class DatabaseOperationHandler implements ActionHandler {
    private final DatabaseGateway gateway;

    public DatabaseOperationHandler(DatabaseGateway gateway) {
        this.gateway = gateway;
    }

    @Override
    public ActionType type() {
        return ActionType.DATABASE_OPERATION;
    }

    @Override
    public String execute(ExecutionStep step, StepContext context) throws InterruptedException {
        return gateway.execute((StepAction.DatabaseOperation) step.action(), context);
    }
}
