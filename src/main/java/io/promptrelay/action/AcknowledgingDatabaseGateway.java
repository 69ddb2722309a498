package io.promptrelay.action;

import io.promptrelay.model.StepAction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AcknowledgingDatabaseGateway implements DatabaseGateway {
    private static final Logger log = LoggerFactory.getLogger(AcknowledgingDatabaseGateway.class);

    @Override
    public String execute(StepAction.DatabaseOperation operation, StepContext context) {
        log.info("No database driver configured; acknowledging {} operation for execution {}",
                operation.operation(), context.executionId());
        return "Database " + operation.operation() + " operation acknowledged";
    }
}
