package io.promptrelay.action;

import io.promptrelay.model.StepAction;

/**
 * Seam for database-backed steps. Implementations own their connections; the dispatcher only
 * hands over the typed payload.
 */
public interface DatabaseGateway {
    String execute(StepAction.DatabaseOperation operation, StepContext context) throws InterruptedException;
}
