package io.promptrelay.action;

import io.promptrelay.error.StepExecutionException;
import io.promptrelay.model.ExecutionStep;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Routes a step to the handler registered for its action type.
 */
public final class StepDispatcher {
    private static final Logger log = LoggerFactory.getLogger(StepDispatcher.class);

    private final ActionHandlerRegistry registry;

    public StepDispatcher(ActionHandlerRegistry registry) {
        this.registry = registry;
    }

    public String dispatch(ExecutionStep step, StepContext context) throws InterruptedException {
        ActionHandler handler = registry.findByType(step.actionType())
                .orElseThrow(() -> StepExecutionException.terminal("No handler registered for action: "
                        + step.actionType().wireName()));
        log.debug("Dispatching step {} ({}) of execution {}",
                step.stepNumber(), step.actionType().wireName(), context.executionId());
        try {
            String output = handler.execute(step, context);
            return output == null ? "" : output;
        } catch (StepExecutionException | InterruptedException e) {
            throw e;
        } catch (RuntimeException e) {
            throw StepExecutionException.retryable(step.actionType().wireName() + " failed: " + e.getMessage(), e);
        }
    }
}
