package io.promptrelay.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class LoggingEventSubscriber implements EventSubscriber {
    private static final Logger log = LoggerFactory.getLogger(LoggingEventSubscriber.class);

    @Override
    public void onEvent(ExecutionEvent event) {
        switch (event.type()) {
            case EXECUTION_STARTED -> log.info("Execution {} started: prompt {} '{}' of {}",
                    event.executionId(), event.promptNumber(), event.promptTitle(), event.documentTitle());
            case STEP_COMPLETED -> log.info("Execution {} step {} completed ({}%)",
                    event.executionId(), event.stepNumber(), event.progressPercent());
            case STEP_FAILED -> log.warn("Execution {} step {} failed (attempt {}): {}",
                    event.executionId(), event.stepNumber(), event.metadata().get("attempt"), event.error());
            case EXECUTION_COMPLETED -> log.info("Execution {} completed: prompt {}",
                    event.executionId(), event.promptNumber());
            case EXECUTION_FAILED -> log.error("Execution {} failed: prompt {}: {}",
                    event.executionId(), event.promptNumber(), event.error());
            case STATUS_UPDATE -> log.info("Execution {} status update: {}",
                    event.executionId(), event.metadata().get("status"));
        }
    }
}
