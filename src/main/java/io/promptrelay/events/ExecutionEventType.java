package io.promptrelay.events;

import java.util.Locale;

public enum ExecutionEventType {
    EXECUTION_STARTED,
    STEP_COMPLETED,
    STEP_FAILED,
    EXECUTION_COMPLETED,
    EXECUTION_FAILED,
    STATUS_UPDATE;

    public String auditAction() {
        return "execution." + name().toLowerCase(Locale.ROOT);
    }
}
