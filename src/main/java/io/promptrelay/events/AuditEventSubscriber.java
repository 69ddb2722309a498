package io.promptrelay.events;

import io.promptrelay.observability.AuditLogger;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Writes every event to the hash-chained audit trail. The last row for an execution id is the
 * durable record of how it ended.
 */
public final class AuditEventSubscriber implements EventSubscriber {
    private final AuditLogger auditLogger;

    public AuditEventSubscriber(AuditLogger auditLogger) {
        this.auditLogger = auditLogger;
    }

    @Override
    public void onEvent(ExecutionEvent event) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("document_title", event.documentTitle());
        details.put("prompt_title", event.promptTitle());
        if (event.stepDescription() != null) {
            details.put("step_description", event.stepDescription());
        }
        if (event.progressPercent() != null) {
            details.put("progress_percent", event.progressPercent());
        }
        if (event.output() != null) {
            details.put("output", event.output());
        }
        if (event.error() != null) {
            details.put("error", event.error());
        }
        details.putAll(event.metadata());
        auditLogger.log(AuditLogger.AuditEvent.of(
                event.type().auditAction(),
                "executor",
                "document:" + event.documentId() + "/prompt:" + event.promptNumber(),
                result(event),
                event.executionId(),
                event.stepNumber(),
                details
        ));
    }

    private static String result(ExecutionEvent event) {
        return switch (event.type()) {
            case EXECUTION_STARTED -> "started";
            case STEP_COMPLETED, EXECUTION_COMPLETED -> "ok";
            case STEP_FAILED, EXECUTION_FAILED -> "failed";
            case STATUS_UPDATE -> String.valueOf(event.metadata().getOrDefault("status", "updated")).toLowerCase(Locale.ROOT);
        };
    }
}
