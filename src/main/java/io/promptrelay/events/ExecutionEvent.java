package io.promptrelay.events;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionEvent(
        ExecutionEventType type,
        String executionId,
        String documentId,
        String documentTitle,
        Integer promptNumber,
        String promptTitle,
        Integer stepNumber,
        String stepDescription,
        Integer progressPercent,
        String output,
        String error,
        Map<String, Object> metadata,
        Instant timestamp
) {
    public ExecutionEvent {
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
        timestamp = timestamp == null ? Instant.now() : timestamp;
    }

    public static Builder builder(ExecutionEventType type, String executionId) {
        return new Builder(type, executionId);
    }

    public static final class Builder {
        private final ExecutionEventType type;
        private final String executionId;
        private String documentId;
        private String documentTitle;
        private Integer promptNumber;
        private String promptTitle;
        private Integer stepNumber;
        private String stepDescription;
        private Integer progressPercent;
        private String output;
        private String error;
        private final Map<String, Object> metadata = new LinkedHashMap<>();

        private Builder(ExecutionEventType type, String executionId) {
            this.type = type;
            this.executionId = executionId;
        }

        public Builder document(String documentId, String documentTitle) {
            this.documentId = documentId;
            this.documentTitle = documentTitle;
            return this;
        }

        public Builder prompt(int promptNumber, String promptTitle) {
            this.promptNumber = promptNumber;
            this.promptTitle = promptTitle;
            return this;
        }

        public Builder step(int stepNumber, String stepDescription) {
            this.stepNumber = stepNumber;
            this.stepDescription = stepDescription;
            return this;
        }

        public Builder progress(int percent) {
            this.progressPercent = Math.max(0, Math.min(100, percent));
            return this;
        }

        public Builder output(String output) {
            this.output = output;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder meta(String key, Object value) {
            if (value != null) {
                metadata.put(key, value);
            }
            return this;
        }

        public ExecutionEvent build() {
            return new ExecutionEvent(
                    type,
                    executionId,
                    documentId,
                    documentTitle,
                    promptNumber,
                    promptTitle,
                    stepNumber,
                    stepDescription,
                    progressPercent,
                    output,
                    error,
                    metadata,
                    Instant.now()
            );
        }
    }
}
