package io.promptrelay.model;

import java.time.Duration;
import java.util.List;

public record DocumentMetadata(
        int promptCount,
        Duration totalEstimatedTime,
        String version,
        String author,
        String project,
        List<String> tags
) {
    public DocumentMetadata {
        totalEstimatedTime = totalEstimatedTime == null ? Duration.ZERO : totalEstimatedTime;
        version = version == null || version.isBlank() ? "1.0" : version;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
