package io.promptrelay.action;

import java.nio.file.Path;
import java.time.Duration;

public record StepContext(
        String executionId,
        String documentId,
        String documentTitle,
        int promptNumber,
        Path workingDirectory,
        Duration timeout
) {
    public Path resolve(String raw) {
        Path path = Path.of(raw);
        if (path.isAbsolute()) {
            return path.normalize();
        }
        return workingDirectory.resolve(path).normalize();
    }
}
