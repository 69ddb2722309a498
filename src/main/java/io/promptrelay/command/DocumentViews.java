package io.promptrelay.command;

import io.promptrelay.execution.DependencyGate;
import io.promptrelay.model.ExecutablePrompt;
import io.promptrelay.model.PromptDocument;
import io.promptrelay.model.PromptExecutionRecord;
import io.promptrelay.model.PromptStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Read-only projections of documents for responses and the CLI.
 */
public final class DocumentViews {
    private DocumentViews() {
    }

    public static DocumentSummary summary(PromptDocument document, boolean active) {
        long completed = document.prompts().stream().filter(p -> p.status() == PromptStatus.COMPLETED).count();
        return new DocumentSummary(
                document.id(),
                document.title(),
                document.sourcePath().map(Object::toString).orElse(null),
                document.metadata().promptCount(),
                (int) completed,
                active,
                document.createdAt()
        );
    }

    public static DocumentInfo info(PromptDocument document) {
        Map<Integer, DependencyGate.PromptReadiness> readiness = DependencyGate.readiness(document).stream()
                .collect(Collectors.toMap(DependencyGate.PromptReadiness::promptNumber, Function.identity()));
        List<PromptInfo> prompts = new ArrayList<>();
        for (ExecutablePrompt prompt : document.prompts()) {
            DependencyGate.PromptReadiness r = readiness.get(prompt.number());
            prompts.add(new PromptInfo(
                    prompt.number(),
                    prompt.title(),
                    prompt.description(),
                    prompt.status(),
                    prompt.dependencies().stream().sorted().toList(),
                    prompt.steps().size(),
                    prompt.estimatedTime().toMinutes(),
                    prompt.tags(),
                    r != null && r.ready(),
                    r == null ? List.of() : r.blockedBy(),
                    prompt.lastExecution().map(PromptExecutionRecord::executionId).orElse(null)
            ));
        }
        return new DocumentInfo(
                document.id(),
                document.title(),
                document.sourcePath().map(Object::toString).orElse(null),
                document.metadata().version(),
                document.metadata().author(),
                document.metadata().project(),
                document.metadata().tags(),
                document.metadata().totalEstimatedTime().toMinutes(),
                document.createdAt(),
                prompts
        );
    }

    public record DocumentSummary(
            String id,
            String title,
            String sourcePath,
            int promptCount,
            int completedPrompts,
            boolean active,
            Instant createdAt
    ) {
    }

    public record DocumentInfo(
            String id,
            String title,
            String sourcePath,
            String version,
            String author,
            String project,
            List<String> tags,
            long totalEstimatedMinutes,
            Instant createdAt,
            List<PromptInfo> prompts
    ) {
    }

    public record PromptInfo(
            int number,
            String title,
            String description,
            PromptStatus status,
            List<Integer> dependencies,
            int stepCount,
            long estimatedMinutes,
            List<String> tags,
            boolean ready,
            List<Integer> blockedBy,
            String lastExecutionId
    ) {
    }
}
