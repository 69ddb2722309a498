package io.promptrelay.model;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public final class PromptDocument {
    private final String id;
    private final String title;
    private final Path sourcePath;
    private final List<ExecutablePrompt> prompts;
    private final DocumentMetadata metadata;
    private final Instant createdAt;

    public PromptDocument(
            String id,
            String title,
            Path sourcePath,
            List<ExecutablePrompt> prompts,
            DocumentMetadata metadata,
            Instant createdAt
    ) {
        this.id = Objects.requireNonNull(id, "id");
        this.title = title == null ? "" : title;
        this.sourcePath = sourcePath;
        this.prompts = List.copyOf(Objects.requireNonNull(prompts, "prompts"));
        this.metadata = Objects.requireNonNull(metadata, "metadata");
        this.createdAt = createdAt == null ? Instant.now() : createdAt;
    }

    public String id() {
        return id;
    }

    public String title() {
        return title;
    }

    public Optional<Path> sourcePath() {
        return Optional.ofNullable(sourcePath);
    }

    public List<ExecutablePrompt> prompts() {
        return prompts;
    }

    public Optional<ExecutablePrompt> prompt(int number) {
        for (ExecutablePrompt prompt : prompts) {
            if (prompt.number() == number) {
                return Optional.of(prompt);
            }
        }
        return Optional.empty();
    }

    public DocumentMetadata metadata() {
        return metadata;
    }

    public Instant createdAt() {
        return createdAt;
    }
}
