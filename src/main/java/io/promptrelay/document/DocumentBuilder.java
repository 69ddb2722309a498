package io.promptrelay.document;

import io.promptrelay.model.ActionType;
import io.promptrelay.model.DocumentMetadata;
import io.promptrelay.model.ExecutablePrompt;
import io.promptrelay.model.ExecutionStep;
import io.promptrelay.model.PromptDocument;
import io.promptrelay.model.StepAction;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Assembles a {@link PromptDocument} from already-extracted plan data and validates it.
 */
public final class DocumentBuilder {
    private String id;
    private String title;
    private Path sourcePath;
    private String version;
    private String author;
    private String project;
    private final List<String> tags = new ArrayList<>();
    private final List<PromptSpec> prompts = new ArrayList<>();

    public static DocumentBuilder document(String title) {
        DocumentBuilder builder = new DocumentBuilder();
        builder.title = title;
        return builder;
    }

    public DocumentBuilder id(String id) {
        this.id = id;
        return this;
    }

    public DocumentBuilder sourcePath(Path sourcePath) {
        this.sourcePath = sourcePath;
        return this;
    }

    public DocumentBuilder version(String version) {
        this.version = version;
        return this;
    }

    public DocumentBuilder author(String author) {
        this.author = author;
        return this;
    }

    public DocumentBuilder project(String project) {
        this.project = project;
        return this;
    }

    public DocumentBuilder tags(List<String> tags) {
        if (tags != null) {
            this.tags.addAll(tags);
        }
        return this;
    }

    public PromptSpec prompt(int number, String title) {
        PromptSpec spec = new PromptSpec(this, number, title);
        prompts.add(spec);
        return spec;
    }

    public PromptDocument build() {
        String resolvedId = id == null || id.isBlank() ? "doc_" + UUID.randomUUID() : id.trim();
        List<ExecutablePrompt> built = new ArrayList<>(prompts.size());
        Duration total = Duration.ZERO;
        Set<String> allTags = new LinkedHashSet<>(tags);
        for (PromptSpec spec : prompts) {
            ExecutablePrompt prompt = spec.toPrompt();
            built.add(prompt);
            total = total.plus(prompt.estimatedTime());
            allTags.addAll(prompt.tags());
        }
        DocumentValidator.validatePrompts(resolvedId, built);
        DocumentMetadata metadata = new DocumentMetadata(
                built.size(),
                total,
                version,
                author,
                project,
                List.copyOf(allTags)
        );
        return new PromptDocument(resolvedId, title, sourcePath, built, metadata, Instant.now());
    }

    public static final class PromptSpec {
        private final DocumentBuilder parent;
        private final int number;
        private final String title;
        private String description;
        private final List<String> requirements = new ArrayList<>();
        private final Set<Integer> dependencies = new LinkedHashSet<>();
        private Duration estimatedTime = Duration.ZERO;
        private final List<String> tags = new ArrayList<>();
        private final List<ExecutionStep> steps = new ArrayList<>();

        private PromptSpec(DocumentBuilder parent, int number, String title) {
            this.parent = parent;
            this.number = number;
            this.title = title;
        }

        public PromptSpec description(String description) {
            this.description = description;
            return this;
        }

        public PromptSpec requirements(List<String> requirements) {
            if (requirements != null) {
                this.requirements.addAll(requirements);
            }
            return this;
        }

        public PromptSpec dependsOn(Integer... numbers) {
            for (Integer n : numbers) {
                dependencies.add(n);
            }
            return this;
        }

        public PromptSpec dependsOn(List<Integer> numbers) {
            if (numbers != null) {
                dependencies.addAll(numbers);
            }
            return this;
        }

        public PromptSpec estimatedTime(Duration estimatedTime) {
            this.estimatedTime = estimatedTime == null ? Duration.ZERO : estimatedTime;
            return this;
        }

        public PromptSpec tags(List<String> tags) {
            if (tags != null) {
                this.tags.addAll(tags);
            }
            return this;
        }

        public PromptSpec step(String description, StepAction action) {
            steps.add(new ExecutionStep(steps.size() + 1, description, action, null));
            return this;
        }

        public PromptSpec step(int stepNumber, String description, StepAction action, String expectedOutput) {
            steps.add(new ExecutionStep(stepNumber, description, action, expectedOutput));
            return this;
        }

        /**
         * Adds a step from untyped named parameters; missing or unknown values fail here.
         */
        public PromptSpec step(int stepNumber, String description, ActionType type, Map<String, String> parameters) {
            steps.add(new ExecutionStep(stepNumber, description, StepActions.fromParameters(type, parameters), null));
            return this;
        }

        public PromptSpec prompt(int number, String title) {
            return parent.prompt(number, title);
        }

        public DocumentBuilder done() {
            return parent;
        }

        public PromptDocument build() {
            return parent.build();
        }

        private ExecutablePrompt toPrompt() {
            return new ExecutablePrompt(number, title, description, requirements, dependencies, estimatedTime, tags, steps);
        }
    }
}
