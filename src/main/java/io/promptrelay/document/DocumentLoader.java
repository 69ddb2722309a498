package io.promptrelay.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.promptrelay.error.InvalidDocumentException;
import io.promptrelay.model.ActionType;
import io.promptrelay.model.PromptDocument;
import io.promptrelay.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Reads a structured plan (the parser's JSON output) into a validated {@link PromptDocument}.
 */
public final class DocumentLoader {
    private DocumentLoader() {
    }

    public static PromptDocument load(Path path) {
        if (path == null || !Files.isRegularFile(path)) {
            throw new InvalidDocumentException("Plan file not found: " + path);
        }
        try {
            String json = Files.readString(path, StandardCharsets.UTF_8);
            return parse(json, path.toAbsolutePath().normalize());
        } catch (IOException e) {
            throw new InvalidDocumentException("Failed to read plan file: " + path, e);
        }
    }

    public static PromptDocument parse(String json, Path sourcePath) {
        PlanFile plan;
        try {
            plan = Jsons.mapper().readValue(json, PlanFile.class);
        } catch (JsonProcessingException e) {
            throw new InvalidDocumentException("Malformed plan JSON: " + e.getOriginalMessage(), e);
        }
        if (plan == null || plan.prompts() == null || plan.prompts().isEmpty()) {
            throw new InvalidDocumentException("Plan must contain at least one prompt");
        }
        DocumentBuilder builder = DocumentBuilder.document(plan.title())
                .id(plan.id())
                .sourcePath(sourcePath)
                .version(plan.version())
                .author(plan.author())
                .project(plan.project())
                .tags(plan.tags());
        for (PromptEntry entry : plan.prompts()) {
            if (entry.number() == null) {
                throw new InvalidDocumentException("Prompt entry without number: " + entry.title());
            }
            DocumentBuilder.PromptSpec spec = builder.prompt(entry.number(), entry.title())
                    .description(entry.description())
                    .requirements(entry.requirements())
                    .dependsOn(entry.dependencies())
                    .estimatedTime(Duration.ofMinutes(entry.estimatedMinutes() == null ? 0L : Math.max(0L, entry.estimatedMinutes())))
                    .tags(entry.tags());
            List<StepEntry> steps = entry.steps() == null ? List.of() : entry.steps();
            int position = 0;
            for (StepEntry step : steps) {
                position++;
                int stepNumber = step.stepNumber() == null ? position : step.stepNumber();
                if (stepNumber < 1) {
                    throw new InvalidDocumentException(
                            "Step numbers must be >= 1 (prompt " + entry.number() + ")"
                    );
                }
                ActionType type;
                try {
                    type = ActionType.fromString(step.action());
                } catch (IllegalArgumentException e) {
                    throw new InvalidDocumentException(
                            "Prompt " + entry.number() + " step " + stepNumber + ": " + e.getMessage(), e
                    );
                }
                spec.step(stepNumber, step.description(), type, step.parameters() == null ? Map.of() : step.parameters());
            }
        }
        return builder.build();
    }

    private record PlanFile(
            String id,
            String title,
            String version,
            String author,
            String project,
            List<String> tags,
            List<PromptEntry> prompts
    ) {
    }

    private record PromptEntry(
            Integer number,
            String title,
            String description,
            List<String> requirements,
            List<Integer> dependencies,
            Long estimatedMinutes,
            List<String> tags,
            List<StepEntry> steps
    ) {
    }

    private record StepEntry(
            Integer stepNumber,
            String description,
            String action,
            Map<String, String> parameters
    ) {
    }
}
