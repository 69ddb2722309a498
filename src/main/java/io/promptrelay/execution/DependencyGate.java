package io.promptrelay.execution;

import io.promptrelay.error.InvalidDocumentException;
import io.promptrelay.error.UnsatisfiedDependencyException;
import io.promptrelay.model.ExecutablePrompt;
import io.promptrelay.model.PromptDocument;
import io.promptrelay.model.PromptStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides whether a prompt may start. Read-only: never changes a status.
 */
public final class DependencyGate {
    private DependencyGate() {
    }

    /**
     * Fails on the first dependency that has not completed, in ascending dependency order.
     *
     * @throws UnsatisfiedDependencyException when a dependency is not {@link PromptStatus#COMPLETED}
     * @throws InvalidDocumentException       when a dependency number names no prompt in the document
     */
    public static void validate(PromptDocument document, ExecutablePrompt prompt) {
        for (int dependency : prompt.dependencies().stream().sorted().toList()) {
            ExecutablePrompt required = document.prompt(dependency).orElseThrow(() -> new InvalidDocumentException(
                    "Prompt " + prompt.number() + " of document " + document.id()
                            + " depends on missing prompt " + dependency));
            if (required.status() != PromptStatus.COMPLETED) {
                throw new UnsatisfiedDependencyException(prompt.number(), dependency, required.status());
            }
        }
    }

    public static List<PromptReadiness> readiness(PromptDocument document) {
        List<PromptReadiness> out = new ArrayList<>();
        for (ExecutablePrompt prompt : document.prompts()) {
            List<Integer> blockedBy = new ArrayList<>();
            for (int dependency : prompt.dependencies().stream().sorted().toList()) {
                PromptStatus status = document.prompt(dependency)
                        .map(ExecutablePrompt::status)
                        .orElse(null);
                if (status != PromptStatus.COMPLETED) {
                    blockedBy.add(dependency);
                }
            }
            boolean ready = blockedBy.isEmpty() && prompt.status() != PromptStatus.RUNNING;
            out.add(new PromptReadiness(prompt.number(), prompt.title(), prompt.status(), ready, blockedBy));
        }
        return out;
    }

    public record PromptReadiness(
            int promptNumber,
            String title,
            PromptStatus status,
            boolean ready,
            List<Integer> blockedBy
    ) {
        public PromptReadiness {
            blockedBy = List.copyOf(blockedBy);
        }
    }
}
