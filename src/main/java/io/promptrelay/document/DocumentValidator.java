package io.promptrelay.document;

import io.promptrelay.error.InvalidDocumentException;
import io.promptrelay.model.ExecutablePrompt;
import io.promptrelay.model.ExecutionStep;
import io.promptrelay.model.PromptDocument;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Structural checks every document must pass before any of its prompts may run.
 */
public final class DocumentValidator {
    private DocumentValidator() {
    }

    public static void validate(PromptDocument document) {
        validatePrompts(document.id(), document.prompts());
    }

    static void validatePrompts(String documentId, List<ExecutablePrompt> prompts) {
        Set<Integer> numbers = new HashSet<>();
        for (ExecutablePrompt prompt : prompts) {
            if (prompt.number() < 1) {
                throw new InvalidDocumentException("Prompt numbers must be >= 1 in document " + documentId);
            }
            if (!numbers.add(prompt.number())) {
                throw new InvalidDocumentException(
                        "Duplicate prompt number " + prompt.number() + " in document " + documentId
                );
            }
        }
        for (ExecutablePrompt prompt : prompts) {
            validateDependencies(documentId, prompt, numbers);
            validateSteps(documentId, prompt);
        }
    }

    public static void validateDependencies(String documentId, ExecutablePrompt prompt, Set<Integer> promptNumbers) {
        for (Integer dependency : prompt.dependencies()) {
            if (dependency == null) {
                throw new InvalidDocumentException("Prompt " + prompt.number() + " has a null dependency");
            }
            if (dependency >= prompt.number()) {
                throw new InvalidDocumentException(
                        "Prompt " + prompt.number() + " depends on prompt " + dependency
                                + "; dependencies must reference lower-numbered prompts"
                );
            }
            if (!promptNumbers.contains(dependency)) {
                throw new InvalidDocumentException(
                        "Prompt " + prompt.number() + " depends on missing prompt " + dependency
                                + " in document " + documentId
                );
            }
        }
    }

    /**
     * Steps are held in ascending order, so numbering must read 1..N with no gaps.
     */
    private static void validateSteps(String documentId, ExecutablePrompt prompt) {
        Set<Integer> stepNumbers = new HashSet<>();
        int expected = 1;
        for (ExecutionStep step : prompt.steps()) {
            if (!stepNumbers.add(step.stepNumber())) {
                throw new InvalidDocumentException(
                        "Duplicate step number " + step.stepNumber() + " in prompt " + prompt.number()
                                + " of document " + documentId
                );
            }
            if (step.stepNumber() != expected) {
                throw new InvalidDocumentException(
                        "Step numbers of prompt " + prompt.number() + " in document " + documentId
                                + " must run 1.." + prompt.steps().size() + " without gaps; found " + step.stepNumber()
                                + " where " + expected + " was expected"
                );
            }
            expected++;
        }
    }
}
