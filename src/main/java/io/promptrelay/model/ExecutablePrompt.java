package io.promptrelay.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

public final class ExecutablePrompt {
    private final int number;
    private final String title;
    private final String description;
    private final List<String> requirements;
    private final Set<Integer> dependencies;
    private final Duration estimatedTime;
    private final List<String> tags;
    private final List<ExecutionStep> steps;
    private final List<PromptExecutionRecord> executions;
    private volatile PromptStatus status;

    public ExecutablePrompt(
            int number,
            String title,
            String description,
            List<String> requirements,
            Set<Integer> dependencies,
            Duration estimatedTime,
            List<String> tags,
            List<ExecutionStep> steps
    ) {
        this.number = number;
        this.title = title == null ? "" : title;
        this.description = description == null ? "" : description;
        this.requirements = requirements == null ? List.of() : List.copyOf(requirements);
        this.dependencies = dependencies == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        this.estimatedTime = estimatedTime == null ? Duration.ZERO : estimatedTime;
        this.tags = tags == null ? List.of() : List.copyOf(tags);
        List<ExecutionStep> ordered = new ArrayList<>(Objects.requireNonNull(steps, "steps"));
        ordered.sort(Comparator.comparingInt(ExecutionStep::stepNumber));
        this.steps = List.copyOf(ordered);
        this.executions = new CopyOnWriteArrayList<>();
        this.status = PromptStatus.PENDING;
    }

    public int number() {
        return number;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public List<String> requirements() {
        return requirements;
    }

    public Set<Integer> dependencies() {
        return dependencies;
    }

    public Duration estimatedTime() {
        return estimatedTime;
    }

    public List<String> tags() {
        return tags;
    }

    /**
     * Steps in ascending step-number order.
     */
    public List<ExecutionStep> steps() {
        return steps;
    }

    public Optional<ExecutionStep> step(int stepNumber) {
        return steps.stream().filter(s -> s.stepNumber() == stepNumber).findFirst();
    }

    public PromptStatus status() {
        return status;
    }

    public void status(PromptStatus status) {
        this.status = Objects.requireNonNull(status, "status");
    }

    public List<PromptExecutionRecord> executions() {
        return List.copyOf(executions);
    }

    public void recordExecution(PromptExecutionRecord record) {
        executions.add(Objects.requireNonNull(record, "record"));
    }

    public Optional<PromptExecutionRecord> lastExecution() {
        if (executions.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(executions.get(executions.size() - 1));
    }
}
