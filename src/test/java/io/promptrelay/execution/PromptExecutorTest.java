package io.promptrelay.execution;

import io.promptrelay.action.ActionHandlerRegistry;
import io.promptrelay.action.StepDispatcher;
import io.promptrelay.config.PromptRelayConfig;
import io.promptrelay.document.DocumentBuilder;
import io.promptrelay.document.DocumentStore;
import io.promptrelay.error.InvalidStateException;
import io.promptrelay.error.NotFoundException;
import io.promptrelay.error.UnsatisfiedDependencyException;
import io.promptrelay.events.EventBus;
import io.promptrelay.events.EventSubscriber;
import io.promptrelay.events.ExecutionEvent;
import io.promptrelay.events.ExecutionEventType;
import io.promptrelay.model.PromptDocument;
import io.promptrelay.model.PromptStatus;
import io.promptrelay.model.StepAction;
import io.promptrelay.model.StepResult;
import io.promptrelay.runtime.PromptRelayRuntime;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

final class PromptExecutorTest {

    @Test
    void dependentPromptIsRejectedUntilItsDependencyCompletes() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-deps-");
        try (PromptRelayRuntime runtime = new PromptRelayRuntime(config(root).build())) {
            Recorder recorder = new Recorder();
            runtime.events().subscribe(recorder);
            PromptDocument document = runtime.documents().add(DocumentBuilder.document("Deps")
                    .prompt(1, "First")
                    .step("write a", new StepAction.CreateFile("a.txt", "a"))
                    .prompt(2, "Second").dependsOn(1)
                    .step("write b", new StepAction.CreateFile("b.txt", "b"))
                    .build());

            UnsatisfiedDependencyException blocked = Assertions.assertThrows(
                    UnsatisfiedDependencyException.class,
                    () -> runtime.executor().start(document.id(), 2)
            );
            Assertions.assertEquals(1, blocked.dependencyNumber());
            Assertions.assertEquals(PromptStatus.PENDING, blocked.dependencyStatus());
            Assertions.assertTrue(runtime.executor().listActive().isEmpty());
            Assertions.assertFalse(Files.exists(root.resolve("b.txt")));
            Assertions.assertEquals(PromptStatus.PENDING, document.prompt(2).orElseThrow().status());
            Assertions.assertTrue(runtime.events().flush(Duration.ofSeconds(5)));
            Assertions.assertTrue(recorder.events.isEmpty());

            ExecutionReport first = runtime.executor().executeAndWait(document.id(), 1);
            Assertions.assertEquals(PromptStatus.COMPLETED, first.status());

            ExecutionReport second = runtime.executor().executeAndWait(document.title(), 2);
            Assertions.assertEquals(PromptStatus.COMPLETED, second.status());
            Assertions.assertEquals("b", Files.readString(root.resolve("b.txt"), StandardCharsets.UTF_8));

            Assertions.assertTrue(runtime.events().flush(Duration.ofSeconds(5)));
            Assertions.assertEquals(1, recorder.count(second.executionId(), ExecutionEventType.STEP_COMPLETED));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void createThenValidateCompletesWithStepsInOrder() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-create-validate-");
        try (PromptRelayRuntime runtime = new PromptRelayRuntime(config(root).build())) {
            Recorder recorder = new Recorder();
            runtime.events().subscribe(recorder);
            Path target = root.resolve("out").resolve("a.txt");
            PromptDocument document = runtime.documents().add(DocumentBuilder.document("Create")
                    .prompt(1, "Create and check")
                    .step("create", new StepAction.CreateFile(target.toString(), "hi"))
                    .step("validate", new StepAction.Validation(StepAction.ValidationType.FILE_EXISTS, target.toString()))
                    .step("mark", new StepAction.Custom("done"))
                    .build());

            ExecutionReport report = runtime.executor().executeAndWait(document.id(), 1);

            Assertions.assertEquals(PromptStatus.COMPLETED, report.status());
            Assertions.assertEquals(List.of(1, 2, 3), report.stepResults().stream().map(StepResult::stepNumber).toList());
            Assertions.assertTrue(report.stepResults().stream().allMatch(StepResult::succeeded));
            Assertions.assertEquals("hi", Files.readString(target, StandardCharsets.UTF_8));
            Assertions.assertEquals(PromptStatus.COMPLETED, document.prompt(1).orElseThrow().status());
            Assertions.assertEquals(report.executionId(),
                    document.prompt(1).orElseThrow().lastExecution().orElseThrow().executionId());
            Assertions.assertThrows(NotFoundException.class, () -> runtime.executor().getStatus(report.executionId()));

            Assertions.assertTrue(runtime.events().flush(Duration.ofSeconds(5)));
            Assertions.assertEquals(List.of(33, 66, 100), recorder.events.stream()
                    .filter(e -> e.type() == ExecutionEventType.STEP_COMPLETED)
                    .map(ExecutionEvent::progressPercent)
                    .toList());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void alwaysFailingCommandIsAttemptedOncePlusMaxRetries() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-exhaust-");
        try (PromptRelayRuntime runtime = new PromptRelayRuntime(config(root).maxRetries(2).build())) {
            Recorder recorder = new Recorder();
            runtime.events().subscribe(recorder);
            PromptDocument document = runtime.documents().add(DocumentBuilder.document("Exhaust")
                    .prompt(1, "Broken")
                    .step("fail", new StepAction.ExecuteCommand("echo boom >&2; exit 3"))
                    .step("never", new StepAction.CreateFile("never.txt", "x"))
                    .build());

            ExecutionReport report = runtime.executor().executeAndWait(document.id(), 1);

            Assertions.assertEquals(PromptStatus.FAILED, report.status());
            Assertions.assertEquals(3, report.stepResults().size());
            Assertions.assertTrue(report.stepResults().stream().allMatch(r -> r.stepNumber() == 1 && !r.succeeded()));
            Assertions.assertEquals(List.of(1, 2, 3), report.stepResults().stream().map(StepResult::attempt).toList());
            Assertions.assertTrue(report.error().contains("after 3 attempts"));
            Assertions.assertTrue(report.error().contains("boom"));
            Assertions.assertFalse(Files.exists(root.resolve("never.txt")));
            Assertions.assertEquals(PromptStatus.FAILED, document.prompt(1).orElseThrow().status());

            Assertions.assertTrue(runtime.events().flush(Duration.ofSeconds(5)));
            Assertions.assertEquals(3, recorder.count(report.executionId(), ExecutionEventType.STEP_FAILED));
            Assertions.assertEquals(1, recorder.count(report.executionId(), ExecutionEventType.EXECUTION_FAILED));
            Assertions.assertEquals(0, recorder.count(report.executionId(), ExecutionEventType.STEP_COMPLETED));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stepThatFailsOnceThenSucceedsKeepsTheFailedAttempt() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-flaky-");
        try (PromptRelayRuntime runtime = new PromptRelayRuntime(config(root).build())) {
            String flaky = "if [ -f marker ]; then echo recovered; else touch marker; exit 1; fi";
            PromptDocument document = runtime.documents().add(DocumentBuilder.document("Flaky")
                    .prompt(1, "Flaky")
                    .step("flaky", new StepAction.ExecuteCommand(flaky))
                    .step("after", new StepAction.ExecuteCommand("echo after"))
                    .build());

            ExecutionReport report = runtime.executor().executeAndWait(document.id(), 1);

            Assertions.assertEquals(PromptStatus.COMPLETED, report.status());
            Assertions.assertEquals(3, report.stepResults().size());
            StepResult failed = report.stepResults().get(0);
            Assertions.assertFalse(failed.succeeded());
            Assertions.assertEquals(StepResult.FailureKind.RETRYABLE, failed.failureKind());
            StepResult retried = report.stepResults().get(1);
            Assertions.assertTrue(retried.succeeded());
            Assertions.assertEquals(1, retried.stepNumber());
            Assertions.assertEquals(2, retried.attempt());
            Assertions.assertEquals("recovered", retried.output());
            Assertions.assertEquals(List.of(1, 2), report.completedSteps().stream().map(StepResult::stepNumber).toList());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void terminalFailureIsNotRetried() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-terminal-");
        try (PromptRelayRuntime runtime = new PromptRelayRuntime(config(root).maxRetries(3).build())) {
            PromptDocument document = runtime.documents().add(DocumentBuilder.document("Terminal")
                    .prompt(1, "Modify missing")
                    .step("modify", new StepAction.ModifyFile("missing.txt", null))
                    .build());

            ExecutionReport report = runtime.executor().executeAndWait(document.id(), 1);

            Assertions.assertEquals(PromptStatus.FAILED, report.status());
            Assertions.assertEquals(1, report.stepResults().size());
            Assertions.assertEquals(StepResult.FailureKind.TERMINAL, report.stepResults().get(0).failureKind());
            Assertions.assertTrue(report.error().contains("File does not exist"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unparseableApiUrlFailsOnceWithoutRetry() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-bad-url-");
        try (PromptRelayRuntime runtime = new PromptRelayRuntime(config(root).maxRetries(2).build())) {
            PromptDocument document = runtime.documents().add(DocumentBuilder.document("Bad url")
                    .prompt(1, "Call")
                    .step("call", new StepAction.ApiCall("http://bad host/x", "GET", null))
                    .build());

            ExecutionReport report = runtime.executor().executeAndWait(document.id(), 1);

            Assertions.assertEquals(PromptStatus.FAILED, report.status());
            Assertions.assertEquals(1, report.stepResults().size());
            Assertions.assertEquals(StepResult.FailureKind.TERMINAL, report.stepResults().get(0).failureKind());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void stepTimeoutIsARetryableFailure() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-timeout-");
        PromptRelayConfig config = config(root)
                .stepTimeout(Duration.ofMillis(300))
                .maxRetries(1)
                .build();
        try (PromptRelayRuntime runtime = new PromptRelayRuntime(config)) {
            PromptDocument document = runtime.documents().add(DocumentBuilder.document("Slow")
                    .prompt(1, "Slow")
                    .step("sleep", new StepAction.ExecuteCommand("sleep 5"))
                    .build());

            ExecutionReport report = runtime.executor().executeAndWait(document.id(), 1);

            Assertions.assertEquals(PromptStatus.FAILED, report.status());
            Assertions.assertEquals(2, report.stepResults().size());
            for (StepResult result : report.stepResults()) {
                Assertions.assertEquals(StepResult.FailureKind.RETRYABLE, result.failureKind());
                Assertions.assertTrue(result.error().contains("timed out") || result.error().contains("timeout"),
                        result.error());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void promptBudgetExpiryFailsWithoutRetry() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-budget-");
        PromptRelayConfig config = config(root)
                .promptTimeout(Duration.ofMillis(300))
                .maxRetries(3)
                .build();
        try (PromptRelayRuntime runtime = new PromptRelayRuntime(config)) {
            PromptDocument document = runtime.documents().add(DocumentBuilder.document("Budget")
                    .prompt(1, "Budget")
                    .step("sleep", new StepAction.ExecuteCommand("sleep 5"))
                    .build());

            ExecutionReport report = runtime.executor().executeAndWait(document.id(), 1);

            Assertions.assertEquals(PromptStatus.FAILED, report.status());
            Assertions.assertEquals(1, report.stepResults().size());
            Assertions.assertEquals(StepResult.FailureKind.TERMINAL, report.stepResults().get(0).failureKind());
            Assertions.assertTrue(report.error().contains("Prompt timeout"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void cancelRemovesTheRowAndDiscardsTheInFlightResult() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-cancel-");
        try (PromptRelayRuntime runtime = new PromptRelayRuntime(config(root).build())) {
            Recorder recorder = new Recorder();
            runtime.events().subscribe(recorder);
            PromptDocument document = runtime.documents().add(DocumentBuilder.document("Cancel")
                    .prompt(1, "Long")
                    .step("sleep", new StepAction.ExecuteCommand("sleep 5"))
                    .step("after", new StepAction.CreateFile("after.txt", "x"))
                    .build());

            String executionId = runtime.executor().start(document.id(), 1);
            Assertions.assertEquals(PromptStatus.RUNNING, runtime.executor().getStatus(executionId).status());

            ExecutionSnapshot cancelled = runtime.executor().cancel(executionId);

            Assertions.assertEquals(PromptStatus.CANCELLED, cancelled.status());
            Assertions.assertTrue(runtime.executor().listActive().isEmpty());
            Assertions.assertThrows(NotFoundException.class, () -> runtime.executor().getStatus(executionId));
            Assertions.assertThrows(NotFoundException.class, () -> runtime.executor().cancel(executionId));

            ExecutionReport report = runtime.executor().awaitReport(executionId, Duration.ofSeconds(10));
            Assertions.assertEquals(PromptStatus.CANCELLED, report.status());
            Assertions.assertTrue(report.stepResults().isEmpty());
            Assertions.assertEquals(PromptStatus.CANCELLED, document.prompt(1).orElseThrow().status());
            Assertions.assertFalse(Files.exists(root.resolve("after.txt")));

            Assertions.assertTrue(runtime.events().flush(Duration.ofSeconds(5)));
            Assertions.assertEquals(1, recorder.count(executionId, ExecutionEventType.STATUS_UPDATE));
            Assertions.assertEquals(0, recorder.count(executionId, ExecutionEventType.STEP_FAILED));
            Assertions.assertEquals(0, recorder.count(executionId, ExecutionEventType.EXECUTION_FAILED));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void samePromptCannotRunTwiceAtOnce() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-lock-");
        try (PromptRelayRuntime runtime = new PromptRelayRuntime(config(root).build())) {
            PromptDocument document = runtime.documents().add(DocumentBuilder.document("Lock")
                    .prompt(1, "Long")
                    .step("sleep", new StepAction.ExecuteCommand("sleep 5"))
                    .build());

            String executionId = runtime.executor().start(document.id(), 1);
            Assertions.assertThrows(InvalidStateException.class, () -> runtime.executor().start(document.id(), 1));
            Assertions.assertEquals(1, runtime.executor().listActive().size());

            runtime.executor().cancel(executionId);
            runtime.executor().awaitReport(executionId, Duration.ofSeconds(10));
            waitFor(() -> {
                try {
                    String again = runtime.executor().start(document.id(), 1);
                    runtime.executor().cancel(again);
                    return true;
                } catch (InvalidStateException e) {
                    return false;
                }
            });
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void admissionBeyondMaxConcurrentIsRejected() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-max-concurrent-");
        try (PromptRelayRuntime runtime = new PromptRelayRuntime(config(root).maxConcurrent(1).build())) {
            PromptDocument document = runtime.documents().add(DocumentBuilder.document("Bound")
                    .prompt(1, "One").step("sleep", new StepAction.ExecuteCommand("sleep 5"))
                    .prompt(2, "Two").step("sleep", new StepAction.ExecuteCommand("sleep 5"))
                    .build());

            String first = runtime.executor().start(document.id(), 1);
            InvalidStateException rejected = Assertions.assertThrows(
                    InvalidStateException.class,
                    () -> runtime.executor().start(document.id(), 2)
            );
            Assertions.assertTrue(rejected.getMessage().contains("Maximum concurrent"));
            Assertions.assertEquals(PromptStatus.PENDING, document.prompt(2).orElseThrow().status());
            runtime.executor().cancel(first);
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unknownIdsAreReportedAsNotFound() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-not-found-");
        try (PromptRelayRuntime runtime = new PromptRelayRuntime(config(root).build())) {
            PromptDocument document = runtime.documents().add(DocumentBuilder.document("Small")
                    .prompt(1, "Only").step("mark", new StepAction.Custom("noop"))
                    .build());

            Assertions.assertThrows(NotFoundException.class, () -> runtime.executor().getStatus("exe_missing"));
            Assertions.assertThrows(NotFoundException.class, () -> runtime.executor().cancel("exe_missing"));
            Assertions.assertThrows(NotFoundException.class, () -> runtime.executor().start("nope", 1));
            Assertions.assertThrows(NotFoundException.class, () -> runtime.executor().start(document.id(), 9));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void sequenceRunsPromptsInOrderAndStopsOnFailure() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-sequence-");
        try (PromptRelayRuntime runtime = new PromptRelayRuntime(config(root).maxRetries(0).build())) {
            PromptDocument document = runtime.documents().add(DocumentBuilder.document("Sequence")
                    .prompt(1, "One").step("a", new StepAction.CreateFile("one.txt", "1"))
                    .prompt(2, "Two").dependsOn(1).step("b", new StepAction.ExecuteCommand("exit 1"))
                    .prompt(3, "Three").dependsOn(2).step("c", new StepAction.CreateFile("three.txt", "3"))
                    .build());

            String sequenceId = runtime.executor().startSequence(document.id(), List.of(1, 2, 3), true);
            waitFor(() -> runtime.executor().sequenceStatus(sequenceId).status() != SequenceSnapshot.SequenceStatus.RUNNING);

            SequenceSnapshot sequence = runtime.executor().sequenceStatus(sequenceId);
            Assertions.assertEquals(SequenceSnapshot.SequenceStatus.FAILED, sequence.status());
            Assertions.assertEquals(2, sequence.entries().size());
            Assertions.assertEquals(PromptStatus.COMPLETED, sequence.entries().get(0).status());
            Assertions.assertEquals(PromptStatus.FAILED, sequence.entries().get(1).status());
            Assertions.assertTrue(Files.exists(root.resolve("one.txt")));
            Assertions.assertFalse(Files.exists(root.resolve("three.txt")));
            Assertions.assertEquals(PromptStatus.PENDING, document.prompt(3).orElseThrow().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void finishedSequencesAndReportsAreEvictedBeyondTheRetainedLimit() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-retention-");
        PromptRelayConfig config = config(root).build();
        DocumentStore documents = new DocumentStore();
        EventBus events = new EventBus();
        try (PromptExecutor executor = new PromptExecutor(
                documents,
                new ExecutionTracker(),
                new StepDispatcher(ActionHandlerRegistry.defaults(config)),
                events,
                config,
                2
        )) {
            PromptDocument document = documents.add(DocumentBuilder.document("Retention")
                    .prompt(1, "Mark").step("mark", new StepAction.Custom("done"))
                    .build());

            List<String> sequenceIds = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                String sequenceId = executor.startSequence(document.id(), List.of(1), true);
                waitFor(() -> executor.sequenceStatus(sequenceId).completedAt() != null);
                sequenceIds.add(sequenceId);
            }

            Assertions.assertThrows(NotFoundException.class, () -> executor.sequenceStatus(sequenceIds.get(0)));
            Assertions.assertEquals(SequenceSnapshot.SequenceStatus.COMPLETED,
                    executor.sequenceStatus(sequenceIds.get(2)).status());
            String lastExecution = executor.sequenceStatus(sequenceIds.get(2)).entries().get(0).executionId();
            Assertions.assertTrue(executor.report(lastExecution).isPresent());
        } finally {
            events.close();
            deleteRecursively(root);
        }
    }

    private static PromptRelayConfig.Builder config(Path root) {
        return PromptRelayConfig.builder(root)
                .workspaceDir(root)
                .retryDelay(Duration.ofMillis(10))
                .stepTimeout(Duration.ofSeconds(20))
                .auditEnabled(false);
    }

    private static void waitFor(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 10_000L;
        while (System.currentTimeMillis() < deadline) {
            if (condition.getAsBoolean()) {
                return;
            }
            Thread.sleep(20L);
        }
        Assertions.fail("condition not met within 10s");
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private static final class Recorder implements EventSubscriber {
        private final List<ExecutionEvent> events = new CopyOnWriteArrayList<>();

        @Override
        public void onEvent(ExecutionEvent event) {
            events.add(event);
        }

        long count(String executionId, ExecutionEventType type) {
            return events.stream()
                    .filter(e -> executionId.equals(e.executionId()) && e.type() == type)
                    .count();
        }
    }
}
