package io.promptrelay.execution;

import io.promptrelay.action.StepContext;
import io.promptrelay.action.StepDispatcher;
import io.promptrelay.config.PromptRelayConfig;
import io.promptrelay.document.DocumentStore;
import io.promptrelay.document.DocumentValidator;
import io.promptrelay.error.InvalidStateException;
import io.promptrelay.error.NotFoundException;
import io.promptrelay.error.PromptRelayException;
import io.promptrelay.error.RetryExhaustedException;
import io.promptrelay.error.StepExecutionException;
import io.promptrelay.events.EventBus;
import io.promptrelay.events.ExecutionEvent;
import io.promptrelay.events.ExecutionEventType;
import io.promptrelay.model.ExecutablePrompt;
import io.promptrelay.model.ExecutionStep;
import io.promptrelay.model.PromptDocument;
import io.promptrelay.model.PromptExecutionRecord;
import io.promptrelay.model.PromptStatus;
import io.promptrelay.model.StepResult;
import io.promptrelay.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Runs prompts step by step.
 *
 * <p>{@link #start(String, int)} checks dependencies, takes the prompt's run lock and a concurrency
 * slot, registers a tracker row and returns the execution id; the steps then run on a worker.
 * Each dispatch runs on its own thread and is raced against the smaller of the step timeout and
 * what is left of the prompt budget, so both a timer and {@link #cancel(String)} can interrupt it.
 *
 * <p>A failed attempt is always recorded and published. Retryable failures are re-dispatched
 * while the retry policy allows; terminal failures and exhausted retries fail the whole prompt.
 */
public final class PromptExecutor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PromptExecutor.class);
    private static final int MAX_RETAINED = 1_024;

    private final DocumentStore documents;
    private final ExecutionTracker tracker;
    private final StepDispatcher dispatcher;
    private final EventBus events;
    private final RetryPolicy retryPolicy;
    private final Duration stepTimeout;
    private final Duration promptTimeout;
    private final Path workingDirectory;
    private final int maxConcurrent;
    private final Semaphore slots;
    private final Map<String, String> promptLocks = new ConcurrentHashMap<>();
    private final Map<String, RunHandle> runs = new ConcurrentHashMap<>();
    private final Map<String, CompletableFuture<ExecutionReport>> reports = new LinkedHashMap<>();
    private final Map<String, SequenceRun> sequences = new LinkedHashMap<>();
    private final int retainedLimit;
    private final ExecutorService runPool;
    private final ExecutorService stepPool;
    private final ExecutorService sequencePool;

    public PromptExecutor(
            DocumentStore documents,
            ExecutionTracker tracker,
            StepDispatcher dispatcher,
            EventBus events,
            PromptRelayConfig config
    ) {
        this(documents, tracker, dispatcher, events, config, MAX_RETAINED);
    }

    /**
     * @param retainedLimit settled reports and finished sequences kept for lookup
     */
    PromptExecutor(
            DocumentStore documents,
            ExecutionTracker tracker,
            StepDispatcher dispatcher,
            EventBus events,
            PromptRelayConfig config,
            int retainedLimit
    ) {
        this.retainedLimit = Math.max(1, retainedLimit);
        this.documents = documents;
        this.tracker = tracker;
        this.dispatcher = dispatcher;
        this.events = events;
        this.retryPolicy = RetryPolicy.from(config);
        this.stepTimeout = config.stepTimeout();
        this.promptTimeout = config.promptTimeout();
        this.workingDirectory = config.workspaceDir();
        this.maxConcurrent = config.maxConcurrent();
        this.slots = new Semaphore(maxConcurrent);
        this.runPool = Executors.newFixedThreadPool(maxConcurrent, named("promptrelay-run-"));
        this.stepPool = Executors.newCachedThreadPool(named("promptrelay-step-"));
        this.sequencePool = Executors.newCachedThreadPool(named("promptrelay-sequence-"));
    }

    public ExecutionTracker tracker() {
        return tracker;
    }

    public DocumentStore documents() {
        return documents;
    }

    public int maxConcurrent() {
        return maxConcurrent;
    }

    /**
     * Admits a run of one prompt and returns its execution id.
     *
     * @throws NotFoundException                                     unknown document or prompt
     * @throws io.promptrelay.error.UnsatisfiedDependencyException a dependency has not completed
     * @throws InvalidStateException                                 the prompt is already running or
     *                                                               every concurrency slot is taken
     */
    public String start(String documentRef, int promptNumber) {
        PromptDocument document = documents.resolve(documentRef);
        ExecutablePrompt prompt = document.prompt(promptNumber)
                .orElseThrow(() -> NotFoundException.prompt(document.id(), promptNumber));
        Set<Integer> numbers = document.prompts().stream()
                .map(ExecutablePrompt::number)
                .collect(Collectors.toSet());
        DocumentValidator.validateDependencies(document.id(), prompt, numbers);
        DependencyGate.validate(document, prompt);

        String executionId = "exe_" + UUID.randomUUID();
        String lockKey = document.id() + "#" + promptNumber;
        String holder = promptLocks.putIfAbsent(lockKey, executionId);
        if (holder != null) {
            throw new InvalidStateException("Prompt " + promptNumber + " of document " + document.id()
                    + " is already running as " + holder);
        }
        if (!slots.tryAcquire()) {
            promptLocks.remove(lockKey, executionId);
            throw new InvalidStateException("Maximum concurrent executions reached (" + maxConcurrent + ")");
        }

        RunHandle handle = new RunHandle(executionId, document, prompt, lockKey);
        PromptStatus previous = prompt.status();
        try {
            // A dependency may have been re-run while we were acquiring the lock.
            DependencyGate.validate(document, prompt);
            runs.put(executionId, handle);
            tracker.register(executionId, document.id(), promptNumber, prompt.steps().size());
            prompt.status(PromptStatus.RUNNING);
            retainReport(executionId, handle.report);
            events.publish(event(handle, ExecutionEventType.EXECUTION_STARTED)
                    .progress(0)
                    .meta("total_steps", prompt.steps().size())
                    .build());
            runPool.execute(() -> run(handle));
        } catch (RuntimeException e) {
            runs.remove(executionId);
            if (tracker.removeOnTerminal(executionId, PromptStatus.FAILED, e.getMessage()).isPresent()) {
                prompt.status(previous);
            }
            release(handle);
            throw e;
        }
        log.info("Execution {} admitted: document={} prompt={}", executionId, document.id(), promptNumber);
        return executionId;
    }

    /**
     * Starts a run and blocks until it settles.
     */
    public ExecutionReport executeAndWait(String documentRef, int promptNumber) {
        String executionId = start(documentRef, promptNumber);
        return awaitReport(executionId, promptTimeout.plus(stepTimeout));
    }

    public ExecutionReport awaitReport(String executionId, Duration timeout) {
        CompletableFuture<ExecutionReport> future;
        synchronized (reports) {
            future = reports.get(executionId);
        }
        if (future == null) {
            throw NotFoundException.execution(executionId);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InvalidStateException("Interrupted while waiting for execution " + executionId);
        } catch (TimeoutException e) {
            throw new InvalidStateException("Execution " + executionId + " still running after " + timeout);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Execution report failed for " + executionId, e.getCause());
        }
    }

    public Optional<ExecutionReport> report(String executionId) {
        CompletableFuture<ExecutionReport> future;
        synchronized (reports) {
            future = reports.get(executionId);
        }
        if (future == null || !future.isDone()) {
            return Optional.empty();
        }
        return Optional.ofNullable(future.getNow(null));
    }

    public ExecutionSnapshot getStatus(String executionId) {
        return tracker.get(executionId);
    }

    public List<ExecutionSnapshot> listActive() {
        return tracker.listActive();
    }

    /**
     * Cancels a running execution. The row disappears at once; the in-flight step is interrupted and
     * whatever it produces afterwards is discarded.
     */
    public ExecutionSnapshot cancel(String executionId) {
        ExecutionSnapshot cancelled = tracker.cancel(executionId);
        RunHandle handle = runs.get(executionId);
        if (handle != null) {
            handle.cancelled.set(true);
            handle.cancelSignal.countDown();
            handle.prompt.status(PromptStatus.CANCELLED);
            handle.prompt.recordExecution(new PromptExecutionRecord(
                    executionId,
                    cancelled.startedAt(),
                    Instant.now(),
                    PromptStatus.CANCELLED,
                    "",
                    "cancelled",
                    cancelled.stepResults()
            ));
            Future<String> inFlight = handle.inFlight;
            if (inFlight != null) {
                inFlight.cancel(true);
            }
            events.publish(event(handle, ExecutionEventType.STATUS_UPDATE)
                    .progress(cancelled.progressPercent())
                    .meta("status", PromptStatus.CANCELLED.name())
                    .build());
        }
        log.info("Execution {} cancelled at step {}", executionId, cancelled.currentStep());
        return cancelled;
    }

    /**
     * Runs the given prompts one after another on a background worker.
     *
     * @return sequence id for {@link #sequenceStatus(String)}
     */
    public String startSequence(String documentRef, List<Integer> promptNumbers, boolean stopOnError) {
        PromptDocument document = documents.resolve(documentRef);
        if (promptNumbers == null || promptNumbers.isEmpty()) {
            throw new InvalidStateException("Prompt sequence is empty");
        }
        for (Integer number : promptNumbers) {
            if (number == null || document.prompt(number).isEmpty()) {
                throw NotFoundException.prompt(document.id(), number == null ? -1 : number);
            }
        }
        String sequenceId = "seq_" + UUID.randomUUID();
        SequenceRun sequence = new SequenceRun(sequenceId, document.id(), List.copyOf(promptNumbers), stopOnError);
        retainSequence(sequence);
        sequencePool.execute(() -> runSequence(sequence));
        return sequenceId;
    }

    public SequenceSnapshot sequenceStatus(String sequenceId) {
        SequenceRun sequence;
        synchronized (sequences) {
            sequence = sequences.get(sequenceId);
        }
        if (sequence == null) {
            throw new NotFoundException("Sequence not found: " + sequenceId);
        }
        return sequence.snapshot();
    }

    private void runSequence(SequenceRun sequence) {
        boolean failed = false;
        for (int number : sequence.promptNumbers) {
            sequence.current(number);
            SequenceSnapshot.Entry entry;
            try {
                ExecutionReport report = executeAndWait(sequence.documentId, number);
                entry = new SequenceSnapshot.Entry(number, report.executionId(), report.status(), report.error());
            } catch (PromptRelayException e) {
                entry = new SequenceSnapshot.Entry(number, null, PromptStatus.FAILED, e.getMessage());
            }
            sequence.add(entry);
            if (entry.status() != PromptStatus.COMPLETED) {
                failed = true;
                if (sequence.stopOnError) {
                    log.warn("Sequence {} stopped at prompt {}: {}", sequence.sequenceId, number, entry.error());
                    break;
                }
            }
        }
        sequence.finish(failed ? SequenceSnapshot.SequenceStatus.FAILED : SequenceSnapshot.SequenceStatus.COMPLETED);
    }

    private void run(RunHandle handle) {
        Instant deadline = handle.startedAt.plus(promptTimeout);
        List<String> outputs = new ArrayList<>();
        try {
            for (ExecutionStep step : handle.prompt.steps()) {
                if (handle.cancelled.get() || !tracker.advanceCursor(handle.executionId, step.stepNumber())) {
                    return;
                }
                step.status(StepStatus.RUNNING);
                String output = runStep(handle, step, deadline);
                step.status(StepStatus.COMPLETED);
                outputs.add(output);
            }
            finish(handle, PromptStatus.COMPLETED, String.join("\n", outputs), null);
        } catch (RetryExhaustedException e) {
            finish(handle, PromptStatus.FAILED, String.join("\n", outputs), e.getMessage());
        } catch (StepExecutionException e) {
            finish(handle, PromptStatus.FAILED, String.join("\n", outputs), e.getMessage());
        } catch (ExecutionCancelled e) {
            log.debug("Execution {} stopped after cancellation", handle.executionId);
        } catch (RuntimeException e) {
            log.error("Execution {} aborted unexpectedly", handle.executionId, e);
            finish(handle, PromptStatus.FAILED, String.join("\n", outputs), "internal error: " + e.getMessage());
        } finally {
            runs.remove(handle.executionId);
            release(handle);
            if (!handle.report.isDone()) {
                handle.report.complete(cancelledReport(handle));
            }
        }
    }

    private String runStep(RunHandle handle, ExecutionStep step, Instant deadline) {
        int maxAttempts = retryPolicy.maxAttempts();
        for (int attempt = 1; ; attempt++) {
            Instant attemptStart = Instant.now();
            Duration remaining = Duration.between(attemptStart, deadline);
            try {
                if (remaining.isNegative() || remaining.isZero()) {
                    throw StepExecutionException.terminal("Prompt timeout of " + promptTimeout + " exceeded");
                }
                String output = dispatchWithTimer(handle, step, remaining);
                StepResult result = StepResult.completed(step.stepNumber(), attempt, output,
                        Duration.between(attemptStart, Instant.now()));
                if (handle.cancelled.get() || !tracker.recordStepResult(handle.executionId, result)) {
                    throw new ExecutionCancelled();
                }
                events.publish(event(handle, ExecutionEventType.STEP_COMPLETED)
                        .step(step.stepNumber(), step.description())
                        .progress((handle.prompt.steps().indexOf(step) + 1) * 100 / handle.prompt.steps().size())
                        .output(output)
                        .meta("attempt", attempt)
                        .build());
                return output;
            } catch (StepExecutionException e) {
                StepResult result = StepResult.failed(step.stepNumber(), attempt, e.getMessage(), e.retryable(),
                        Duration.between(attemptStart, Instant.now()));
                if (handle.cancelled.get() || !tracker.recordStepResult(handle.executionId, result)) {
                    throw new ExecutionCancelled();
                }
                step.status(StepStatus.FAILED);
                events.publish(event(handle, ExecutionEventType.STEP_FAILED)
                        .step(step.stepNumber(), step.description())
                        .error(e.getMessage())
                        .meta("attempt", attempt)
                        .meta("retryable", e.retryable())
                        .build());
                if (!e.retryable()) {
                    throw e;
                }
                if (attempt >= maxAttempts) {
                    if (!retryPolicy.autoRetry()) {
                        throw e;
                    }
                    throw new RetryExhaustedException(step.stepNumber(), attempt, e.getMessage());
                }
                log.info("Execution {} retrying step {} (attempt {}/{}) in {}",
                        handle.executionId, step.stepNumber(), attempt + 1, maxAttempts, retryPolicy.retryDelay());
                pause(handle, retryPolicy.retryDelay());
                step.status(StepStatus.RUNNING);
            }
        }
    }

    private String dispatchWithTimer(RunHandle handle, ExecutionStep step, Duration remainingBudget) {
        boolean budgetBound = remainingBudget.compareTo(stepTimeout) < 0;
        Duration timeout = budgetBound ? remainingBudget : stepTimeout;
        StepContext context = new StepContext(
                handle.executionId,
                handle.document.id(),
                handle.document.title(),
                handle.prompt.number(),
                workingDirectory,
                timeout
        );
        Future<String> future = stepPool.submit(() -> dispatcher.dispatch(step, context));
        handle.inFlight = future;
        if (handle.cancelled.get()) {
            future.cancel(true);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            if (budgetBound) {
                throw StepExecutionException.terminal("Prompt timeout of " + promptTimeout + " exceeded during step "
                        + step.stepNumber());
            }
            throw StepExecutionException.retryable("Step " + step.stepNumber() + " timed out after " + timeout);
        } catch (CancellationException e) {
            if (handle.cancelled.get()) {
                throw new ExecutionCancelled();
            }
            throw StepExecutionException.retryable("Step " + step.stepNumber() + " was interrupted");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof StepExecutionException stepFailure) {
                throw stepFailure;
            }
            if (handle.cancelled.get()) {
                throw new ExecutionCancelled();
            }
            if (cause instanceof InterruptedException) {
                throw StepExecutionException.retryable("Step " + step.stepNumber() + " was interrupted", cause);
            }
            throw StepExecutionException.retryable("Step " + step.stepNumber() + " failed: " + cause, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            if (handle.cancelled.get()) {
                throw new ExecutionCancelled();
            }
            throw StepExecutionException.terminal("Executor interrupted during step " + step.stepNumber(), e);
        } finally {
            handle.inFlight = null;
        }
    }

    private void pause(RunHandle handle, Duration delay) {
        if (delay.isZero()) {
            return;
        }
        boolean cancelled;
        try {
            cancelled = handle.cancelSignal.await(delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw StepExecutionException.terminal("Interrupted while waiting to retry", e);
        }
        if (cancelled || handle.cancelled.get()) {
            throw new ExecutionCancelled();
        }
    }

    private void finish(RunHandle handle, PromptStatus status, String output, String error) {
        Optional<ExecutionSnapshot> settled = tracker.removeOnTerminal(handle.executionId, status, error);
        if (settled.isEmpty()) {
            // Cancelled while the last step was finishing.
            return;
        }
        ExecutionSnapshot snapshot = settled.get();
        Instant completedAt = Instant.now();
        handle.prompt.status(status);
        handle.prompt.recordExecution(new PromptExecutionRecord(
                handle.executionId,
                handle.startedAt,
                completedAt,
                status,
                output,
                error,
                snapshot.stepResults()
        ));
        if (status == PromptStatus.COMPLETED) {
            events.publish(event(handle, ExecutionEventType.EXECUTION_COMPLETED)
                    .progress(100)
                    .output(output)
                    .meta("duration_ms", Duration.between(handle.startedAt, completedAt).toMillis())
                    .build());
        } else {
            events.publish(event(handle, ExecutionEventType.EXECUTION_FAILED)
                    .progress(snapshot.progressPercent())
                    .error(error)
                    .meta("failed_step", snapshot.currentStep())
                    .build());
        }
        runs.remove(handle.executionId);
        release(handle);
        handle.report.complete(new ExecutionReport(
                handle.executionId,
                handle.document.id(),
                handle.prompt.number(),
                status,
                output,
                error,
                snapshot.stepResults(),
                handle.startedAt,
                completedAt
        ));
    }

    private ExecutionReport cancelledReport(RunHandle handle) {
        List<StepResult> results = handle.prompt.lastExecution()
                .filter(r -> r.executionId().equals(handle.executionId))
                .map(PromptExecutionRecord::stepResults)
                .orElse(List.of());
        return new ExecutionReport(
                handle.executionId,
                handle.document.id(),
                handle.prompt.number(),
                PromptStatus.CANCELLED,
                "",
                "cancelled",
                results,
                handle.startedAt,
                Instant.now()
        );
    }

    private void release(RunHandle handle) {
        if (handle.released.compareAndSet(false, true)) {
            promptLocks.remove(handle.lockKey, handle.executionId);
            slots.release();
        }
    }

    private void retainReport(String executionId, CompletableFuture<ExecutionReport> report) {
        synchronized (reports) {
            reports.put(executionId, report);
            if (reports.size() > retainedLimit) {
                reports.entrySet().removeIf(e -> e.getValue().isDone() && reports.size() > retainedLimit);
            }
        }
    }

    private void retainSequence(SequenceRun sequence) {
        synchronized (sequences) {
            sequences.put(sequence.sequenceId, sequence);
            if (sequences.size() > retainedLimit) {
                sequences.entrySet().removeIf(e -> e.getValue().finished() && sequences.size() > retainedLimit);
            }
        }
    }

    private static ExecutionEvent.Builder event(RunHandle handle, ExecutionEventType type) {
        return ExecutionEvent.builder(type, handle.executionId)
                .document(handle.document.id(), handle.document.title())
                .prompt(handle.prompt.number(), handle.prompt.title());
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    @Override
    public void close() {
        for (String executionId : List.copyOf(runs.keySet())) {
            try {
                cancel(executionId);
            } catch (NotFoundException e) {
                log.debug("Execution {} settled during shutdown", executionId);
            }
        }
        sequencePool.shutdownNow();
        runPool.shutdown();
        stepPool.shutdownNow();
        try {
            if (!runPool.awaitTermination(5, TimeUnit.SECONDS)) {
                runPool.shutdownNow();
            }
        } catch (InterruptedException e) {
            runPool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static final class RunHandle {
        private final String executionId;
        private final PromptDocument document;
        private final ExecutablePrompt prompt;
        private final String lockKey;
        private final Instant startedAt = Instant.now();
        private final AtomicBoolean cancelled = new AtomicBoolean();
        private final AtomicBoolean released = new AtomicBoolean();
        private final CountDownLatch cancelSignal = new CountDownLatch(1);
        private final CompletableFuture<ExecutionReport> report = new CompletableFuture<>();
        private volatile Future<String> inFlight;

        private RunHandle(String executionId, PromptDocument document, ExecutablePrompt prompt, String lockKey) {
            this.executionId = executionId;
            this.document = document;
            this.prompt = prompt;
            this.lockKey = lockKey;
        }
    }

    private static final class SequenceRun {
        private final String sequenceId;
        private final String documentId;
        private final List<Integer> promptNumbers;
        private final boolean stopOnError;
        private final Instant startedAt = Instant.now();
        private final List<SequenceSnapshot.Entry> entries = new ArrayList<>();
        private Integer current;
        private SequenceSnapshot.SequenceStatus status = SequenceSnapshot.SequenceStatus.RUNNING;
        private Instant completedAt;

        private SequenceRun(String sequenceId, String documentId, List<Integer> promptNumbers, boolean stopOnError) {
            this.sequenceId = sequenceId;
            this.documentId = documentId;
            this.promptNumbers = promptNumbers;
            this.stopOnError = stopOnError;
        }

        private synchronized void current(int promptNumber) {
            this.current = promptNumber;
        }

        private synchronized void add(SequenceSnapshot.Entry entry) {
            entries.add(entry);
        }

        private synchronized void finish(SequenceSnapshot.SequenceStatus finalStatus) {
            this.status = finalStatus;
            this.current = null;
            this.completedAt = Instant.now();
        }

        private synchronized boolean finished() {
            return completedAt != null;
        }

        private synchronized SequenceSnapshot snapshot() {
            return new SequenceSnapshot(
                    sequenceId,
                    documentId,
                    promptNumbers,
                    stopOnError,
                    status,
                    current,
                    new ArrayList<>(entries),
                    startedAt,
                    completedAt
            );
        }
    }

    /**
     * Unwinds a run whose tracker row was removed by {@link #cancel(String)}.
     */
    private static final class ExecutionCancelled extends RuntimeException {
        private ExecutionCancelled() {
            super(null, null, false, false);
        }
    }
}
