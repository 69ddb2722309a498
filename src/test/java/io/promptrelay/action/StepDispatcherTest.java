package io.promptrelay.action;

import io.promptrelay.config.PromptRelayConfig;
import io.promptrelay.error.StepExecutionException;
import io.promptrelay.model.ActionType;
import io.promptrelay.model.ExecutionStep;
import io.promptrelay.model.StepAction;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

final class StepDispatcherTest {

    @Test
    void createFileWritesDefaultContentWhenNoneGiven() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-create-file-");
        try {
            StepDispatcher dispatcher = dispatcher(root);

            String output = dispatcher.dispatch(step(1, "write config", new StepAction.CreateFile("conf/app.txt", null)), context(root));

            Path written = root.resolve("conf").resolve("app.txt");
            Assertions.assertEquals("Created file: " + written, output);
            Assertions.assertEquals(
                    "// Generated by promptrelay for Plan\n// Step: write config\n",
                    Files.readString(written, StandardCharsets.UTF_8)
            );
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void modifyFileAppendsAndFailsTerminallyOnMissingFile() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-modify-file-");
        try {
            StepDispatcher dispatcher = dispatcher(root);
            Files.writeString(root.resolve("notes.txt"), "start", StandardCharsets.UTF_8);

            dispatcher.dispatch(step(1, "append", new StepAction.ModifyFile("notes.txt", "+more")), context(root));
            Assertions.assertEquals("start+more", Files.readString(root.resolve("notes.txt"), StandardCharsets.UTF_8));

            StepExecutionException missing = Assertions.assertThrows(
                    StepExecutionException.class,
                    () -> dispatcher.dispatch(step(2, "append", new StepAction.ModifyFile("absent.txt", null)), context(root))
            );
            Assertions.assertFalse(missing.retryable());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void directoryCommandValidationAndCustomSteps() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-dispatch-");
        try {
            StepDispatcher dispatcher = dispatcher(root);

            dispatcher.dispatch(step(1, "dir", new StepAction.CreateDirectory("a/b")), context(root));
            dispatcher.dispatch(step(2, "dir again", new StepAction.CreateDirectory("a/b")), context(root));
            Assertions.assertTrue(Files.isDirectory(root.resolve("a").resolve("b")));

            Assertions.assertEquals("hello",
                    dispatcher.dispatch(step(3, "echo", new StepAction.ExecuteCommand("echo hello")), context(root)));
            StepExecutionException failed = Assertions.assertThrows(
                    StepExecutionException.class,
                    () -> dispatcher.dispatch(step(4, "fail", new StepAction.ExecuteCommand("echo nope >&2; exit 2")), context(root))
            );
            Assertions.assertTrue(failed.retryable());
            Assertions.assertTrue(failed.getMessage().contains("exit=2"));
            Assertions.assertTrue(failed.getMessage().contains("nope"));

            StepExecutionException invalid = Assertions.assertThrows(
                    StepExecutionException.class,
                    () -> dispatcher.dispatch(step(5, "check", new StepAction.Validation(
                            StepAction.ValidationType.FILE_EXISTS, "missing.txt")), context(root))
            );
            Assertions.assertTrue(invalid.retryable());
            Assertions.assertTrue(dispatcher.dispatch(step(6, "check", new StepAction.Validation(
                    StepAction.ValidationType.FILE_EXISTS, "a/b")), context(root)).startsWith("Validation passed"));

            Assertions.assertEquals("Custom action 'ping' executed: notify",
                    dispatcher.dispatch(step(7, "notify", new StepAction.Custom("ping")), context(root)));
            Assertions.assertEquals("Database migrate operation acknowledged",
                    dispatcher.dispatch(step(8, "db", new StepAction.DatabaseOperation("migrate", null)), context(root)));
            Assertions.assertTrue(dispatcher.dispatch(step(9, "tests", new StepAction.TestExecution("echo 3 passed")), context(root))
                    .startsWith("Tests passed:"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingHandlerIsTerminalAndHandlerCrashIsRetryable() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-dispatch-errors-");
        try {
            ActionHandlerRegistry registry = new ActionHandlerRegistry();
            registry.register(new ActionHandler() {
                @Override
                public ActionType type() {
                    return ActionType.CUSTOM;
                }

                @Override
                public String execute(ExecutionStep step, StepContext context) {
                    throw new IllegalStateException("handler bug");
                }
            });
            StepDispatcher dispatcher = new StepDispatcher(registry);

            StepExecutionException crash = Assertions.assertThrows(
                    StepExecutionException.class,
                    () -> dispatcher.dispatch(step(1, "boom", new StepAction.Custom("x")), context(root))
            );
            Assertions.assertTrue(crash.retryable());
            Assertions.assertTrue(crash.getMessage().contains("handler bug"));

            StepExecutionException unhandled = Assertions.assertThrows(
                    StepExecutionException.class,
                    () -> dispatcher.dispatch(step(2, "dir", new StepAction.CreateDirectory("x")), context(root))
            );
            Assertions.assertFalse(unhandled.retryable());
            Assertions.assertTrue(unhandled.getMessage().contains("create_directory"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void gitCommandsAreBuiltFromTheOperation() {
        Assertions.assertEquals(
                List.of("git", "add", "src/A.java", "src/B.java"),
                GitOperationHandler.command(new StepAction.GitOperation(StepAction.GitCommand.ADD, " src/A.java  src/B.java ", null))
        );
        Assertions.assertEquals(
                List.of("git", "add", "."),
                GitOperationHandler.command(new StepAction.GitOperation(StepAction.GitCommand.ADD, null, null))
        );
        Assertions.assertEquals(
                List.of("git", "commit", "-m", GitOperationHandler.DEFAULT_COMMIT_MESSAGE),
                GitOperationHandler.command(new StepAction.GitOperation(StepAction.GitCommand.COMMIT, null, " "))
        );
    }

    private static StepDispatcher dispatcher(Path root) {
        return new StepDispatcher(ActionHandlerRegistry.defaults(PromptRelayConfig.builder(root).build()));
    }

    private static ExecutionStep step(int number, String description, StepAction action) {
        return new ExecutionStep(number, description, action, null);
    }

    private static StepContext context(Path root) {
        return new StepContext("exe_test", "doc_test", "Plan", 1, root, Duration.ofSeconds(20));
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
}
