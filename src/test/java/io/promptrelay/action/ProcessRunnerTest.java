package io.promptrelay.action;

import io.promptrelay.error.StepExecutionException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

final class ProcessRunnerTest {

    @Test
    void capturesBothStreamsAndExitCode() throws Exception {
        ProcessRunner.ProcessOutcome outcome = new ProcessRunner()
                .runShell("echo out; echo err >&2; exit 4", Path.of("."), Duration.ofSeconds(10));

        Assertions.assertFalse(outcome.succeeded());
        Assertions.assertEquals(4, outcome.exitCode());
        Assertions.assertEquals("out", outcome.stdout());
        Assertions.assertEquals("err", outcome.stderr());
        Assertions.assertEquals("cmd exit=4 error=err", outcome.failureMessage("cmd"));
    }

    @Test
    void timeoutAndSpawnFailureAreRetryable() {
        ProcessRunner runner = new ProcessRunner();

        StepExecutionException timeout = Assertions.assertThrows(
                StepExecutionException.class,
                () -> runner.runShell("sleep 5", Path.of("."), Duration.ofMillis(200))
        );
        Assertions.assertTrue(timeout.retryable());

        StepExecutionException spawn = Assertions.assertThrows(
                StepExecutionException.class,
                () -> runner.run(List.of("promptrelay-no-such-binary"), Path.of("."), Duration.ofSeconds(5))
        );
        Assertions.assertTrue(spawn.retryable());

        Assertions.assertThrows(StepExecutionException.class, () -> runner.run(List.of(), null, null));
    }

    @Test
    void truncateFlattensAndLimitsText() {
        Assertions.assertEquals("a b", ProcessRunner.truncate("a\nb\r"));
        Assertions.assertEquals(515, ProcessRunner.truncate("x".repeat(600)).length());
        Assertions.assertEquals("", ProcessRunner.truncate(null));
    }
}
