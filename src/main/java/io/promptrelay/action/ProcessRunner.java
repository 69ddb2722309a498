package io.promptrelay.action;

import io.promptrelay.error.StepExecutionException;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Spawns host processes for command-backed steps. Both output streams are drained on their own
 * threads so a chatty child cannot block on a full pipe.
 */
public final class ProcessRunner {
    private static final int MAX_ERROR_CHARS = 512;

    public ProcessOutcome run(List<String> command, Path workingDirectory, Duration timeout) throws InterruptedException {
        if (command == null || command.isEmpty()) {
            throw StepExecutionException.terminal("command cannot be empty");
        }
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        if (workingDirectory != null) {
            pb.directory(workingDirectory.toFile());
        }
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw StepExecutionException.retryable("process spawn failed: " + e.getMessage(), e);
        }
        try {
            process.getOutputStream().close();
        } catch (IOException ignored) {
            // stdin is unused; a child that exits early may already have closed it.
        }

        StreamCollector stdout = new StreamCollector(process.getInputStream());
        StreamCollector stderr = new StreamCollector(process.getErrorStream());
        stdout.start();
        stderr.start();
        try {
            long timeoutMs = timeout == null ? Long.MAX_VALUE : Math.max(1L, timeout.toMillis());
            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                throw StepExecutionException.retryable("process timeout after " + timeout);
            }
            stdout.join();
            stderr.join();
            return new ProcessOutcome(process.exitValue(), stdout.text(), stderr.text());
        } catch (InterruptedException e) {
            process.destroyForcibly();
            throw e;
        }
    }

    public ProcessOutcome runShell(String command, Path workingDirectory, Duration timeout) throws InterruptedException {
        return run(shellCommand(command), workingDirectory, timeout);
    }

    public static List<String> shellCommand(String command) {
        String os = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        if (os.contains("win")) {
            return List.of("cmd", "/C", command);
        }
        return List.of("sh", "-c", command);
    }

    public static String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }

    public record ProcessOutcome(int exitCode, String stdout, String stderr) {
        public boolean succeeded() {
            return exitCode == 0;
        }

        public String failureMessage(String label) {
            String detail = stderr == null || stderr.isBlank() ? stdout : stderr;
            return label + " exit=" + exitCode + " error=" + truncate(detail);
        }
    }

    private static final class StreamCollector extends Thread {
        private final InputStream input;
        private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        private volatile IOException failure;

        private StreamCollector(InputStream input) {
            this.input = input;
            setDaemon(true);
            setName("promptrelay-process-io");
        }

        @Override
        public void run() {
            try (InputStream in = input) {
                in.transferTo(buffer);
            } catch (IOException e) {
                failure = e;
            }
        }

        private String text() {
            String text = buffer.toString(StandardCharsets.UTF_8).strip();
            if (failure != null && text.isEmpty()) {
                return "<stream error: " + failure.getMessage() + ">";
            }
            return text;
        }
    }
}
