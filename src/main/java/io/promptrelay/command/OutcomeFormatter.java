package io.promptrelay.command;

import io.promptrelay.execution.ExecutionReport;
import io.promptrelay.execution.ExecutionSnapshot;
import io.promptrelay.execution.SequenceSnapshot;
import io.promptrelay.model.StepResult;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * Human-readable rendering of outcomes for terminals and chat hooks. The text is for people only;
 * programs read {@link ExecutionReport} and {@link CommandResponse} instead.
 */
public final class OutcomeFormatter {
    private static final int MAX_LINE_CHARS = 160;

    private OutcomeFormatter() {
    }

    public static String render(ExecutionReport report) {
        StringBuilder out = new StringBuilder();
        out.append('[').append(report.status()).append("] prompt ").append(report.promptNumber())
                .append(" (").append(report.executionId()).append(')');
        if (report.startedAt() != null && report.completedAt() != null) {
            out.append(" in ").append(formatDuration(Duration.between(report.startedAt(), report.completedAt())));
        }
        out.append('\n');
        appendSteps(out, report.stepResults());
        if (report.error() != null && !report.error().isBlank()) {
            out.append("  error: ").append(firstLine(report.error())).append('\n');
        }
        return out.toString();
    }

    public static String render(ExecutionSnapshot snapshot) {
        StringBuilder out = new StringBuilder();
        out.append('[').append(snapshot.status()).append("] prompt ").append(snapshot.promptNumber())
                .append(" (").append(snapshot.executionId()).append(") step ")
                .append(snapshot.currentStep()).append('/').append(snapshot.totalSteps())
                .append(", ").append(snapshot.progressPercent()).append("%\n");
        appendSteps(out, snapshot.stepResults());
        return out.toString();
    }

    public static String render(SequenceSnapshot sequence) {
        StringBuilder out = new StringBuilder();
        out.append('[').append(sequence.status()).append("] sequence ").append(sequence.sequenceId())
                .append(" prompts ").append(sequence.promptNumbers()).append('\n');
        for (SequenceSnapshot.Entry entry : sequence.entries()) {
            out.append("  prompt ").append(entry.promptNumber()).append(": ").append(entry.status());
            if (entry.error() != null) {
                out.append(" - ").append(firstLine(entry.error()));
            }
            out.append('\n');
        }
        return out.toString();
    }

    public static String render(CommandResponse response) {
        StringBuilder out = new StringBuilder();
        out.append('[').append(response.status()).append("] ").append(response.message());
        if (response.executionId() != null) {
            out.append(" (").append(response.executionId()).append(')');
        }
        return out.append('\n').toString();
    }

    private static void appendSteps(StringBuilder out, List<StepResult> results) {
        for (StepResult result : results) {
            out.append(result.succeeded() ? "  + " : "  x ")
                    .append("step ").append(result.stepNumber())
                    .append(" attempt ").append(result.attempt());
            if (result.duration() != null) {
                out.append(" (").append(formatDuration(result.duration())).append(')');
            }
            String detail = result.succeeded() ? result.output() : result.error();
            if (detail != null && !detail.isBlank()) {
                out.append(": ").append(firstLine(detail));
            }
            if (result.failureKind() == StepResult.FailureKind.TERMINAL) {
                out.append(" [terminal]");
            }
            out.append('\n');
        }
    }

    static String formatDuration(Duration duration) {
        long millis = duration.toMillis();
        if (millis < 1_000L) {
            return millis + "ms";
        }
        if (millis < 60_000L) {
            return String.format(Locale.ROOT, "%.1fs", millis / 1_000.0);
        }
        return duration.toMinutes() + "m" + duration.toSecondsPart() + "s";
    }

    private static String firstLine(String text) {
        String line = text.strip();
        int newline = line.indexOf('\n');
        if (newline >= 0) {
            line = line.substring(0, newline).strip() + " ...";
        }
        if (line.length() > MAX_LINE_CHARS) {
            line = line.substring(0, MAX_LINE_CHARS) + "...";
        }
        return line;
    }
}
