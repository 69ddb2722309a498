package io.promptrelay.cli;

import io.promptrelay.command.DocumentViews;
import io.promptrelay.command.OutcomeFormatter;
import io.promptrelay.config.PromptRelayConfig;
import io.promptrelay.error.PromptRelayException;
import io.promptrelay.execution.DependencyGate;
import io.promptrelay.execution.ExecutionReport;
import io.promptrelay.model.ExecutablePrompt;
import io.promptrelay.model.PromptDocument;
import io.promptrelay.model.PromptStatus;
import io.promptrelay.observability.AuditLogger;
import io.promptrelay.runtime.PromptRelayRuntime;
import io.promptrelay.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
        name = "promptrelay",
        mixinStandardHelpOptions = true,
        description = "Executes structured prompt plans step by step",
        subcommands = {
                PromptRelayCommand.RunCommand.class,
                PromptRelayCommand.InspectCommand.class,
                PromptRelayCommand.ServeCommand.class,
                PromptRelayCommand.AuditVerifyCommand.class
        }
)
public final class PromptRelayCommand implements Runnable {
    @Option(names = {"--root"}, description = "Runtime data root directory", defaultValue = "data")
    String root;

    @Option(names = {"--workspace"}, description = "Working directory for relative step paths (default: root)")
    String workspace;

    @Option(names = {"--max-concurrent"}, description = "Maximum executions in flight")
    Integer maxConcurrent;

    @Option(names = {"--step-timeout-ms"}, description = "Per-step timeout in milliseconds")
    Long stepTimeoutMs;

    @Option(names = {"--prompt-timeout-ms"}, description = "Per-prompt timeout in milliseconds")
    Long promptTimeoutMs;

    @Option(names = {"--max-retries"}, description = "Retries after a retryable step failure")
    Integer maxRetries;

    @Option(names = {"--retry-delay-ms"}, description = "Delay between retries in milliseconds")
    Long retryDelayMs;

    @Option(names = {"--no-auto-retry"}, description = "Fail a step on its first failure")
    boolean noAutoRetry;

    @Option(names = {"--token"}, description = "Shared token required on inbound commands")
    String token;

    @Override
    public void run() {
        System.out.println("Use subcommands: run | inspect | serve | audit-verify");
    }

    PromptRelayConfig config() {
        PromptRelayConfig base = PromptRelayConfig.fromRoot(root);
        PromptRelayConfig.Builder builder = base.toBuilder();
        if (workspace != null && !workspace.isBlank()) {
            builder.workspaceDir(Paths.get(workspace));
        }
        if (maxConcurrent != null) {
            builder.maxConcurrent(maxConcurrent);
        }
        if (stepTimeoutMs != null) {
            builder.stepTimeout(Duration.ofMillis(stepTimeoutMs));
        }
        if (promptTimeoutMs != null) {
            builder.promptTimeout(Duration.ofMillis(promptTimeoutMs));
        }
        if (maxRetries != null) {
            builder.maxRetries(maxRetries);
        }
        if (retryDelayMs != null) {
            builder.retryDelay(Duration.ofMillis(retryDelayMs));
        }
        if (noAutoRetry) {
            builder.autoRetry(false);
        }
        if (token != null && !token.isBlank()) {
            builder.authToken(token);
        }
        return builder.build();
    }

    PromptRelayRuntime runtime() {
        return new PromptRelayRuntime(config());
    }

    @Command(name = "run", description = "Load a plan and run one prompt, a list of prompts, or all of them")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        PromptRelayCommand parent;

        @Option(names = {"--plan"}, required = true, description = "Plan JSON file")
        String plan;

        @Option(names = {"--prompt"}, split = ",", description = "Prompt number(s) to run in order (default: all)")
        List<Integer> prompts;

        @Option(names = {"--continue-on-error"}, defaultValue = "false",
                description = "Keep going after a prompt fails")
        boolean continueOnError;

        @Option(names = {"--json"}, defaultValue = "false", description = "Print JSON reports instead of text")
        boolean json;

        @Override
        public Integer call() {
            try (PromptRelayRuntime runtime = parent.runtime()) {
                PromptDocument document = runtime.loadDocument(Paths.get(plan));
                List<Integer> numbers = prompts == null || prompts.isEmpty()
                        ? document.prompts().stream().map(ExecutablePrompt::number).toList()
                        : prompts;
                List<Object> outcomes = new ArrayList<>();
                boolean allCompleted = true;
                for (int number : numbers) {
                    try {
                        ExecutionReport report = runtime.executor().executeAndWait(document.id(), number);
                        outcomes.add(report);
                        if (!json) {
                            System.out.print(OutcomeFormatter.render(report));
                        }
                        if (report.status() != PromptStatus.COMPLETED) {
                            allCompleted = false;
                            if (!continueOnError) {
                                break;
                            }
                        }
                    } catch (PromptRelayException e) {
                        allCompleted = false;
                        Map<String, Object> error = new LinkedHashMap<>();
                        error.put("promptNumber", number);
                        error.put("kind", e.kind().name());
                        error.put("error", e.getMessage());
                        outcomes.add(error);
                        if (!json) {
                            System.out.println("[" + e.kind() + "] prompt " + number + ": " + e.getMessage());
                        }
                        if (!continueOnError) {
                            break;
                        }
                    }
                }
                if (json) {
                    System.out.println(Jsons.toJson(outcomes));
                }
                return allCompleted ? 0 : 1;
            }
        }
    }

    @Command(name = "inspect", description = "Validate a plan and show prompts, dependencies and readiness")
    static final class InspectCommand implements Callable<Integer> {
        @ParentCommand
        PromptRelayCommand parent;

        @Option(names = {"--plan"}, required = true, description = "Plan JSON file")
        String plan;

        @Override
        public Integer call() {
            try (PromptRelayRuntime runtime = parent.runtime()) {
                PromptDocument document = runtime.loadDocument(Paths.get(plan));
                System.out.println(Jsons.toJson(DocumentViews.info(document)));
                for (DependencyGate.PromptReadiness r : DependencyGate.readiness(document)) {
                    System.out.println("prompt " + r.promptNumber() + " '" + r.title() + "': "
                            + (r.ready() ? "ready" : "blocked by " + r.blockedBy()));
                }
                return 0;
            }
        }
    }

    @Command(name = "serve", description = "Serve the command API, execution status and event stream over HTTP")
    static final class ServeCommand implements Callable<Integer> {
        @ParentCommand
        PromptRelayCommand parent;

        @Option(names = {"--host"}, defaultValue = "127.0.0.1", description = "Bind address")
        String host;

        @Option(names = {"--port"}, defaultValue = "8080", description = "Bind port")
        int port;

        @Option(names = {"--plan"}, description = "Plan JSON file(s) to load at startup")
        List<String> plans;

        @Override
        public Integer call() throws Exception {
            PromptRelayRuntime runtime = parent.runtime();
            if (plans != null) {
                for (String plan : plans) {
                    runtime.loadDocument(Paths.get(plan));
                }
            }
            ApiServer server = new ApiServer(runtime, host, port);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                server.close();
                runtime.close();
            }));
            server.start();
            System.out.println("promptrelay API on http://" + host + ":" + server.port());
            Thread.currentThread().join();
            return 0;
        }
    }

    @Command(name = "audit-verify", description = "Verify the audit trail hash chain")
    static final class AuditVerifyCommand implements Callable<Integer> {
        @ParentCommand
        PromptRelayCommand parent;

        @Override
        public Integer call() {
            PromptRelayConfig config = parent.config();
            Path file = config.auditFile();
            AuditLogger.IntegrityOutcome out = new AuditLogger(file, "promptrelay", null).verifyIntegrity();
            System.out.println(Jsons.toJson(out));
            return out.ok() ? 0 : 1;
        }
    }
}
