package io.promptrelay.command;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.promptrelay.document.DocumentLoader;
import io.promptrelay.document.DocumentStore;
import io.promptrelay.error.ErrorKind;
import io.promptrelay.error.NotFoundException;
import io.promptrelay.error.PromptRelayException;
import io.promptrelay.events.WebhookEventSubscriber;
import io.promptrelay.execution.ExecutionReport;
import io.promptrelay.execution.PromptExecutor;
import io.promptrelay.model.PromptDocument;
import io.promptrelay.observability.AuditLogger;
import io.promptrelay.util.Hashing;
import io.promptrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for remote commands. Every request is checked against the shared token before it
 * touches the executor; with no token configured all requests are accepted.
 */
public final class CommandGateway {
    private static final Logger log = LoggerFactory.getLogger(CommandGateway.class);

    private final PromptExecutor executor;
    private final DocumentStore documents;
    private final String authToken;
    private final Path workspaceDir;
    private final AuditLogger auditLogger;
    private final WebhookEventSubscriber webhooks;

    public CommandGateway(
            PromptExecutor executor,
            String authToken,
            Path workspaceDir,
            AuditLogger auditLogger,
            WebhookEventSubscriber webhooks
    ) {
        this.executor = executor;
        this.documents = executor.documents();
        this.authToken = authToken == null || authToken.isBlank() ? null : authToken;
        this.workspaceDir = workspaceDir;
        this.auditLogger = auditLogger;
        this.webhooks = webhooks;
    }

    public boolean authenticate(String providedToken) {
        if (authToken == null) {
            return true;
        }
        return Hashing.constantTimeEquals(authToken, providedToken);
    }

    public CommandResponse handleJson(String body, String headerToken) {
        CommandRequest request;
        try {
            request = Jsons.mapper().readValue(body, CommandRequest.class);
        } catch (JsonProcessingException e) {
            if (!authenticate(headerToken)) {
                return CommandResponse.unauthorized();
            }
            return CommandResponse.error("Invalid command request: " + e.getOriginalMessage());
        }
        if (request.authToken() == null && headerToken != null) {
            request = request.withAuthToken(headerToken);
        }
        return handle(request);
    }

    public CommandResponse handle(CommandRequest request) {
        if (request == null || !authenticate(request.authToken())) {
            audit(request, "unauthorized", Map.of());
            log.warn("Rejected command {}: invalid token", commandName(request));
            return CommandResponse.unauthorized();
        }
        if (request.action() == null) {
            return CommandResponse.error("Command action is required");
        }
        CommandResponse response;
        try {
            response = dispatch(request);
        } catch (PromptRelayException e) {
            response = fromError(e);
        } catch (IllegalArgumentException e) {
            response = CommandResponse.error(e.getMessage());
        }
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("status", response.status().name());
        if (response.executionId() != null) {
            details.put("execution_id", response.executionId());
        }
        if (request.workflowId() != null) {
            details.put("workflow_id", request.workflowId());
        }
        audit(request, response.status().name().toLowerCase(Locale.ROOT), details);
        return response;
    }

    private CommandResponse dispatch(CommandRequest request) {
        InboundCommand command = request.action();
        if (command instanceof InboundCommand.ExecutePrompt execute) {
            if (execute.promptNumber() == null) {
                return CommandResponse.error("promptNumber is required");
            }
            List<URI> callbacks = WebhookEventSubscriber.parseCallbacks(request.callbackUrls());
            String executionId = executor.start(documentRef(execute.document()), execute.promptNumber());
            registerCallbacks(executionId, callbacks);
            return CommandResponse.processing("Prompt " + execute.promptNumber() + " execution started", executionId, null);
        }
        if (command instanceof InboundCommand.ExecutePromptSequence sequence) {
            List<Integer> numbers = sequence.promptNumbers() == null ? List.of() : sequence.promptNumbers();
            String sequenceId = executor.startSequence(documentRef(sequence.document()), numbers, sequence.stopOnErrorOrDefault());
            return CommandResponse.processing(
                    "Sequence of " + numbers.size() + " prompts started",
                    null,
                    Map.of("sequenceId", sequenceId, "promptNumbers", numbers)
            );
        }
        if (command instanceof InboundCommand.GetDocumentInfo info) {
            PromptDocument document = documents.resolve(documentRef(info.document()));
            return CommandResponse.success("Document " + document.title(), DocumentViews.info(document));
        }
        if (command instanceof InboundCommand.GetExecutionStatus status) {
            return executionStatus(status.executionId());
        }
        if (command instanceof InboundCommand.CancelExecution cancel) {
            return new CommandResponse(
                    ResponseStatus.SUCCESS,
                    "Execution " + cancel.executionId() + " cancelled",
                    cancel.executionId(),
                    executor.cancel(cancel.executionId())
            );
        }
        if (command instanceof InboundCommand.ListDocuments) {
            String activeId = documents.active().map(PromptDocument::id).orElse(null);
            List<DocumentViews.DocumentSummary> summaries = documents.list().stream()
                    .map(d -> DocumentViews.summary(d, d.id().equals(activeId)))
                    .toList();
            return CommandResponse.success(summaries.size() + " documents", summaries);
        }
        if (command instanceof InboundCommand.ProcessDocument process) {
            if (process.documentPath() == null || process.documentPath().isBlank()) {
                return CommandResponse.error("documentPath is required");
            }
            Path path = workspaceDir.resolve(process.documentPath()).normalize();
            PromptDocument document = documents.add(DocumentLoader.load(path));
            return CommandResponse.success("Document processed: " + document.title(), DocumentViews.summary(
                    document,
                    documents.active().map(PromptDocument::id).filter(document.id()::equals).isPresent()
            ));
        }
        return CommandResponse.error("Unsupported command: " + command.getClass().getSimpleName());
    }

    private CommandResponse executionStatus(String executionId) {
        if (executionId == null || executionId.isBlank()) {
            return CommandResponse.error("executionId is required");
        }
        try {
            return new CommandResponse(ResponseStatus.PROCESSING, "Execution running", executionId, executor.getStatus(executionId));
        } catch (NotFoundException e) {
            Optional<ExecutionReport> report = executor.report(executionId);
            if (report.isPresent()) {
                return new CommandResponse(
                        ResponseStatus.SUCCESS,
                        "Execution " + report.get().status().name().toLowerCase(Locale.ROOT),
                        executionId,
                        report.get()
                );
            }
            throw e;
        }
    }

    private String documentRef(String raw) {
        if (raw != null && !raw.isBlank()) {
            return raw;
        }
        return documents.active()
                .map(PromptDocument::id)
                .orElseThrow(() -> new NotFoundException("No document named and no active document"));
    }

    private void registerCallbacks(String executionId, List<URI> callbackUrls) {
        if (webhooks != null && !callbackUrls.isEmpty()) {
            webhooks.register(executionId, callbackUrls);
        }
    }

    static CommandResponse fromError(PromptRelayException e) {
        ErrorKind kind = e.kind();
        return switch (kind) {
            case NOT_FOUND -> CommandResponse.notFound(e.getMessage());
            case UNAUTHORIZED -> CommandResponse.unauthorized();
            default -> new CommandResponse(ResponseStatus.ERROR, e.getMessage(), null, Map.of("kind", kind.name()));
        };
    }

    private void audit(CommandRequest request, String result, Map<String, Object> details) {
        if (auditLogger == null) {
            return;
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "command." + commandName(request),
                "gateway",
                "command",
                result,
                null,
                null,
                details
        ));
    }

    private static String commandName(CommandRequest request) {
        if (request == null || request.action() == null) {
            return "unknown";
        }
        String simple = request.action().getClass().getSimpleName();
        return simple.replaceAll("([a-z])([A-Z])", "$1_$2").toLowerCase(Locale.ROOT);
    }
}
