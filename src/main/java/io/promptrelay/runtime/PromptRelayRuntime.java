package io.promptrelay.runtime;

import io.promptrelay.action.AcknowledgingDatabaseGateway;
import io.promptrelay.action.ActionHandlerRegistry;
import io.promptrelay.action.DatabaseGateway;
import io.promptrelay.action.StepDispatcher;
import io.promptrelay.command.CommandGateway;
import io.promptrelay.config.PromptRelayConfig;
import io.promptrelay.document.DocumentLoader;
import io.promptrelay.document.DocumentStore;
import io.promptrelay.events.AuditEventSubscriber;
import io.promptrelay.events.EventBus;
import io.promptrelay.events.LoggingEventSubscriber;
import io.promptrelay.events.WebhookEventSubscriber;
import io.promptrelay.execution.ExecutionTracker;
import io.promptrelay.execution.PromptExecutor;
import io.promptrelay.model.PromptDocument;
import io.promptrelay.observability.AuditLogger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Wires one process worth of components: document store, tracker, event bus with its built-in
 * subscribers, dispatcher, executor and command gateway. Nothing here is global; tests build as
 * many runtimes as they like.
 */
public final class PromptRelayRuntime implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(PromptRelayRuntime.class);

    private final PromptRelayConfig config;
    private final DocumentStore documents;
    private final ExecutionTracker tracker;
    private final EventBus events;
    private final AuditLogger auditLogger;
    private final WebhookEventSubscriber webhooks;
    private final PromptExecutor executor;
    private final CommandGateway gateway;

    public PromptRelayRuntime(PromptRelayConfig config) {
        this(config, new AcknowledgingDatabaseGateway());
    }

    public PromptRelayRuntime(PromptRelayConfig config, DatabaseGateway databaseGateway) {
        this(config, ActionHandlerRegistry.defaults(config, databaseGateway));
    }

    public PromptRelayRuntime(PromptRelayConfig config, ActionHandlerRegistry handlers) {
        this.config = config;
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.workspaceDir());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to initialize runtime directories under " + config.rootDir(), e);
        }
        this.documents = new DocumentStore();
        this.tracker = new ExecutionTracker();
        this.events = new EventBus();
        this.events.subscribe(new LoggingEventSubscriber());
        if (config.auditEnabled()) {
            this.auditLogger = new AuditLogger(config.auditFile(), "promptrelay", null);
            this.events.subscribe(new AuditEventSubscriber(auditLogger));
        } else {
            this.auditLogger = null;
        }
        this.webhooks = WebhookEventSubscriber.create(config.callbackUrls(), config.authToken());
        this.events.subscribe(webhooks);
        this.executor = new PromptExecutor(documents, tracker, new StepDispatcher(handlers), events, config);
        this.gateway = new CommandGateway(executor, config.authToken(), config.workspaceDir(), auditLogger, webhooks);
        log.info("Runtime ready: root={} workspace={} maxConcurrent={} autoRetry={} maxRetries={}",
                config.rootDir(), config.workspaceDir(), config.maxConcurrent(), config.autoRetry(), config.maxRetries());
    }

    public PromptDocument loadDocument(Path planFile) {
        PromptDocument document = documents.add(DocumentLoader.load(planFile));
        log.info("Loaded document {} '{}' with {} prompts", document.id(), document.title(), document.prompts().size());
        return document;
    }

    public PromptRelayConfig config() {
        return config;
    }

    public DocumentStore documents() {
        return documents;
    }

    public ExecutionTracker tracker() {
        return tracker;
    }

    public EventBus events() {
        return events;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    public PromptExecutor executor() {
        return executor;
    }

    public CommandGateway gateway() {
        return gateway;
    }

    @Override
    public void close() {
        executor.close();
        events.flush(Duration.ofSeconds(5));
        events.close();
    }
}
