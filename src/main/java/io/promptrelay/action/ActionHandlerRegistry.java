package io.promptrelay.action;

import io.promptrelay.config.PromptRelayConfig;
import io.promptrelay.model.ActionType;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public final class ActionHandlerRegistry {
    private final Map<ActionType, ActionHandler> handlers = new ConcurrentHashMap<>();

    public void register(ActionHandler handler) {
        handlers.put(handler.type(), handler);
    }

    public Optional<ActionHandler> findByType(ActionType type) {
        return Optional.ofNullable(handlers.get(type));
    }

    public Collection<ActionType> listTypes() {
        return handlers.keySet();
    }

    public static ActionHandlerRegistry defaults(PromptRelayConfig config) {
        return defaults(config, new AcknowledgingDatabaseGateway());
    }

    public static ActionHandlerRegistry defaults(PromptRelayConfig config, DatabaseGateway databaseGateway) {
        ProcessRunner runner = new ProcessRunner();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        ActionHandlerRegistry registry = new ActionHandlerRegistry();
        registry.register(new CreateFileHandler());
        registry.register(new ModifyFileHandler());
        registry.register(new ExecuteCommandHandler(runner));
        registry.register(new CreateDirectoryHandler());
        registry.register(new GitOperationHandler(runner));
        registry.register(new ExternalToolHandler(runner, config.externalToolCommand()));
        registry.register(new ApiCallHandler(httpClient));
        registry.register(new DatabaseOperationHandler(databaseGateway));
        registry.register(new TestExecutionHandler(runner));
        registry.register(new ValidationHandler());
        registry.register(new CustomActionHandler());
        return registry;
    }
}
