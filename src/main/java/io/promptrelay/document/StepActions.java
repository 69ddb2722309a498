package io.promptrelay.document;

import io.promptrelay.error.InvalidDocumentException;
import io.promptrelay.model.ActionType;
import io.promptrelay.model.StepAction;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Map;

/**
 * Converts the parser's named string parameters into typed {@link StepAction} payloads.
 */
public final class StepActions {
    private StepActions() {
    }

    public static StepAction fromParameters(ActionType type, Map<String, String> parameters) {
        Map<String, String> p = parameters == null ? Map.of() : parameters;
        return switch (type) {
            case CREATE_FILE -> new StepAction.CreateFile(required(type, p, "file"), optional(p, "content"));
            case MODIFY_FILE -> new StepAction.ModifyFile(required(type, p, "file"), optional(p, "content"));
            case EXECUTE_COMMAND -> new StepAction.ExecuteCommand(required(type, p, "command"));
            case CREATE_DIRECTORY -> new StepAction.CreateDirectory(required(type, p, "directory"));
            case GIT_OPERATION -> gitOperation(p);
            case EXTERNAL_TOOL_ACTION -> externalTool(p);
            case API_CALL -> apiCall(p);
            case DATABASE_OPERATION -> new StepAction.DatabaseOperation(
                    required(type, p, "operation"),
                    optional(p, "statement")
            );
            case TEST_EXECUTION -> new StepAction.TestExecution(required(type, p, "command"));
            case VALIDATION -> validation(p);
            case CUSTOM -> new StepAction.Custom(required(type, p, "name"));
        };
    }

    private static StepAction gitOperation(Map<String, String> p) {
        String raw = required(ActionType.GIT_OPERATION, p, "operation");
        StepAction.GitCommand command = parseEnum(StepAction.GitCommand.class, raw, "git operation");
        return new StepAction.GitOperation(command, optional(p, "files"), optional(p, "message"));
    }

    private static StepAction externalTool(Map<String, String> p) {
        String raw = required(ActionType.EXTERNAL_TOOL_ACTION, p, "action");
        StepAction.ToolCommand action = parseEnum(StepAction.ToolCommand.class, raw, "external tool action");
        return switch (action) {
            case OPEN -> new StepAction.ExternalToolAction(action, required(ActionType.EXTERNAL_TOOL_ACTION, p, "path"), null);
            case INSTALL_EXTENSION -> new StepAction.ExternalToolAction(
                    action,
                    null,
                    required(ActionType.EXTERNAL_TOOL_ACTION, p, "extension")
            );
        };
    }

    private static StepAction apiCall(Map<String, String> p) {
        String url = required(ActionType.API_CALL, p, "url");
        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new InvalidDocumentException("Invalid api_call url: " + url + " (" + e.getReason() + ")", e);
        }
        if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
            throw new InvalidDocumentException("api_call url must be http(s): " + url);
        }
        if (uri.getHost() == null || uri.getHost().isBlank()) {
            throw new InvalidDocumentException("api_call url has no host: " + url);
        }
        String method = optional(p, "method");
        String normalized = method == null || method.isBlank() ? "GET" : method.trim().toUpperCase(Locale.ROOT);
        switch (normalized) {
            case "GET", "POST", "PUT", "PATCH", "DELETE", "HEAD" -> {
            }
            default -> throw new InvalidDocumentException("Unsupported api_call method: " + method);
        }
        return new StepAction.ApiCall(uri.toString(), normalized, optional(p, "body"));
    }

    private static StepAction validation(Map<String, String> p) {
        String rawType = optional(p, "type");
        StepAction.ValidationType type = parseEnum(
                StepAction.ValidationType.class,
                rawType == null || rawType.isBlank() ? "file_exists" : rawType,
                "validation type"
        );
        String target = optional(p, "target");
        if (target == null || target.isBlank()) {
            // older plans name the validated path "file"
            target = optional(p, "file");
        }
        if (target == null || target.isBlank()) {
            throw new InvalidDocumentException("validation step requires parameter 'target'");
        }
        return new StepAction.Validation(type, target.trim());
    }

    private static String required(ActionType type, Map<String, String> p, String key) {
        String value = p.get(key);
        if (value == null || value.isBlank()) {
            throw new InvalidDocumentException(type.wireName() + " step requires parameter '" + key + "'");
        }
        return value.trim();
    }

    private static String optional(Map<String, String> p, String key) {
        return p.get(key);
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> enumType, String raw, String label) {
        String normalized = raw.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        try {
            return Enum.valueOf(enumType, normalized);
        } catch (IllegalArgumentException e) {
            throw new InvalidDocumentException("Unknown " + label + ": " + raw, e);
        }
    }
}
