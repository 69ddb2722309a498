package io.promptrelay.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Strongly typed payload of a step. One record per {@link ActionType}; required parameters are
 * checked when the document is built, so handlers can rely on them being present.
 */
public interface StepAction {
    ActionType type();

    /**
     * Named-parameter view, used for rendering and audit rows.
     */
    Map<String, String> parameters();

    enum GitCommand {
        INIT, STATUS, ADD, COMMIT
    }

    enum ToolCommand {
        OPEN, INSTALL_EXTENSION
    }

    enum ValidationType {
        FILE_EXISTS
    }

    record CreateFile(String file, String content) implements StepAction {
        @Override
        public ActionType type() {
            return ActionType.CREATE_FILE;
        }

        @Override
        public Map<String, String> parameters() {
            return params("file", file, "content", content);
        }
    }

    record ModifyFile(String file, String content) implements StepAction {
        @Override
        public ActionType type() {
            return ActionType.MODIFY_FILE;
        }

        @Override
        public Map<String, String> parameters() {
            return params("file", file, "content", content);
        }
    }

    record ExecuteCommand(String command) implements StepAction {
        @Override
        public ActionType type() {
            return ActionType.EXECUTE_COMMAND;
        }

        @Override
        public Map<String, String> parameters() {
            return params("command", command);
        }
    }

    record CreateDirectory(String directory) implements StepAction {
        @Override
        public ActionType type() {
            return ActionType.CREATE_DIRECTORY;
        }

        @Override
        public Map<String, String> parameters() {
            return params("directory", directory);
        }
    }

    record GitOperation(GitCommand operation, String files, String message) implements StepAction {
        @Override
        public ActionType type() {
            return ActionType.GIT_OPERATION;
        }

        @Override
        public Map<String, String> parameters() {
            return params("operation", operation.name().toLowerCase(), "files", files, "message", message);
        }
    }

    record ExternalToolAction(ToolCommand action, String path, String extension) implements StepAction {
        @Override
        public ActionType type() {
            return ActionType.EXTERNAL_TOOL_ACTION;
        }

        @Override
        public Map<String, String> parameters() {
            return params("action", action.name().toLowerCase(), "path", path, "extension", extension);
        }
    }

    record ApiCall(String url, String method, String body) implements StepAction {
        @Override
        public ActionType type() {
            return ActionType.API_CALL;
        }

        @Override
        public Map<String, String> parameters() {
            return params("url", url, "method", method, "body", body);
        }
    }

    record DatabaseOperation(String operation, String statement) implements StepAction {
        @Override
        public ActionType type() {
            return ActionType.DATABASE_OPERATION;
        }

        @Override
        public Map<String, String> parameters() {
            return params("operation", operation, "statement", statement);
        }
    }

    record TestExecution(String command) implements StepAction {
        @Override
        public ActionType type() {
            return ActionType.TEST_EXECUTION;
        }

        @Override
        public Map<String, String> parameters() {
            return params("command", command);
        }
    }

    record Validation(ValidationType validationType, String target) implements StepAction {
        @Override
        public ActionType type() {
            return ActionType.VALIDATION;
        }

        @Override
        public Map<String, String> parameters() {
            return params("type", validationType.name().toLowerCase(), "target", target);
        }
    }

    record Custom(String name) implements StepAction {
        @Override
        public ActionType type() {
            return ActionType.CUSTOM;
        }

        @Override
        public Map<String, String> parameters() {
            return params("name", name);
        }
    }

    private static Map<String, String> params(String... keyValues) {
        Map<String, String> out = new LinkedHashMap<>();
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            if (keyValues[i + 1] != null) {
                out.put(keyValues[i], keyValues[i + 1]);
            }
        }
        return out;
    }
}
