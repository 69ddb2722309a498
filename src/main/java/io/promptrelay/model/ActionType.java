package io.promptrelay.model;

import java.util.Locale;

public enum ActionType {
    CREATE_FILE("create_file"),
    MODIFY_FILE("modify_file"),
    EXECUTE_COMMAND("execute_command"),
    CREATE_DIRECTORY("create_directory"),
    GIT_OPERATION("git_operation"),
    EXTERNAL_TOOL_ACTION("external_tool_action"),
    API_CALL("api_call"),
    DATABASE_OPERATION("database_operation"),
    TEST_EXECUTION("test_execution"),
    VALIDATION("validation"),
    CUSTOM("custom");

    private final String wireName;

    ActionType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ActionType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Action type is required");
        }
        String normalized = raw.trim().replace('-', '_').toLowerCase(Locale.ROOT);
        for (ActionType value : values()) {
            if (value.wireName.equals(normalized)
                    || value.name().equalsIgnoreCase(normalized)
                    || value.wireName.replace("_", "").equals(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown action type: " + raw);
    }
}
