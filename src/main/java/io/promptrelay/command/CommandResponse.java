package io.promptrelay.command;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommandResponse(
        ResponseStatus status,
        String message,
        String executionId,
        Object data
) {
    public static CommandResponse success(String message, Object data) {
        return new CommandResponse(ResponseStatus.SUCCESS, message, null, data);
    }

    public static CommandResponse processing(String message, String executionId, Object data) {
        return new CommandResponse(ResponseStatus.PROCESSING, message, executionId, data);
    }

    public static CommandResponse error(String message) {
        return new CommandResponse(ResponseStatus.ERROR, message, null, null);
    }

    public static CommandResponse notFound(String message) {
        return new CommandResponse(ResponseStatus.NOT_FOUND, message, null, null);
    }

    public static CommandResponse unauthorized() {
        return new CommandResponse(ResponseStatus.UNAUTHORIZED, "Invalid or missing authentication token", null, null);
    }
}
