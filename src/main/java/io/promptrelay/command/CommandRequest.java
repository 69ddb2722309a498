package io.promptrelay.command;

import java.util.List;
import java.util.Map;

public record CommandRequest(
        String workflowId,
        String requestId,
        InboundCommand action,
        Map<String, String> parameters,
        List<String> callbackUrls,
        String authToken
) {
    public CommandRequest {
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        callbackUrls = callbackUrls == null ? List.of() : List.copyOf(callbackUrls);
    }

    public static CommandRequest of(InboundCommand action, String authToken) {
        return new CommandRequest(null, null, action, Map.of(), List.of(), authToken);
    }

    public CommandRequest withAuthToken(String token) {
        return new CommandRequest(workflowId, requestId, action, parameters, callbackUrls, token);
    }
}
