package io.promptrelay.action;

import io.promptrelay.error.StepExecutionException;
import io.promptrelay.model.ActionType;
import io.promptrelay.model.ExecutionStep;
import io.promptrelay.model.StepAction;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

public final class ApiCallHandler implements ActionHandler {
    private final HttpClient httpClient;

    public ApiCallHandler(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public ActionType type() {
        return ActionType.API_CALL;
    }

    @Override
    public String execute(ExecutionStep step, StepContext context) throws InterruptedException {
        StepAction.ApiCall action = (StepAction.ApiCall) step.action();
        HttpRequest.BodyPublisher body = action.body() == null
                ? HttpRequest.BodyPublishers.noBody()
                : HttpRequest.BodyPublishers.ofString(action.body(), StandardCharsets.UTF_8);
        HttpRequest.Builder request;
        try {
            request = HttpRequest.newBuilder(URI.create(action.url()))
                    .method(action.method(), body)
                    .header("Accept", "application/json");
        } catch (IllegalArgumentException e) {
            throw StepExecutionException.terminal("API " + action.method() + " " + action.url()
                    + " is not a valid request: " + e.getMessage(), e);
        }
        if (action.body() != null) {
            request.header("Content-Type", "application/json");
        }
        if (context.timeout() != null) {
            request.timeout(context.timeout().compareTo(Duration.ofMillis(1)) < 0 ? Duration.ofMillis(1) : context.timeout());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(request.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw StepExecutionException.retryable("API " + action.method() + " " + action.url() + " failed: " + e.getMessage(), e);
        }
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return "API " + action.method() + " " + action.url() + " -> " + status + "\n" + response.body();
        }
        String message = "API " + action.method() + " " + action.url() + " returned " + status + ": "
                + ProcessRunner.truncate(response.body());
        if (status >= 400 && status < 500) {
            throw StepExecutionException.terminal(message);
        }
        throw StepExecutionException.retryable(message);
    }
}
