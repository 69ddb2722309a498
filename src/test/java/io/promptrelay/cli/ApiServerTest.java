package io.promptrelay.cli;

import com.fasterxml.jackson.databind.JsonNode;
import io.promptrelay.config.PromptRelayConfig;
import io.promptrelay.document.DocumentBuilder;
import io.promptrelay.model.StepAction;
import io.promptrelay.runtime.PromptRelayRuntime;
import io.promptrelay.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Stream;

final class ApiServerTest {

    @Test
    void servesHealthAndGuardsRoutesWithTheToken() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-api-");
        try (PromptRelayRuntime runtime = runtime(root);
             ApiServer server = new ApiServer(runtime, "127.0.0.1", 0)) {
            server.start();
            String base = "http://127.0.0.1:" + server.port();
            HttpClient client = HttpClient.newHttpClient();

            HttpResponse<String> health = client.send(HttpRequest.newBuilder(URI.create(base + "/health")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            Assertions.assertEquals(200, health.statusCode());
            Assertions.assertEquals("ok", Jsons.mapper().readTree(health.body()).path("status").asText());

            HttpResponse<String> anonymous = client.send(HttpRequest.newBuilder(URI.create(base + "/api/v1/documents")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            Assertions.assertEquals(401, anonymous.statusCode());

            HttpResponse<String> viaQuery = client.send(
                    HttpRequest.newBuilder(URI.create(base + "/api/v1/documents?token=api-token")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            Assertions.assertEquals(200, viaQuery.statusCode());
            Assertions.assertEquals(1, Jsons.mapper().readTree(viaQuery.body()).path("count").asInt());

            HttpResponse<String> wrongMethod = client.send(
                    HttpRequest.newBuilder(URI.create(base + "/api/v1/command")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            Assertions.assertEquals(405, wrongMethod.statusCode());

            HttpResponse<String> rejected = client.send(post(base, "{\"action\":{\"type\":\"list_documents\"}}", "nope"),
                    HttpResponse.BodyHandlers.ofString());
            Assertions.assertEquals(401, rejected.statusCode());
            Assertions.assertEquals("UNAUTHORIZED", Jsons.mapper().readTree(rejected.body()).path("status").asText());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void commandStartsExecutionThatCanBeQueried() throws Exception {
        Path root = Files.createTempDirectory("promptrelay-test-api-exec-");
        try (PromptRelayRuntime runtime = runtime(root);
             ApiServer server = new ApiServer(runtime, "127.0.0.1", 0)) {
            server.start();
            String base = "http://127.0.0.1:" + server.port();
            HttpClient client = HttpClient.newHttpClient();

            HttpResponse<String> started = client.send(
                    post(base, "{\"action\":{\"type\":\"execute_prompt\",\"document\":\"Api Plan\",\"promptNumber\":1}}", "api-token"),
                    HttpResponse.BodyHandlers.ofString());
            Assertions.assertEquals(202, started.statusCode());
            JsonNode body = Jsons.mapper().readTree(started.body());
            Assertions.assertEquals("PROCESSING", body.path("status").asText());
            String executionId = body.path("executionId").asText();
            Assertions.assertTrue(executionId.startsWith("exe_"));

            runtime.executor().awaitReport(executionId, Duration.ofSeconds(20));
            HttpResponse<String> status = client.send(HttpRequest.newBuilder(URI.create(base + "/api/v1/executions/" + executionId))
                            .header("Authorization", "Bearer api-token").GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            Assertions.assertEquals(200, status.statusCode());
            Assertions.assertEquals("COMPLETED", Jsons.mapper().readTree(status.body()).path("status").asText());

            HttpResponse<String> missing = client.send(HttpRequest.newBuilder(URI.create(base + "/api/v1/executions/exe_missing"))
                            .header("Authorization", "Bearer api-token").GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            Assertions.assertEquals(404, missing.statusCode());

            HttpResponse<String> active = client.send(HttpRequest.newBuilder(URI.create(base + "/api/v1/executions"))
                            .header("Authorization", "Bearer api-token").GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            Assertions.assertEquals(0, Jsons.mapper().readTree(active.body()).path("executions").size());
        } finally {
            deleteRecursively(root);
        }
    }

    private static PromptRelayRuntime runtime(Path root) {
        PromptRelayRuntime runtime = new PromptRelayRuntime(PromptRelayConfig.builder(root)
                .workspaceDir(root)
                .authToken("api-token")
                .auditEnabled(false)
                .build());
        runtime.documents().add(DocumentBuilder.document("Api Plan")
                .prompt(1, "Write").step("write", new StepAction.CreateFile("api.txt", "x"))
                .build());
        return runtime;
    }

    private static HttpRequest post(String base, String json, String token) {
        return HttpRequest.newBuilder(URI.create(base + "/api/v1/command"))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + token)
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
