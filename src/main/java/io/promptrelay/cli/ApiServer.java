package io.promptrelay.cli;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import io.promptrelay.command.CommandGateway;
import io.promptrelay.command.CommandResponse;
import io.promptrelay.command.DocumentViews;
import io.promptrelay.error.NotFoundException;
import io.promptrelay.execution.ExecutionReport;
import io.promptrelay.model.PromptDocument;
import io.promptrelay.runtime.PromptRelayRuntime;
import io.promptrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Minimal HTTP surface over the command gateway. Every route except {@code /health} needs the
 * shared token (Bearer header or {@code token} query parameter) when one is configured.
 */
public final class ApiServer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);
    private static final long SSE_HEARTBEAT_MS = 15_000L;

    private final PromptRelayRuntime runtime;
    private final HttpServer server;
    private final EventStreamHub streams = new EventStreamHub();
    private final ExecutorService handlers;
    private final Instant startedAt = Instant.now();

    public ApiServer(PromptRelayRuntime runtime, String host, int port) throws IOException {
        this.runtime = runtime;
        this.server = HttpServer.create(new InetSocketAddress(host, port), 0);
        this.handlers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "promptrelay-http");
            t.setDaemon(true);
            return t;
        });
        this.server.setExecutor(handlers);
        runtime.events().subscribe(streams);
        registerRoutes();
    }

    public void start() {
        server.start();
        log.info("API server listening on {}", server.getAddress());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    private void registerRoutes() {
        CommandGateway gateway = runtime.gateway();
        server.createContext("/health", exchange -> {
            Map<String, Object> body = new LinkedHashMap<>();
            body.put("status", "ok");
            body.put("startedAt", startedAt.toString());
            body.put("activeExecutions", runtime.tracker().activeCount());
            body.put("documents", runtime.documents().list().size());
            writeJson(exchange, body, 200);
        });
        server.createContext("/api/v1/command", exchange -> {
            if (!allowMethods(exchange, "POST")) return;
            String body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
            CommandResponse response = gateway.handleJson(body, extractToken(exchange, parseQuery(exchange.getRequestURI())));
            writeJson(exchange, response, response.status().httpStatus());
        });
        server.createContext("/api/v1/documents", exchange -> {
            if (!allowMethods(exchange, "GET")) return;
            if (!authorize(exchange, gateway)) return;
            String activeId = runtime.documents().active().map(PromptDocument::id).orElse(null);
            List<DocumentViews.DocumentSummary> documents = runtime.documents().list().stream()
                    .map(d -> DocumentViews.summary(d, d.id().equals(activeId)))
                    .toList();
            writeJson(exchange, Map.of("documents", documents, "count", documents.size()), 200);
        });
        server.createContext("/api/v1/executions", exchange -> {
            if (!allowMethods(exchange, "GET")) return;
            if (!authorize(exchange, gateway)) return;
            String path = exchange.getRequestURI().getPath();
            String suffix = path.substring("/api/v1/executions".length());
            if (suffix.isEmpty() || "/".equals(suffix)) {
                writeJson(exchange, Map.of("executions", runtime.executor().listActive()), 200);
                return;
            }
            String executionId = suffix.substring(1);
            try {
                writeJson(exchange, runtime.executor().getStatus(executionId), 200);
            } catch (NotFoundException e) {
                Optional<ExecutionReport> report = runtime.executor().report(executionId);
                if (report.isPresent()) {
                    writeJson(exchange, report.get(), 200);
                } else {
                    writeJson(exchange, Map.of("error", "not_found", "executionId", executionId), 404);
                }
            }
        });
        server.createContext("/api/v1/events", exchange -> {
            if (!allowMethods(exchange, "GET")) return;
            if (!authorize(exchange, gateway)) return;
            exchange.getResponseHeaders().set("Content-Type", "text/event-stream; charset=utf-8");
            exchange.getResponseHeaders().set("Cache-Control", "no-cache");
            exchange.getResponseHeaders().set("Connection", "keep-alive");
            exchange.sendResponseHeaders(200, 0);
            BlockingQueue<String> queue = streams.connect();
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(": connected\n\n".getBytes(StandardCharsets.UTF_8));
                os.flush();
                while (!Thread.currentThread().isInterrupted()) {
                    String frame = queue.poll(SSE_HEARTBEAT_MS, TimeUnit.MILLISECONDS);
                    os.write((frame == null ? ": heartbeat\n\n" : frame).getBytes(StandardCharsets.UTF_8));
                    os.flush();
                }
            } catch (IOException e) {
                log.debug("Event stream client disconnected: {}", e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            } finally {
                streams.disconnect(queue);
            }
        });
    }

    private static boolean authorize(HttpExchange exchange, CommandGateway gateway) throws IOException {
        String token = extractToken(exchange, parseQuery(exchange.getRequestURI()));
        if (gateway.authenticate(token)) {
            return true;
        }
        writeJson(exchange, CommandResponse.unauthorized(), 401);
        return false;
    }

    private static boolean allowMethods(HttpExchange exchange, String... methods) throws IOException {
        String method = exchange.getRequestMethod();
        for (String allowed : methods) {
            if (allowed.equalsIgnoreCase(method)) {
                return true;
            }
        }
        exchange.getResponseHeaders().set("Allow", String.join(",", methods));
        writeJson(exchange, Map.of("error", "method_not_allowed", "method", String.valueOf(method)), 405);
        return false;
    }

    static void writeJson(HttpExchange exchange, Object body, int status) throws IOException {
        byte[] bytes = Jsons.toJson(body).getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    static String extractToken(HttpExchange exchange, Map<String, String> query) {
        String authz = exchange.getRequestHeaders().getFirst("Authorization");
        if (authz != null && authz.regionMatches(true, 0, "Bearer ", 0, 7)) {
            String token = authz.substring(7).trim();
            if (!token.isEmpty()) {
                return token;
            }
        }
        String queryToken = query.get("token");
        if (queryToken != null && !queryToken.isBlank()) {
            return queryToken.trim();
        }
        return null;
    }

    static Map<String, String> parseQuery(URI uri) {
        Map<String, String> out = new LinkedHashMap<>();
        String query = uri.getRawQuery();
        if (query == null || query.isBlank()) {
            return out;
        }
        for (String pair : query.split("&")) {
            if (pair.isBlank()) {
                continue;
            }
            int idx = pair.indexOf('=');
            if (idx < 0) {
                out.put(URLDecoder.decode(pair, StandardCharsets.UTF_8), "");
            } else {
                out.put(
                        URLDecoder.decode(pair.substring(0, idx), StandardCharsets.UTF_8),
                        URLDecoder.decode(pair.substring(idx + 1), StandardCharsets.UTF_8)
                );
            }
        }
        return out;
    }

    @Override
    public void close() {
        runtime.events().unsubscribe(streams);
        server.stop(0);
        handlers.shutdownNow();
    }
}
