package io.promptrelay.events;

import io.promptrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * POSTs each event as JSON to the configured callback URLs. A failing endpoint is logged and
 * does not block the others.
 */
public final class WebhookEventSubscriber implements EventSubscriber {
    private static final Logger log = LoggerFactory.getLogger(WebhookEventSubscriber.class);

    private static final int MAX_REMEMBERED_SETTLED = 1_024;

    private final HttpClient httpClient;
    private final List<URI> callbacks;
    private final String authToken;
    private final Duration timeout;
    private final Map<String, List<URI>> perExecution = new ConcurrentHashMap<>();
    private final Set<String> settled = new LinkedHashSet<>();

    public WebhookEventSubscriber(HttpClient httpClient, List<String> callbackUrls, String authToken, Duration timeout) {
        this.httpClient = httpClient;
        this.callbacks = parseCallbacks(callbackUrls);
        this.authToken = authToken;
        this.timeout = timeout == null ? Duration.ofSeconds(10) : timeout;
    }

    public static WebhookEventSubscriber create(List<String> callbackUrls, String authToken) {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(5))
                .build();
        return new WebhookEventSubscriber(client, callbackUrls, authToken, Duration.ofSeconds(10));
    }

    /**
     * Parses callback URLs, accepting absolute http(s) URLs only.
     *
     * @throws IllegalArgumentException naming the first URL that does not parse
     */
    public static List<URI> parseCallbacks(List<String> callbackUrls) {
        if (callbackUrls == null) {
            return List.of();
        }
        List<URI> out = new ArrayList<>();
        for (String raw : callbackUrls) {
            if (raw == null || raw.isBlank()) {
                continue;
            }
            URI uri;
            try {
                uri = new URI(raw.trim());
            } catch (URISyntaxException e) {
                throw new IllegalArgumentException("Invalid callback URL: " + raw + " (" + e.getReason() + ")", e);
            }
            String scheme = uri.getScheme();
            if ((!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) || uri.getHost() == null) {
                throw new IllegalArgumentException("Invalid callback URL: " + raw + " (absolute http(s) URL required)");
            }
            out.add(uri);
        }
        return List.copyOf(out);
    }

    /**
     * Adds callback URLs for one execution only; they are dropped once it settles. An execution
     * that has already settled is not registered.
     */
    public void register(String executionId, List<URI> callbackUrls) {
        if (callbackUrls == null || callbackUrls.isEmpty()) {
            return;
        }
        synchronized (settled) {
            if (settled.contains(executionId)) {
                log.debug("Execution {} settled before its callbacks were registered", executionId);
                return;
            }
            perExecution.put(executionId, List.copyOf(callbackUrls));
        }
    }

    int pendingRegistrations() {
        return perExecution.size();
    }

    public List<URI> targets(String executionId) {
        List<URI> extra = perExecution.getOrDefault(executionId, List.of());
        if (extra.isEmpty()) {
            return callbacks;
        }
        List<URI> all = new ArrayList<>(callbacks);
        for (URI uri : extra) {
            if (!all.contains(uri)) {
                all.add(uri);
            }
        }
        return all;
    }

    @Override
    public void onEvent(ExecutionEvent event) {
        List<URI> targets = targets(event.executionId());
        if (settles(event)) {
            markSettled(event.executionId());
        }
        String body = Jsons.toCompactJson(event);
        for (URI callback : targets) {
            HttpRequest.Builder request = HttpRequest.newBuilder(callback)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
            if (authToken != null && !authToken.isBlank()) {
                request.header("Authorization", "Bearer " + authToken);
            }
            try {
                HttpResponse<Void> response = httpClient.send(request.build(), HttpResponse.BodyHandlers.discarding());
                if (response.statusCode() >= 300) {
                    log.warn("Webhook {} rejected {} for execution {}: HTTP {}",
                            callback, event.type(), event.executionId(), response.statusCode());
                }
            } catch (IOException e) {
                log.warn("Webhook {} unreachable for {}: {}", callback, event.type(), e.getMessage());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Webhook delivery interrupted for execution {}", event.executionId());
                return;
            }
        }
    }

    private void markSettled(String executionId) {
        synchronized (settled) {
            perExecution.remove(executionId);
            settled.add(executionId);
            if (settled.size() > MAX_REMEMBERED_SETTLED) {
                Iterator<String> oldest = settled.iterator();
                oldest.next();
                oldest.remove();
            }
        }
    }

    private static boolean settles(ExecutionEvent event) {
        return event.type() == ExecutionEventType.EXECUTION_COMPLETED
                || event.type() == ExecutionEventType.EXECUTION_FAILED
                || event.type() == ExecutionEventType.STATUS_UPDATE && "CANCELLED".equals(event.metadata().get("status"));
    }
}
