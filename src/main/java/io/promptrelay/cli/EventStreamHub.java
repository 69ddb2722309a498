package io.promptrelay.cli;

import io.promptrelay.events.EventSubscriber;
import io.promptrelay.events.ExecutionEvent;
import io.promptrelay.util.Jsons;

import java.util.Locale;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Bridges the event bus to server-sent-event clients. Each client owns a bounded queue; a client
 * that falls too far behind loses its oldest frames rather than stalling delivery for everyone.
 */
final class EventStreamHub implements EventSubscriber {
    static final int CLIENT_BUFFER = 256;

    private final Set<BlockingQueue<String>> clients = ConcurrentHashMap.newKeySet();

    BlockingQueue<String> connect() {
        BlockingQueue<String> queue = new LinkedBlockingQueue<>(CLIENT_BUFFER);
        clients.add(queue);
        return queue;
    }

    void disconnect(BlockingQueue<String> queue) {
        clients.remove(queue);
    }

    int clientCount() {
        return clients.size();
    }

    @Override
    public void onEvent(ExecutionEvent event) {
        String frame = frame(event);
        for (BlockingQueue<String> queue : clients) {
            while (!queue.offer(frame)) {
                queue.poll();
            }
        }
    }

    static String frame(ExecutionEvent event) {
        String data = Jsons.toCompactJson(event).replace("\r", " ").replace("\n", " ");
        return "event: " + event.type().name().toLowerCase(Locale.ROOT) + "\ndata: " + data + "\n\n";
    }
}
