package io.promptrelay.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Fans execution events out to subscribers. Delivery runs on one thread, so every subscriber sees
 * events in publish order; a subscriber that throws is logged and skipped.
 */
public final class EventBus implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final List<EventSubscriber> subscribers = new CopyOnWriteArrayList<>();
    private final ExecutorService delivery = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "promptrelay-events");
        t.setDaemon(true);
        return t;
    });

    public void subscribe(EventSubscriber subscriber) {
        subscribers.add(subscriber);
    }

    public void unsubscribe(EventSubscriber subscriber) {
        subscribers.remove(subscriber);
    }

    public List<EventSubscriber> subscribers() {
        return List.copyOf(subscribers);
    }

    public void publish(ExecutionEvent event) {
        try {
            delivery.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            log.warn("Event bus closed; dropping {} for execution {}", event.type(), event.executionId());
        }
    }

    /**
     * Waits until everything published before this call has been delivered.
     */
    public boolean flush(Duration timeout) {
        try {
            delivery.submit(() -> {
            }).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        } catch (ExecutionException | TimeoutException | RejectedExecutionException e) {
            return false;
        }
    }

    private void deliver(ExecutionEvent event) {
        for (EventSubscriber subscriber : subscribers) {
            try {
                subscriber.onEvent(event);
            } catch (RuntimeException e) {
                log.warn("Event subscriber {} failed on {} for execution {}: {}",
                        subscriber.name(), event.type(), event.executionId(), e.getMessage(), e);
            }
        }
    }

    @Override
    public void close() {
        delivery.shutdown();
        try {
            if (!delivery.awaitTermination(5, TimeUnit.SECONDS)) {
                delivery.shutdownNow();
            }
        } catch (InterruptedException e) {
            delivery.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
