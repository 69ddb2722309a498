package io.promptrelay.events;

@FunctionalInterface
public interface EventSubscriber {
    void onEvent(ExecutionEvent event);

    default String name() {
        return getClass().getSimpleName();
    }
}
