package io.tongchi.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous fan-out of core events. Listeners run on the publishing thread, so they must
 * hand long work off to their own executor; a listener that throws is logged and skipped.
 */
public final class EventBus {
    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final List<Subscription<?>> subscriptions = new CopyOnWriteArrayList<>();

    public AutoCloseable subscribe(EventListener listener) {
        return subscribe(CoreEvent.class, listener::onEvent);
    }

    public <E extends CoreEvent> AutoCloseable subscribe(Class<E> type, TypedListener<E> listener) {
        Subscription<E> subscription = new Subscription<>(type, listener);
        subscriptions.add(subscription);
        return () -> subscriptions.remove(subscription);
    }

    public void publish(CoreEvent event) {
        if (event == null) {
            return;
        }
        for (Subscription<?> subscription : subscriptions) {
            try {
                subscription.deliver(event);
            } catch (RuntimeException e) {
                log.warn("Event listener failed on {}", event.getClass().getSimpleName(), e);
            }
        }
    }

    public int listenerCount() {
        return subscriptions.size();
    }

    @FunctionalInterface
    public interface TypedListener<E extends CoreEvent> {
        void onEvent(E event);
    }

    private record Subscription<E extends CoreEvent>(Class<E> type, TypedListener<E> listener) {
        void deliver(CoreEvent event) {
            if (type.isInstance(event)) {
                listener.onEvent(type.cast(event));
            }
        }
    }
}
