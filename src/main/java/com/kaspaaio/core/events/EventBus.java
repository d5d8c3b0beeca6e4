package com.kaspaaio.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for reconciliation progress.
 * <p>
 * Supports per-run subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations; services deployed in
 * parallel publish from executor threads.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<AioEvent>>> runSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<AioEvent>> globalSubscribers = new CopyOnWriteArrayList<>();

    public void publish(AioEvent event) {
        log.debug("Publishing event: {} for reconciliation {}", event.eventType(), event.reconciliationId());

        List<Consumer<AioEvent>> subs = runSubscribers.get(event.reconciliationId());
        if (subs != null) {
            for (Consumer<AioEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }
        for (Consumer<AioEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events of one reconciliation run.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String reconciliationId, Consumer<AioEvent> consumer) {
        runSubscribers.computeIfAbsent(reconciliationId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        return () -> {
            CopyOnWriteArrayList<Consumer<AioEvent>> subs = runSubscribers.get(reconciliationId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<AioEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<AioEvent> subscriber, AioEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
