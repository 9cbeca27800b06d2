package com.workgraph.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for graph change events.
 * <p>
 * Supports per-item subscriptions and global subscriptions that receive all events.
 * Thread-safe for concurrent publish and subscribe operations. A failing subscriber
 * never affects the publisher or other subscribers.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-item subscribers keyed by work item id. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<GraphEvent>>> itemSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive every event. */
    private final CopyOnWriteArrayList<Consumer<GraphEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(GraphEvent event) {
        log.debug("Publishing event: {} for item {}", event.eventType(), event.itemId());

        if (event.itemId() != null) {
            List<Consumer<GraphEvent>> subs = itemSubscribers.get(event.itemId());
            if (subs != null) {
                for (Consumer<GraphEvent> subscriber : subs) {
                    deliverSafely(subscriber, event);
                }
            }
        }

        for (Consumer<GraphEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events about one work item.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String itemId, Consumer<GraphEvent> consumer) {
        itemSubscribers.computeIfAbsent(itemId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to item {}", itemId);
        return () -> {
            CopyOnWriteArrayList<Consumer<GraphEvent>> subs = itemSubscribers.get(itemId);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    public Subscription subscribeAll(Consumer<GraphEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<GraphEvent> subscriber, GraphEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
