package com.workgraph.core.events;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class EventBusTest {

    private EventBus eventBus;

    @BeforeEach
    void setUp() {
        eventBus = new EventBus();
    }

    @Test
    @DisplayName("item subscribers only see events about their item")
    void itemSubscription() {
        List<GraphEvent> received = new ArrayList<>();
        eventBus.subscribe("feat-1", received::add);

        eventBus.publish(GraphEvent.of(GraphEvent.APPLIED, "feat-2", Map.of()));
        var mine = GraphEvent.of(GraphEvent.APPLIED, "feat-1", Map.of("version", 3L));
        eventBus.publish(mine);

        assertEquals(List.of(mine), received);
    }

    @Test
    @DisplayName("graph-wide events reach global subscribers only")
    void graphWideEvents() {
        List<GraphEvent> item = new ArrayList<>();
        List<GraphEvent> all = new ArrayList<>();
        eventBus.subscribe("feat-1", item::add);
        eventBus.subscribeAll(all::add);

        eventBus.publish(GraphEvent.of(GraphEvent.REBUILT, null, Map.of("trigger", "MANUAL")));
        eventBus.publish(GraphEvent.of(GraphEvent.APPLY_FAILED, "feat-1", Map.of()));

        assertEquals(1, item.size());
        assertEquals(List.of(GraphEvent.REBUILT, GraphEvent.APPLY_FAILED),
                all.stream().map(GraphEvent::eventType).toList());
    }

    @Test
    @DisplayName("unsubscribing stops delivery for that handle only")
    void unsubscribe() {
        List<GraphEvent> first = new ArrayList<>();
        List<GraphEvent> second = new ArrayList<>();
        EventBus.Subscription handle = eventBus.subscribeAll(first::add);
        eventBus.subscribeAll(second::add);

        handle.unsubscribe();
        eventBus.publish(GraphEvent.of(GraphEvent.APPLIED, "a", Map.of()));

        assertTrue(first.isEmpty());
        assertEquals(1, second.size());
    }

    @Test
    @DisplayName("a throwing subscriber does not reach the publisher or other subscribers")
    void failingSubscriber() {
        List<GraphEvent> received = new ArrayList<>();
        eventBus.subscribe("a", e -> {
            throw new IllegalStateException("boom");
        });
        eventBus.subscribe("a", received::add);

        assertDoesNotThrow(() -> eventBus.publish(GraphEvent.of(GraphEvent.APPLIED, "a", Map.of())));
        assertEquals(1, received.size());
    }

    @Test
    @DisplayName("concurrent publishers lose no events")
    void concurrentPublish() throws InterruptedException {
        var received = new CopyOnWriteArrayList<GraphEvent>();
        eventBus.subscribeAll(received::add);

        ExecutorService pool = Executors.newFixedThreadPool(8);
        for (int t = 0; t < 8; t++) {
            String id = "item-" + t;
            pool.submit(() -> {
                for (int i = 0; i < 50; i++) {
                    eventBus.publish(GraphEvent.of(GraphEvent.APPLIED, id, Map.of("n", i)));
                }
            });
        }
        pool.shutdown();

        assertTrue(pool.awaitTermination(10, TimeUnit.SECONDS));
        assertEquals(400, received.size());
    }
}
