package com.workgraph.dispatch.api;

import com.workgraph.core.events.EventBus;
import com.workgraph.core.events.GraphEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.LongFunction;

/**
 * Streams index change events from the {@link EventBus} to SSE clients.
 * <p>
 * A client either follows one work item or every event. Each connection holds one bus
 * subscription, released when the emitter completes, times out or fails. Idle
 * connections get a comment frame every {@value #HEARTBEAT_INTERVAL_SECONDS} seconds.
 */
@Service
public class GraphEventStream {

    private static final Logger log = LoggerFactory.getLogger(GraphEventStream.class);

    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;
    static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    private final EventBus eventBus;
    private final long timeoutMs;
    private final LongFunction<SseEmitter> emitterFactory;
    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeat = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "graph-events-heartbeat");
        t.setDaemon(true);
        return t;
    });

    @Autowired
    public GraphEventStream(EventBus eventBus) {
        this(eventBus, DEFAULT_TIMEOUT_MS, SseEmitter::new);
    }

    GraphEventStream(EventBus eventBus, long timeoutMs, LongFunction<SseEmitter> emitterFactory) {
        this.eventBus = eventBus;
        this.timeoutMs = timeoutMs;
        this.emitterFactory = emitterFactory;
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeat.scheduleAtFixedRate(this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS, HEARTBEAT_INTERVAL_SECONDS, TimeUnit.SECONDS);
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeat.shutdown();
        try {
            if (!heartbeat.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeat.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeat.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Opens a stream of index events.
     *
     * @param itemId only events about this work item, or every event when null
     */
    public SseEmitter open(String itemId) {
        SseEmitter emitter = emitterFactory.apply(timeoutMs);
        EventBus.Subscription subscription = itemId != null
                ? eventBus.subscribe(itemId, event -> send(emitter, event))
                : eventBus.subscribeAll(event -> send(emitter, event));

        var listener = new Listener(itemId, emitter, subscription);
        listeners.add(listener);
        emitter.onCompletion(() -> close(listener));
        emitter.onTimeout(() -> close(listener));
        emitter.onError(ex -> close(listener));

        try {
            emitter.send(SseEmitter.event().comment("connected"));
        } catch (IOException e) {
            log.warn("Could not confirm event stream for {}: {}", describe(itemId), e.getMessage());
        }
        log.info("Event stream opened for {}", describe(itemId));
        return emitter;
    }

    public int activeStreams() {
        return listeners.size();
    }

    /** Payload of one SSE frame; the event type is the frame name. */
    static Map<String, Object> frame(GraphEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        if (event.itemId() != null) {
            data.put("item_id", event.itemId());
        }
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return data;
    }

    private void send(SseEmitter emitter, GraphEvent event) {
        try {
            emitter.send(SseEmitter.event().name(event.eventType()).data(frame(event)));
        } catch (IOException e) {
            log.debug("Dropped {} for a closed stream: {}", event.eventType(), e.getMessage());
        }
    }

    private void sendHeartbeats() {
        for (Listener listener : listeners) {
            try {
                listener.emitter().send(SseEmitter.event().comment("heartbeat"));
            } catch (IOException | IllegalStateException e) {
                log.debug("Heartbeat skipped for {}: {}", describe(listener.itemId()), e.getMessage());
            }
        }
    }

    private void close(Listener listener) {
        if (listeners.remove(listener)) {
            listener.subscription().unsubscribe();
            log.debug("Event stream closed for {}", describe(listener.itemId()));
        }
    }

    private static String describe(String itemId) {
        return itemId != null ? "item " + itemId : "all items";
    }

    private record Listener(String itemId, SseEmitter emitter, EventBus.Subscription subscription) {}
}
