package com.photocurator.node.kernel.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Internal event bus for kernel events.
 * Handlers run on a single dispatcher thread, so each subscriber sees events
 * in emission order and a slow handler never blocks the emitter.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<KernelEventType, CopyOnWriteArrayList<Handler>> subscriptions;
    private final Map<String, Handler> subscriptionById;
    private final ExecutorService dispatcher;

    public EventBus() {
        this.subscriptions = new ConcurrentHashMap<>();
        this.subscriptionById = new ConcurrentHashMap<>();
        this.dispatcher = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "photocurator-event-bus");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Emits an event to all subscribers of its type and to wildcard subscribers.
     *
     * @param event Event to emit
     */
    public void emit(KernelEvent event) {
        if (event == null) {
            return;
        }
        dispatch(subscriptions.get(event.eventType()), event);
        dispatch(subscriptions.get(KernelEventType.ALL), event);
    }

    private void dispatch(CopyOnWriteArrayList<Handler> handlers, KernelEvent event) {
        if (handlers == null || handlers.isEmpty()) {
            return;
        }
        for (Handler handler : handlers) {
            try {
                dispatcher.execute(() -> {
                    try {
                        handler.consumer().accept(event);
                    } catch (RuntimeException e) {
                        log.warn("Event handler {} failed on {}", handler.id(), event.eventType(), e);
                    }
                });
            } catch (RejectedExecutionException e) {
                log.debug("Event bus shut down, dropping {}", event.eventType());
                return;
            }
        }
    }

    /**
     * Subscribes to events of a specific type.
     *
     * @param eventType Type of events to subscribe to, {@link KernelEventType#ALL} for every event
     * @param consumer  Handler to invoke
     * @return Subscription ID
     */
    public String subscribe(KernelEventType eventType, Consumer<KernelEvent> consumer) {
        String subscriptionId = UUID.randomUUID().toString();
        Handler handler = new Handler(subscriptionId, eventType, consumer);

        subscriptions.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(handler);
        subscriptionById.put(subscriptionId, handler);

        return subscriptionId;
    }

    /**
     * Unsubscribes from events.
     *
     * @param subscriptionId Subscription ID
     */
    public void unsubscribe(String subscriptionId) {
        if (subscriptionId == null) {
            return;
        }
        Handler handler = subscriptionById.remove(subscriptionId);
        if (handler != null) {
            CopyOnWriteArrayList<Handler> handlers = subscriptions.get(handler.eventType());
            if (handlers != null) {
                handlers.remove(handler);
            }
        }
    }

    /**
     * Gets the count of subscribers for an event type.
     */
    public int getSubscriberCount(KernelEventType eventType) {
        CopyOnWriteArrayList<Handler> handlers = subscriptions.get(eventType);
        return handlers != null ? handlers.size() : 0;
    }

    /**
     * Delivers queued events, then stops the dispatcher.
     */
    public void shutdown() {
        dispatcher.shutdown();
        try {
            if (!dispatcher.awaitTermination(2, TimeUnit.SECONDS)) {
                dispatcher.shutdownNow();
            }
        } catch (InterruptedException e) {
            dispatcher.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record Handler(
            String id,
            KernelEventType eventType,
            Consumer<KernelEvent> consumer
    ) {}
}
