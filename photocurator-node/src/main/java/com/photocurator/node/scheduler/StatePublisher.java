package com.photocurator.node.scheduler;

import com.photocurator.node.kernel.event.Subscription;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

/**
 * Channel delivering {@link ProcessingState} snapshots to observers.
 * Delivery happens on one dispatcher thread, in publication order.
 */
public class StatePublisher {

    private static final Logger log = LoggerFactory.getLogger(StatePublisher.class);

    private final CopyOnWriteArrayList<Consumer<ProcessingState>> listeners = new CopyOnWriteArrayList<>();
    private final ExecutorService dispatcher;

    public StatePublisher() {
        this.dispatcher = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "photocurator-state-publisher");
            thread.setDaemon(true);
            return thread;
        });
    }

    public Subscription subscribe(Consumer<ProcessingState> listener) {
        Objects.requireNonNull(listener, "Listener cannot be null");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Delivers a snapshot to one listener only, e.g. the current state on subscription.
     */
    public void deliver(Consumer<ProcessingState> listener, ProcessingState state) {
        submit(() -> notify(listener, state));
    }

    public void publish(ProcessingState state) {
        if (listeners.isEmpty()) {
            return;
        }
        submit(() -> {
            for (Consumer<ProcessingState> listener : listeners) {
                notify(listener, state);
            }
        });
    }

    public int getListenerCount() {
        return listeners.size();
    }

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

    private void submit(Runnable delivery) {
        try {
            dispatcher.execute(delivery);
        } catch (RejectedExecutionException e) {
            log.debug("State publisher shut down, dropping state update");
        }
    }

    private void notify(Consumer<ProcessingState> listener, ProcessingState state) {
        try {
            listener.accept(state);
        } catch (RuntimeException e) {
            log.warn("Processing state listener failed", e);
        }
    }
}
