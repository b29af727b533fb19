package com.photocurator.node.queue;

import com.photocurator.node.task.Task;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Non-durable store, used when no storage directory is configured and in tests.
 */
public class InMemoryTaskStore implements TaskStore {

    private final AtomicReference<List<Task>> saved = new AtomicReference<>(List.of());
    private final AtomicInteger saveCount = new AtomicInteger();

    public InMemoryTaskStore() {
    }

    public InMemoryTaskStore(List<Task> initial) {
        saved.set(List.copyOf(initial));
    }

    @Override
    public List<Task> loadQueue() {
        return saved.get();
    }

    @Override
    public void saveQueue(List<Task> tasks) {
        saved.set(List.copyOf(tasks));
        saveCount.incrementAndGet();
    }

    public List<Task> getSaved() {
        return saved.get();
    }

    public int getSaveCount() {
        return saveCount.get();
    }
}
