package com.photocurator.node.queue;

import com.photocurator.node.task.Task;

import java.util.List;

/**
 * Durable storage for the task queue. Implementations throw {@link TaskStoreException}
 * when the underlying medium fails.
 */
public interface TaskStore {

    /**
     * Loads every persisted task; an empty list when nothing was stored yet.
     */
    List<Task> loadQueue();

    /**
     * Replaces the stored queue with the given tasks.
     */
    void saveQueue(List<Task> tasks);
}
