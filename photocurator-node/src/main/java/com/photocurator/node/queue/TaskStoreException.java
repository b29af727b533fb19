package com.photocurator.node.queue;

/**
 * Failure to read or write the persisted task queue.
 */
public class TaskStoreException extends RuntimeException {

    public TaskStoreException(String message) {
        super(message);
    }

    public TaskStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
