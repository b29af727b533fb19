package com.photocurator.node.task;

/**
 * Raised from {@link TaskContext#checkpoint()} when the kernel is stopping.
 * The interrupted task goes back to PENDING and does not count as a failure.
 */
public class TaskInterruptedException extends RuntimeException {

    public TaskInterruptedException(String message) {
        super(message);
    }

    public TaskInterruptedException(String message, Throwable cause) {
        super(message, cause);
    }
}
