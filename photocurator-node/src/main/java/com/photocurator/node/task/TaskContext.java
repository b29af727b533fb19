package com.photocurator.node.task;

/**
 * Handle given to a running task body. Bodies report progress through it and
 * call {@link #checkpoint()} at natural safe points.
 */
public interface TaskContext {

    String taskId();

    /**
     * Reports progress in percent; values are clamped to 0..100.
     */
    void reportProgress(int percent);

    /**
     * True when the body should give the device a break: processing is paused
     * or the kernel is shutting down.
     */
    boolean shouldYield();

    /**
     * Safe point. Applies the intensity's yield pause, blocks while processing is
     * paused and throws when the kernel is stopping.
     *
     * @throws TaskInterruptedException when the body must stop and leave its task for the next start
     */
    void checkpoint();
}
