package com.photocurator.node.kernel.event;

/**
 * Types of events emitted by the processing kernel.
 */
public enum KernelEventType {
    // Lifecycle events
    KERNEL_STARTING,
    QUEUE_LOADED,
    SCHEDULER_STARTED,
    KERNEL_STARTED,
    KERNEL_START_FAILED,
    SHUTDOWN_STARTED,
    SHUTDOWN_COMPLETE,

    // Task events
    TASK_ENQUEUED,
    TASK_STARTED,
    TASK_PROGRESS,
    TASK_COMPLETED,
    TASK_RETRYING,
    TASK_FAILED,
    TASK_CANCELLED,
    TASK_PAUSED,
    TASK_RESUMED,
    TASK_INTERRUPTED,
    QUEUE_CLEARED,

    // Scheduler events
    SCHEDULER_STATE_CHANGED,
    SETTINGS_UPDATED,

    // Resource events
    RESOURCES_CHANGED,
    PERSISTENCE_DEGRADED,

    // Wildcard for subscribing to all events
    ALL
}
