package com.photocurator.node.task;

/**
 * Lifecycle status of a task. COMPLETED, FAILED and CANCELLED are terminal.
 */
public enum TaskStatus {
    PENDING,
    RUNNING,
    PAUSED,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return switch (this) {
            case COMPLETED, FAILED, CANCELLED -> true;
            case PENDING, RUNNING, PAUSED -> false;
        };
    }
}
