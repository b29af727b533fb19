package com.photocurator.node.scheduler;

/**
 * Scheduler states. Only ACTIVE admits new tasks.
 */
public enum SchedulerState {
    /** Admitting and running tasks. */
    ACTIVE,
    /** Paused on request; stays paused until resumed. */
    PAUSED_USER,
    /** Paused by the resource policy; resumes by itself once resources recover. */
    PAUSED_RESOURCE,
    /** Nothing pending and nothing running. */
    IDLE;

    public boolean isPaused() {
        return switch (this) {
            case PAUSED_USER, PAUSED_RESOURCE -> true;
            case ACTIVE, IDLE -> false;
        };
    }
}
