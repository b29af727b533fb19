package com.photocurator.node.task;

/**
 * Task priorities, declared from lowest to highest.
 */
public enum TaskPriority {
    LOW,
    NORMAL,
    HIGH,
    CRITICAL
}
