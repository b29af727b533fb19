package com.photocurator.node.scheduler;

import com.photocurator.node.kernel.resource.ResourceStatus;
import com.photocurator.node.task.Task;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Snapshot of the background processing state, delivered to observers on every change.
 *
 * @param schedulerState         current scheduler state
 * @param processing             true while the scheduler is ACTIVE
 * @param queueLength            pending, paused and running tasks
 * @param runningCount           tasks currently running
 * @param totalProgress          mean progress of non-terminal tasks, 0..100
 * @param currentTask            most advanced running task, null when none runs
 * @param estimatedTimeRemaining ETA for the remaining work, null without history
 * @param resourceStatus         last resource snapshot
 * @param settings               settings in force
 * @param resourceViolations     why the resource policy pauses processing, empty otherwise
 * @param completedTasks         completed tasks so far
 * @param failedTasks            failed tasks so far
 * @param durable                false while the queue cannot be persisted
 */
public record ProcessingState(
        SchedulerState schedulerState,
        boolean processing,
        int queueLength,
        int runningCount,
        double totalProgress,
        Task currentTask,
        Duration estimatedTimeRemaining,
        ResourceStatus resourceStatus,
        ProcessingSettings settings,
        List<String> resourceViolations,
        int completedTasks,
        int failedTasks,
        boolean durable
) {
    public ProcessingState {
        resourceViolations = resourceViolations == null ? List.of() : List.copyOf(resourceViolations);
    }

    public Optional<Task> getCurrentTask() {
        return Optional.ofNullable(currentTask);
    }

    public Optional<Duration> getEstimatedTimeRemaining() {
        return Optional.ofNullable(estimatedTimeRemaining);
    }
}
