package com.photocurator.node.queue;

import com.photocurator.node.task.TaskStatus;

import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counts per status plus the cumulative run time of completed tasks.
 */
public record QueueStats(
        Map<TaskStatus, Integer> countsByStatus,
        Duration totalProcessingTime
) {
    public QueueStats {
        EnumMap<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, 0);
        }
        if (countsByStatus != null) {
            counts.putAll(countsByStatus);
        }
        countsByStatus = Collections.unmodifiableMap(counts);
        totalProcessingTime = totalProcessingTime != null ? totalProcessingTime : Duration.ZERO;
    }

    public int count(TaskStatus status) {
        return countsByStatus.get(status);
    }

    public int pending() {
        return count(TaskStatus.PENDING);
    }

    public int running() {
        return count(TaskStatus.RUNNING);
    }

    public int paused() {
        return count(TaskStatus.PAUSED);
    }

    public int completed() {
        return count(TaskStatus.COMPLETED);
    }

    public int failed() {
        return count(TaskStatus.FAILED);
    }

    public int cancelled() {
        return count(TaskStatus.CANCELLED);
    }

    /**
     * Tasks that still occupy the queue: pending, paused and running.
     */
    public int queueLength() {
        return pending() + paused() + running();
    }
}
