package com.photocurator.node.scheduler;

import java.time.Duration;

/**
 * Cumulative task statistics.
 *
 * @param completed tasks that completed
 * @param failed    tasks that failed after exhausting their retries
 * @param totalTime summed run time of completed tasks
 */
public record TaskStats(int completed, int failed, Duration totalTime) {
}
