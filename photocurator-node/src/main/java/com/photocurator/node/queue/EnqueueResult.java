package com.photocurator.node.queue;

import com.photocurator.node.task.Task;

/**
 * Result of an enqueue.
 *
 * @param task      the inserted task, or the existing one doing the same work
 * @param duplicate true when no new task was created
 */
public record EnqueueResult(Task task, boolean duplicate) {
}
