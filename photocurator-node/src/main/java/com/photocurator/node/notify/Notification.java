package com.photocurator.node.notify;

import java.time.Instant;

/**
 * User-facing notification about background processing.
 *
 * @param kind      what the notification reports
 * @param taskId    task it concerns
 * @param title     short headline
 * @param message   detail line
 * @param progress  0..100 for progress notifications, otherwise -1
 * @param createdAt when it was raised
 */
public record Notification(
        Kind kind,
        String taskId,
        String title,
        String message,
        int progress,
        Instant createdAt
) {
    public enum Kind {
        PROGRESS,
        COMPLETION,
        ERROR
    }
}
