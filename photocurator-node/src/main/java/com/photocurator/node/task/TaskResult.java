package com.photocurator.node.task;

/**
 * Outcome returned by a task body.
 *
 * @param success whether the work succeeded
 * @param data    optional result payload
 * @param error   failure detail when not successful
 */
public record TaskResult(
        boolean success,
        Object data,
        String error
) {
    public static TaskResult ok() {
        return new TaskResult(true, null, null);
    }

    public static TaskResult ok(Object data) {
        return new TaskResult(true, data, null);
    }

    public static TaskResult failure(String error) {
        return new TaskResult(false, null, error != null ? error : "Unknown error");
    }
}
