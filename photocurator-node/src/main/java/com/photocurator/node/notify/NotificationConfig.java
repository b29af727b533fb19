package com.photocurator.node.notify;

/**
 * Which notifications the user wants to see.
 */
public record NotificationConfig(
        boolean showProgress,
        boolean showCompletion,
        boolean showErrors
) {
    public static NotificationConfig defaults() {
        return new NotificationConfig(true, true, true);
    }

    public static NotificationConfig silent() {
        return new NotificationConfig(false, false, false);
    }

    public boolean allows(Notification.Kind kind) {
        return switch (kind) {
            case PROGRESS -> showProgress;
            case COMPLETION -> showCompletion;
            case ERROR -> showErrors;
        };
    }

    public NotificationConfig withShowProgress(boolean show) {
        return new NotificationConfig(show, showCompletion, showErrors);
    }

    public NotificationConfig withShowCompletion(boolean show) {
        return new NotificationConfig(showProgress, show, showErrors);
    }

    public NotificationConfig withShowErrors(boolean show) {
        return new NotificationConfig(showProgress, showCompletion, show);
    }
}
