package com.photocurator.node.notify;

/**
 * Destination for notifications, e.g. the platform's notification center.
 */
@FunctionalInterface
public interface NotificationSink {

    void show(Notification notification);
}
