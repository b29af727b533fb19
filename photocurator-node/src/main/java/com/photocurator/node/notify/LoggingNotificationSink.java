package com.photocurator.node.notify;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default sink used when no platform notification center is wired in.
 */
public class LoggingNotificationSink implements NotificationSink {

    private static final Logger log = LoggerFactory.getLogger(LoggingNotificationSink.class);

    @Override
    public void show(Notification notification) {
        switch (notification.kind()) {
            case PROGRESS -> log.debug("[{}] {}: {}", notification.taskId(), notification.title(), notification.message());
            case COMPLETION -> log.info("{}: {}", notification.title(), notification.message());
            case ERROR -> log.warn("{}: {}", notification.title(), notification.message());
        }
    }
}
