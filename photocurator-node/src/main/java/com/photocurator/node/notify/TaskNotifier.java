package com.photocurator.node.notify;

import com.photocurator.node.kernel.event.EventBus;
import com.photocurator.node.kernel.event.KernelEvent;
import com.photocurator.node.kernel.event.KernelEventType;
import com.photocurator.node.task.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Turns task events from the {@link EventBus} into user notifications.
 * Progress is reported per task, completions and final failures once per task.
 */
public class TaskNotifier {

    private static final Logger log = LoggerFactory.getLogger(TaskNotifier.class);

    static final String COMPLETION_TITLE = "Photo Processing Complete";
    static final String ERROR_TITLE = "Photo Processing Error";

    private final EventBus eventBus;
    private final NotificationSink sink;
    private final List<String> subscriptions = new ArrayList<>();
    private volatile NotificationConfig config;

    public TaskNotifier(EventBus eventBus) {
        this(eventBus, new LoggingNotificationSink(), NotificationConfig.defaults());
    }

    public TaskNotifier(EventBus eventBus, NotificationSink sink, NotificationConfig config) {
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        this.sink = Objects.requireNonNull(sink, "Notification sink cannot be null");
        this.config = Objects.requireNonNull(config, "Notification config cannot be null");
    }

    public synchronized void start() {
        if (!subscriptions.isEmpty()) {
            return;
        }
        subscriptions.add(eventBus.subscribe(KernelEventType.TASK_PROGRESS, this::onProgress));
        subscriptions.add(eventBus.subscribe(KernelEventType.TASK_COMPLETED, this::onCompleted));
        subscriptions.add(eventBus.subscribe(KernelEventType.TASK_FAILED, this::onFailed));
    }

    public synchronized void stop() {
        subscriptions.forEach(eventBus::unsubscribe);
        subscriptions.clear();
    }

    public synchronized boolean isStarted() {
        return !subscriptions.isEmpty();
    }

    public void updateConfig(NotificationConfig config) {
        this.config = Objects.requireNonNull(config, "Notification config cannot be null");
    }

    public NotificationConfig getConfig() {
        return config;
    }

    private void onProgress(KernelEvent event) {
        int progress = intMetadata(event, "progress", 0);
        String title = typeOf(event).map(TaskType::title).orElse("Processing photos");
        show(new Notification(Notification.Kind.PROGRESS, event.subjectId(), title,
                progress + "% complete", progress, event.timestamp()));
    }

    private void onCompleted(KernelEvent event) {
        int photos = intMetadata(event, "photoCount", 0);
        String message = typeOf(event)
                .map(type -> completionMessage(type, photos))
                .orElse("Processed " + photos + " photos");
        show(new Notification(Notification.Kind.COMPLETION, event.subjectId(), COMPLETION_TITLE,
                message, 100, event.timestamp()));
    }

    private void onFailed(KernelEvent event) {
        String task = typeOf(event).map(TaskType::title).orElse("Processing photos").toLowerCase(Locale.ROOT);
        Object error = event.metadata().getOrDefault("error", event.message());
        show(new Notification(Notification.Kind.ERROR, event.subjectId(), ERROR_TITLE,
                "Failed " + task + ": " + error, -1, event.timestamp()));
    }

    static String completionMessage(TaskType type, int photos) {
        return switch (type) {
            case PHOTO_ANALYSIS -> "Analyzed " + photos + " photos";
            case FACE_DETECTION -> "Detected faces in " + photos + " photos";
            case CLUSTERING -> "Organized " + photos + " photos into groups";
            case CURATION -> "Curated best shots from " + photos + " photos";
        };
    }

    private void show(Notification notification) {
        if (!config.allows(notification.kind())) {
            return;
        }
        try {
            sink.show(notification);
        } catch (RuntimeException e) {
            log.warn("Notification sink failed for task {}", notification.taskId(), e);
        }
    }

    private static Optional<TaskType> typeOf(KernelEvent event) {
        Object type = event.metadata().get("type");
        if (type == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(TaskType.valueOf(type.toString()));
        } catch (IllegalArgumentException e) {
            log.debug("Unknown task type in event: {}", type);
            return Optional.empty();
        }
    }

    private static int intMetadata(KernelEvent event, String key, int fallback) {
        return event.metadata().get(key) instanceof Number number ? number.intValue() : fallback;
    }
}
