package com.photocurator.node.task;

/**
 * Kinds of background analysis work.
 */
public enum TaskType {
    PHOTO_ANALYSIS("Analyzing photos", TaskPriority.NORMAL),
    FACE_DETECTION("Detecting faces", TaskPriority.NORMAL),
    CLUSTERING("Organizing photos", TaskPriority.LOW),
    CURATION("Curating best shots", TaskPriority.LOW);

    private final String title;
    private final TaskPriority defaultPriority;

    TaskType(String title, TaskPriority defaultPriority) {
        this.title = title;
        this.defaultPriority = defaultPriority;
    }

    /**
     * Short user-facing description used in notifications.
     */
    public String title() {
        return title;
    }

    public TaskPriority defaultPriority() {
        return defaultPriority;
    }
}
