package com.photocurator.node.kernel.event;

import java.time.Instant;
import java.util.Map;

/**
 * Event emitted by the kernel for observers and inter-component communication.
 *
 * @param eventType type of the event
 * @param subjectId id of the task the event concerns, or the kernel id for lifecycle events
 * @param timestamp when the event was raised
 * @param message   human readable detail, may be null
 * @param metadata  structured detail (state names, progress, error text)
 */
public record KernelEvent(
        KernelEventType eventType,
        String subjectId,
        Instant timestamp,
        String message,
        Map<String, Object> metadata
) {
    public KernelEvent {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public KernelEvent(KernelEventType eventType, String subjectId, Instant timestamp) {
        this(eventType, subjectId, timestamp, null, Map.of());
    }

    public KernelEvent(KernelEventType eventType, String subjectId, Instant timestamp, String message) {
        this(eventType, subjectId, timestamp, message, Map.of());
    }
}
