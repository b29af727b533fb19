package com.photocurator.node.task;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

/**
 * A unit of background work. Instances are immutable; every transition returns a copy.
 *
 * @param id          unique task id
 * @param type        kind of analysis
 * @param priority    scheduling priority
 * @param payload     opaque reference to the data to process, e.g. {@code photoIds};
 *                    integral numbers are held as {@code Long}, decimals as {@code Double}
 *                    and collections as lists, the shapes a JSON reload produces
 * @param progress    0..100
 * @param status      lifecycle status
 * @param createdAt   creation time
 * @param startedAt   start of the current or last run, null if never started
 * @param completedAt time a terminal status was reached
 * @param retryCount  failed attempts so far
 * @param error       last failure detail
 * @param sequence    insertion order, the FIFO tie-break within a priority
 */
public record Task(
        String id,
        TaskType type,
        TaskPriority priority,
        Map<String, Object> payload,
        int progress,
        TaskStatus status,
        Instant createdAt,
        Instant startedAt,
        Instant completedAt,
        int retryCount,
        String error,
        long sequence
) {
    public Task {
        Objects.requireNonNull(id, "Task id cannot be null");
        Objects.requireNonNull(type, "Task type cannot be null");
        Objects.requireNonNull(status, "Task status cannot be null");
        priority = priority != null ? priority : type.defaultPriority();
        payload = normalizePayload(payload);
        progress = Math.max(0, Math.min(100, progress));
        createdAt = createdAt != null ? createdAt : Instant.now();
    }

    /**
     * Creates a new PENDING task.
     */
    public static Task create(TaskType type, Map<String, Object> payload, TaskPriority priority,
                              long sequence, Instant now) {
        return new Task(UUID.randomUUID().toString(), type, priority, payload,
                0, TaskStatus.PENDING, now, null, null, 0, null, sequence);
    }

    @JsonIgnore
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /**
     * Whether this task does the same work as another one.
     */
    public boolean sameWorkAs(TaskType otherType, Map<String, Object> otherPayload) {
        return type == otherType && payload.equals(normalizePayload(otherPayload));
    }

    /**
     * Copies a payload into the JSON-stable form tasks hold.
     */
    public static Map<String, Object> normalizePayload(Map<String, Object> payload) {
        if (payload == null || payload.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        payload.forEach((key, value) -> copy.put(key, normalizeValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object normalizeValue(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ((Number) value).longValue();
        }
        if (value instanceof BigInteger big && big.bitLength() < Long.SIZE) {
            return big.longValue();
        }
        if (value instanceof Float number) {
            return Double.valueOf(number.toString());
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, normalizeValue(nested)));
            return Collections.unmodifiableMap(copy);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> copy = new ArrayList<>(collection.size());
            for (Object element : collection) {
                copy.add(normalizeValue(element));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    /**
     * Wall time of the last run, present once the task completed.
     */
    @JsonIgnore
    public Optional<Duration> getDuration() {
        if (startedAt != null && completedAt != null) {
            return Optional.of(Duration.between(startedAt, completedAt));
        }
        return Optional.empty();
    }

    public Task withStatus(TaskStatus newStatus) {
        return new Task(id, type, priority, payload, progress, newStatus,
                createdAt, startedAt, completedAt, retryCount, error, sequence);
    }

    public Task withProgress(int newProgress) {
        return new Task(id, type, priority, payload, newProgress, status,
                createdAt, startedAt, completedAt, retryCount, error, sequence);
    }

    public Task started(Instant at) {
        return new Task(id, type, priority, payload, progress, TaskStatus.RUNNING,
                createdAt, at, null, retryCount, error, sequence);
    }

    public Task completed(Instant at) {
        return new Task(id, type, priority, payload, 100, TaskStatus.COMPLETED,
                createdAt, startedAt, at, retryCount, error, sequence);
    }

    public Task failed(String failure, Instant at) {
        return new Task(id, type, priority, payload, progress, TaskStatus.FAILED,
                createdAt, startedAt, at, retryCount, failure, sequence);
    }

    public Task cancelled(Instant at) {
        return new Task(id, type, priority, payload, progress, TaskStatus.CANCELLED,
                createdAt, startedAt, at, retryCount, error, sequence);
    }

    /**
     * Back to PENDING for another attempt, behind the tasks already waiting at its priority.
     */
    public Task retry(String failure, long newSequence) {
        return new Task(id, type, priority, payload, 0, TaskStatus.PENDING,
                createdAt, null, null, retryCount + 1, failure, newSequence);
    }

    /**
     * Back to PENDING without consuming a retry, keeping its place in line.
     */
    public Task demoted() {
        return new Task(id, type, priority, payload, 0, TaskStatus.PENDING,
                createdAt, null, null, retryCount, error, sequence);
    }

    /**
     * Re-armed for a forced refresh: PENDING, fresh progress, no error.
     */
    public Task rearmed(long newSequence) {
        return new Task(id, type, priority, payload, 0, TaskStatus.PENDING,
                createdAt, null, null, 0, null, newSequence);
    }
}
