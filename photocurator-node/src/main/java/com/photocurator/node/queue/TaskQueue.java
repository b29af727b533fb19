package com.photocurator.node.queue;

import com.photocurator.node.task.Task;
import com.photocurator.node.task.TaskPriority;
import com.photocurator.node.task.TaskStatus;
import com.photocurator.node.task.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Ordered, durable collection of background tasks.
 * Higher priority runs first and equal priorities run in insertion order. Every
 * mutation is written through to the {@link TaskStore}; when the store fails the
 * queue keeps working in memory and reports itself as not durable.
 * <p>
 * Only the most recent finished tasks are kept, up to the terminal retention.
 * Completed, failed and cancelled totals are counters, so evicting a finished
 * task never changes the stats.
 */
public class TaskQueue {

    private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

    /**
     * Dispatch order: highest priority first, then lowest sequence.
     */
    public static final Comparator<Task> DISPATCH_ORDER = Comparator
            .comparing(Task::priority, Comparator.reverseOrder())
            .thenComparingLong(Task::sequence);

    public static final int DEFAULT_TERMINAL_RETENTION = 100;

    private static final Comparator<Task> FINISH_ORDER = Comparator
            .comparing(Task::completedAt, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparingLong(Task::sequence);

    private final TaskStore store;
    private final Clock clock;
    private final int terminalRetention;
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private long nextSequence;
    private boolean durable = true;
    private int completedCount;
    private int failedCount;
    private int cancelledCount;
    private Duration totalProcessingTime = Duration.ZERO;

    public TaskQueue(TaskStore store) {
        this(store, Clock.systemUTC(), DEFAULT_TERMINAL_RETENTION);
    }

    public TaskQueue(TaskStore store, int terminalRetention) {
        this(store, Clock.systemUTC(), terminalRetention);
    }

    public TaskQueue(TaskStore store, Clock clock, int terminalRetention) {
        this.store = Objects.requireNonNull(store, "Task store cannot be null");
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        if (terminalRetention < 0) {
            throw new IllegalArgumentException("Terminal retention cannot be negative");
        }
        this.terminalRetention = terminalRetention;
        loadPersistedQueue();
    }

    // ==================== Insertion ====================

    /**
     * Adds a task unless a non-terminal task already does the same work,
     * in which case the existing task is returned.
     */
    public synchronized EnqueueResult enqueue(TaskType type, Map<String, Object> payload, TaskPriority priority) {
        Objects.requireNonNull(type, "Task type cannot be null");

        Map<String, Object> work = Task.normalizePayload(payload);
        for (Task existing : tasks.values()) {
            if (!existing.isTerminal() && existing.type() == type && existing.payload().equals(work)) {
                log.debug("Task {} already queued for {} with the same payload", existing.id(), type);
                return new EnqueueResult(existing, true);
            }
        }

        TaskPriority effective = priority != null ? priority : type.defaultPriority();
        Task task = Task.create(type, work, effective, nextSequence++, clock.instant());
        tasks.put(task.id(), task);
        persistQueue();
        return new EnqueueResult(task, false);
    }

    // ==================== Dispatch ====================

    /**
     * Returns the PENDING task that should run next, without changing it.
     */
    public synchronized Optional<Task> dequeueNext() {
        return dequeueNext(task -> true);
    }

    /**
     * Returns the best PENDING task accepted by the filter. Rejected tasks keep their place.
     */
    public synchronized Optional<Task> dequeueNext(Predicate<Task> eligible) {
        return tasks.values().stream()
                .filter(task -> task.status() == TaskStatus.PENDING)
                .filter(eligible)
                .min(DISPATCH_ORDER);
    }

    /**
     * Moves a PENDING task to RUNNING.
     *
     * @throws IllegalStateException when the task is not PENDING
     */
    public synchronized Task markRunning(String taskId) {
        Task task = require(taskId);
        if (task.status() != TaskStatus.PENDING) {
            throw new IllegalStateException("Task " + taskId + " is " + task.status() + ", expected PENDING");
        }
        return store(task.started(clock.instant()));
    }

    /**
     * Records progress of a RUNNING task; ignored for any other status.
     */
    public synchronized Optional<Task> updateProgress(String taskId, int percent) {
        Task task = tasks.get(taskId);
        if (task == null || task.status() != TaskStatus.RUNNING) {
            return Optional.empty();
        }
        Task updated = task.withProgress(percent);
        if (updated.progress() == task.progress()) {
            return Optional.of(task);
        }
        // progress is advisory, it is not worth a disk write
        tasks.put(taskId, updated);
        return Optional.of(updated);
    }

    public synchronized Task complete(String taskId) {
        Task task = requireRunning(taskId);
        Task completed = task.completed(clock.instant());
        completedCount++;
        totalProcessingTime = totalProcessingTime.plus(completed.getDuration().orElse(Duration.ZERO));
        return store(completed);
    }

    /**
     * Records a failed run. The task goes back to PENDING at its priority while
     * retries remain, otherwise it becomes FAILED.
     */
    public synchronized Task recordFailure(String taskId, String error, int retryLimit) {
        Task task = requireRunning(taskId);
        if (task.retryCount() < retryLimit) {
            return store(task.retry(error, nextSequence++));
        }
        failedCount++;
        return store(task.failed(error, clock.instant()));
    }

    /**
     * Returns an interrupted RUNNING task to PENDING without consuming a retry.
     */
    public synchronized Optional<Task> demote(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null || task.status() != TaskStatus.RUNNING) {
            return Optional.empty();
        }
        return Optional.of(store(task.demoted()));
    }

    // ==================== User operations ====================

    /**
     * Resets the given tasks to PENDING for a forced refresh. RUNNING and unknown ids are skipped.
     * A task that already reached a terminal status stays as it is; a fresh PENDING task
     * for the same work is queued in its place unless one is already waiting.
     *
     * @return number of tasks re-armed or re-created
     */
    public synchronized int requeue(Collection<String> taskIds) {
        int changed = 0;
        for (String taskId : taskIds) {
            Task task = tasks.get(taskId);
            if (task == null || task.status() == TaskStatus.RUNNING) {
                continue;
            }
            if (task.isTerminal()) {
                if (hasActiveTaskFor(task)) {
                    continue;
                }
                Task fresh = Task.create(task.type(), task.payload(), task.priority(),
                        nextSequence++, clock.instant());
                tasks.put(fresh.id(), fresh);
            } else {
                tasks.put(taskId, task.rearmed(nextSequence++));
            }
            changed++;
        }
        if (changed > 0) {
            persistQueue();
        }
        return changed;
    }

    public synchronized int markForSync(Collection<String> taskIds) {
        return requeue(taskIds);
    }

    public synchronized boolean pause(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null || task.status() != TaskStatus.PENDING) {
            return false;
        }
        store(task.withStatus(TaskStatus.PAUSED));
        return true;
    }

    public synchronized boolean resume(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null || task.status() != TaskStatus.PAUSED) {
            return false;
        }
        store(task.withStatus(TaskStatus.PENDING));
        return true;
    }

    /**
     * Cancels a task that has not started. RUNNING tasks always run to completion.
     */
    public synchronized boolean cancel(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            return false;
        }
        if (task.status() != TaskStatus.PENDING && task.status() != TaskStatus.PAUSED) {
            return false;
        }
        cancelledCount++;
        store(task.cancelled(clock.instant()));
        return true;
    }

    /**
     * Removes every PENDING and PAUSED task and drops the finished ones kept for
     * lookup. RUNNING tasks finish naturally. Stats are not affected.
     *
     * @return the removed PENDING and PAUSED tasks
     */
    public synchronized List<Task> clear() {
        List<Task> removed = new ArrayList<>();
        int evicted = 0;
        for (Iterator<Task> it = tasks.values().iterator(); it.hasNext(); ) {
            Task task = it.next();
            if (task.status() == TaskStatus.PENDING || task.status() == TaskStatus.PAUSED) {
                removed.add(task);
                it.remove();
            } else if (task.isTerminal()) {
                evicted++;
                it.remove();
            }
        }
        if (!removed.isEmpty() || evicted > 0) {
            log.debug("Cleared {} queued and {} finished tasks", removed.size(), evicted);
            persistQueue();
        }
        return removed;
    }

    // ==================== Queries ====================

    public synchronized Optional<Task> get(String taskId) {
        return Optional.ofNullable(tasks.get(taskId));
    }

    /**
     * All tasks, terminal ones included, in insertion order.
     */
    public synchronized List<Task> snapshot() {
        List<Task> copy = new ArrayList<>(tasks.values());
        copy.sort(Comparator.comparingLong(Task::sequence));
        return copy;
    }

    public synchronized List<Task> getTasksByStatus(TaskStatus status) {
        return tasks.values().stream()
                .filter(task -> task.status() == status)
                .sorted(DISPATCH_ORDER)
                .toList();
    }

    public synchronized int count(TaskStatus status) {
        return (int) tasks.values().stream().filter(task -> task.status() == status).count();
    }

    /**
     * Number of non-terminal tasks.
     */
    public synchronized int queueLength() {
        return (int) tasks.values().stream().filter(task -> !task.isTerminal()).count();
    }

    /**
     * Live counts for queued and running tasks; totals for finished ones, evicted tasks included.
     */
    public synchronized QueueStats getStats() {
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (Task task : tasks.values()) {
            if (!task.isTerminal()) {
                counts.merge(task.status(), 1, Integer::sum);
            }
        }
        counts.put(TaskStatus.COMPLETED, completedCount);
        counts.put(TaskStatus.FAILED, failedCount);
        counts.put(TaskStatus.CANCELLED, cancelledCount);
        return new QueueStats(counts, totalProcessingTime);
    }

    public int getTerminalRetention() {
        return terminalRetention;
    }

    /**
     * False while the last load or save failed; the queue then only lives in memory.
     */
    public synchronized boolean isDurable() {
        return durable;
    }

    /**
     * Writes the current queue to the store, e.g. on shutdown to capture progress.
     */
    public synchronized void flush() {
        persistQueue();
    }

    // ==================== Internals ====================

    private boolean hasActiveTaskFor(Task task) {
        return tasks.values().stream()
                .anyMatch(other -> !other.isTerminal() && other.sameWorkAs(task.type(), task.payload()));
    }

    private Task require(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("Unknown task: " + taskId);
        }
        return task;
    }

    private Task requireRunning(String taskId) {
        Task task = require(taskId);
        if (task.status() != TaskStatus.RUNNING) {
            throw new IllegalStateException("Task " + taskId + " is " + task.status() + ", expected RUNNING");
        }
        return task;
    }

    private Task store(Task task) {
        tasks.put(task.id(), task);
        if (task.isTerminal()) {
            evictOldestTerminal();
        }
        persistQueue();
        return task;
    }

    private void evictOldestTerminal() {
        List<Task> finished = tasks.values().stream()
                .filter(Task::isTerminal)
                .sorted(FINISH_ORDER)
                .toList();
        for (int i = 0; i < finished.size() - terminalRetention; i++) {
            tasks.remove(finished.get(i).id());
        }
    }

    private void persistQueue() {
        try {
            store.saveQueue(snapshot());
            if (!durable) {
                log.info("Task store recovered, queue is durable again");
            }
            durable = true;
        } catch (TaskStoreException e) {
            if (durable) {
                log.warn("Failed to persist task queue, continuing in memory only", e);
            }
            durable = false;
        }
    }

    private void loadPersistedQueue() {
        List<Task> persisted;
        try {
            persisted = store.loadQueue();
        } catch (TaskStoreException e) {
            log.error("Failed to load persisted task queue, starting empty and non-durable", e);
            durable = false;
            return;
        }

        int demoted = 0;
        List<Task> ordered = new ArrayList<>(persisted);
        ordered.sort(Comparator.comparingLong(Task::sequence));
        for (Task task : ordered) {
            if (task.status() == TaskStatus.RUNNING) {
                // an interrupted run is never resumed as RUNNING
                task = task.demoted();
                demoted++;
            }
            tasks.put(task.id(), task);
            nextSequence = Math.max(nextSequence, task.sequence() + 1);
            switch (task.status()) {
                case COMPLETED -> {
                    completedCount++;
                    totalProcessingTime = totalProcessingTime.plus(task.getDuration().orElse(Duration.ZERO));
                }
                case FAILED -> failedCount++;
                case CANCELLED -> cancelledCount++;
                case PENDING, RUNNING, PAUSED -> {
                }
            }
        }
        int retained = tasks.size();
        evictOldestTerminal();

        if (!ordered.isEmpty()) {
            log.info("Loaded {} persisted tasks ({} interrupted runs back to PENDING)", ordered.size(), demoted);
        }
        if (demoted > 0 || tasks.size() < retained) {
            persistQueue();
        }
    }
}
