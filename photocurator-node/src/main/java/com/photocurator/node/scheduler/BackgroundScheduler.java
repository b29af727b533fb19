package com.photocurator.node.scheduler;

import com.photocurator.node.kernel.event.EventBus;
import com.photocurator.node.kernel.event.KernelEvent;
import com.photocurator.node.kernel.event.KernelEventType;
import com.photocurator.node.kernel.event.Subscription;
import com.photocurator.node.kernel.resource.ResourceMonitor;
import com.photocurator.node.kernel.resource.ResourcePolicy;
import com.photocurator.node.kernel.resource.ResourceStatus;
import com.photocurator.node.queue.EnqueueResult;
import com.photocurator.node.queue.QueueStats;
import com.photocurator.node.queue.TaskQueue;
import com.photocurator.node.scheduler.WorkerPool.Slot;
import com.photocurator.node.scheduler.WorkerPool.TaskOutcome;
import com.photocurator.node.task.Task;
import com.photocurator.node.task.TaskBody;
import com.photocurator.node.task.TaskContext;
import com.photocurator.node.task.TaskInterruptedException;
import com.photocurator.node.task.TaskPriority;
import com.photocurator.node.task.TaskStatus;
import com.photocurator.node.task.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Resource-aware scheduler for background analysis tasks.
 * <p>
 * All state changes (calls from the app, resource notifications, progress reports
 * and task outcomes) go through one lock around the queue and the scheduler state,
 * which is held only for bookkeeping. Task bodies run unsynchronized on the
 * {@link WorkerPool} and talk back only through their {@link TaskContext} and outcome.
 * <p>
 * The state is re-derived after every change: a user pause wins, then an empty
 * queue means IDLE, then any resource violation means PAUSED_RESOURCE, otherwise
 * ACTIVE. Only ACTIVE admits tasks.
 */
public class BackgroundScheduler {

    private static final Logger log = LoggerFactory.getLogger(BackgroundScheduler.class);

    private final TaskQueue queue;
    private final ResourceMonitor resourceMonitor;
    private final EventBus eventBus;
    private final SchedulerConfig config;
    private final WorkerPool workerPool;
    private final ProgressAggregator progressAggregator;
    private final StatePublisher statePublisher;
    private final Map<TaskType, TaskBody> taskBodies;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition resumed = lock.newCondition();

    // guarded by lock, volatile for the lock-free reads of running task bodies
    private volatile ProcessingSettings settings;
    private volatile SchedulerState state = SchedulerState.IDLE;
    private volatile boolean stopping;
    private ResourceStatus resources;
    private List<String> violations = List.of();
    private boolean userPaused;
    private boolean running;
    private Subscription resourceSubscription;
    private boolean durable = true;

    public BackgroundScheduler(TaskQueue queue,
                               ResourceMonitor resourceMonitor,
                               EventBus eventBus,
                               SchedulerConfig config) {
        this.queue = Objects.requireNonNull(queue, "Task queue cannot be null");
        this.resourceMonitor = Objects.requireNonNull(resourceMonitor, "Resource monitor cannot be null");
        this.eventBus = Objects.requireNonNull(eventBus, "Event bus cannot be null");
        this.config = Objects.requireNonNull(config, "Scheduler config cannot be null");
        this.settings = config.initialSettings();
        this.workerPool = new WorkerPool(ProcessingSettings.MAX_CONCURRENT_TASKS);
        this.progressAggregator = new ProgressAggregator(config.historyWindow());
        this.statePublisher = new StatePublisher();
        this.taskBodies = new EnumMap<>(TaskType.class);
        this.resources = resourceMonitor.getSnapshot();
        this.violations = ResourcePolicy.violations(settings, resources);
        for (Task task : queue.getTasksByStatus(TaskStatus.COMPLETED)) {
            progressAggregator.recordCompletion(task);
        }
    }

    // ==================== Lifecycle ====================

    /**
     * Starts admitting tasks. The initial state is IDLE for an empty queue, otherwise
     * ACTIVE unless the resource policy already forbids processing.
     */
    public void start() {
        lock.lock();
        try {
            if (running) {
                return;
            }
            running = true;
            stopping = false;
            workerPool.start();
            resourceSubscription = resourceMonitor.onChange(this::onResourceChange);
            resources = resourceMonitor.getSnapshot();
            violations = ResourcePolicy.violations(settings, resources);
            log.info("Background scheduler started with {} queued tasks", queue.queueLength());
            reconcile();
            admit();
            publishState();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stops admission, asks running bodies to stop at their next checkpoint and waits
     * up to the configured grace period. Tasks still running afterwards go back to
     * PENDING for the next start; their bodies are left to finish on their own and
     * keep their slot until they return.
     */
    public void stop() {
        lock.lock();
        try {
            if (!running) {
                return;
            }
            running = false;
            stopping = true;
            if (resourceSubscription != null) {
                resourceSubscription.unsubscribe();
                resourceSubscription = null;
            }
            resumed.signalAll();
        } finally {
            lock.unlock();
        }

        try {
            if (!workerPool.awaitIdle(config.shutdownGrace())) {
                log.warn("{} tasks still running after {} ms, returning them to the queue",
                        workerPool.activeCount(), config.shutdownGrace().toMillis());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        lock.lock();
        try {
            for (Slot slot : workerPool.activeSlots()) {
                if (workerPool.abandon(slot)) {
                    queue.demote(slot.taskId()).ifPresent(task ->
                            emit(taskEvent(KernelEventType.TASK_INTERRUPTED, task, "Interrupted by shutdown")));
                }
            }
            workerPool.shutdown();
            queue.flush();
            reconcile();
            publishState();
            log.info("Background scheduler stopped");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Releases the observer channel. The scheduler cannot be restarted afterwards.
     */
    public void close() {
        stop();
        statePublisher.shutdown();
    }

    public boolean isRunning() {
        lock.lock();
        try {
            return running;
        } finally {
            lock.unlock();
        }
    }

    // ==================== Task bodies ====================

    /**
     * Registers the routine for a task type. Tasks of a type without a body stay
     * PENDING and are picked up once their body is registered.
     */
    public void registerTaskBody(TaskType type, TaskBody body) {
        Objects.requireNonNull(type, "Task type cannot be null");
        Objects.requireNonNull(body, "Task body cannot be null");
        lock.lock();
        try {
            boolean added = taskBodies.put(type, body) == null;
            if (added && running) {
                reconcile();
                admit();
                publishState();
            }
        } finally {
            lock.unlock();
        }
    }

    // ==================== Operations ====================

    /**
     * Queues work. Returns the existing task when the same work is already queued or running.
     */
    public Task enqueue(TaskType type, Map<String, Object> payload, TaskPriority priority) {
        lock.lock();
        try {
            EnqueueResult result = queue.enqueue(type, payload, priority);
            Task task = result.task();
            if (!result.duplicate()) {
                log.debug("Enqueued {} task {} at {}", task.type(), task.id(), task.priority());
                emit(taskEvent(KernelEventType.TASK_ENQUEUED, task, "Task queued"));
                reconcile();
                admit();
                publishState();
            }
            return queue.get(task.id()).orElse(task);
        } finally {
            lock.unlock();
        }
    }

    public void pauseProcessing() {
        lock.lock();
        try {
            if (userPaused) {
                return;
            }
            userPaused = true;
            log.info("Processing paused by user");
            reconcile();
            publishState();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Lifts a user pause. An active resource violation still keeps processing paused.
     */
    public void resumeProcessing() {
        lock.lock();
        try {
            if (!userPaused) {
                return;
            }
            userPaused = false;
            log.info("Processing resumed by user");
            reconcile();
            admit();
            publishState();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a partial settings change atomically.
     *
     * @throws InvalidSettingsException when any value is out of range; nothing changes then
     */
    public ProcessingSettings updateSettings(SettingsUpdate update) {
        Objects.requireNonNull(update, "Settings update cannot be null");
        lock.lock();
        try {
            ProcessingSettings updated = settings.apply(update);
            settings = updated;
            violations = ResourcePolicy.violations(updated, resources);
            log.info("Processing settings updated: intensity={} maxConcurrentTasks={} ceiling={}",
                    updated.intensity(), updated.maxConcurrentTasks(), updated.concurrencyCeiling());
            emit(new KernelEvent(KernelEventType.SETTINGS_UPDATED, null, Instant.now(),
                    "Settings updated", Map.of(
                            "intensity", updated.intensity().name(),
                            "maxConcurrentTasks", updated.maxConcurrentTasks(),
                            "ceiling", updated.concurrencyCeiling())));
            reconcile();
            admit();
            publishState();
            return updated;
        } finally {
            lock.unlock();
        }
    }

    public ProcessingSettings getSettings() {
        return settings;
    }

    /**
     * Removes every pending and paused task. Running tasks finish normally.
     *
     * @return number of tasks removed
     */
    public int clearQueue() {
        lock.lock();
        try {
            List<Task> removed = queue.clear();
            log.info("Cleared {} queued tasks", removed.size());
            emit(new KernelEvent(KernelEventType.QUEUE_CLEARED, null, Instant.now(),
                    "Queue cleared", Map.of("removed", removed.size())));
            reconcile();
            publishState();
            return removed.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean cancelTask(String taskId) {
        lock.lock();
        try {
            if (!queue.cancel(taskId)) {
                return false;
            }
            queue.get(taskId).ifPresent(task -> emit(taskEvent(KernelEventType.TASK_CANCELLED, task, "Task cancelled")));
            reconcile();
            publishState();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean pauseTask(String taskId) {
        lock.lock();
        try {
            if (!queue.pause(taskId)) {
                return false;
            }
            queue.get(taskId).ifPresent(task -> emit(taskEvent(KernelEventType.TASK_PAUSED, task, "Task paused")));
            reconcile();
            publishState();
            return true;
        } finally {
            lock.unlock();
        }
    }

    public boolean resumeTask(String taskId) {
        lock.lock();
        try {
            if (!queue.resume(taskId)) {
                return false;
            }
            queue.get(taskId).ifPresent(task -> emit(taskEvent(KernelEventType.TASK_RESUMED, task, "Task resumed")));
            reconcile();
            admit();
            publishState();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forces the given tasks to be processed again; running tasks are left alone.
     *
     * @return number of tasks queued again
     */
    public int requeue(Collection<String> taskIds) {
        Objects.requireNonNull(taskIds, "Task ids cannot be null");
        lock.lock();
        try {
            int changed = queue.requeue(taskIds);
            if (changed > 0) {
                log.info("Requeued {} tasks", changed);
                reconcile();
                admit();
                publishState();
            }
            return changed;
        } finally {
            lock.unlock();
        }
    }

    // ==================== Queries ====================

    public TaskStats getTaskStats() {
        QueueStats stats = queue.getStats();
        return new TaskStats(stats.completed(), stats.failed(), stats.totalProcessingTime());
    }

    public QueueStats getQueueStats() {
        return queue.getStats();
    }

    public Optional<Task> getTask(String taskId) {
        return queue.get(taskId);
    }

    public SchedulerState getSchedulerState() {
        return state;
    }

    public ProcessingState getState() {
        lock.lock();
        try {
            return buildState();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Registers an observer. It receives the current state right away and a new
     * snapshot after every change.
     */
    public Subscription subscribe(Consumer<ProcessingState> listener) {
        lock.lock();
        try {
            Subscription subscription = statePublisher.subscribe(listener);
            statePublisher.deliver(listener, buildState());
            return subscription;
        } finally {
            lock.unlock();
        }
    }

    // ==================== Event handling ====================

    private void onResourceChange(ResourceStatus status) {
        lock.lock();
        try {
            resources = status;
            violations = ResourcePolicy.violations(settings, status);
            emit(new KernelEvent(KernelEventType.RESOURCES_CHANGED, null, status.sampledAt(),
                    violations.isEmpty() ? "Resources within limits" : String.join("; ", violations)));
            reconcile();
            admit();
            publishState();
        } finally {
            lock.unlock();
        }
    }

    private void onProgress(Slot slot, int percent) {
        lock.lock();
        try {
            if (!workerPool.owns(slot)) {
                return;
            }
            int before = queue.get(slot.taskId()).map(Task::progress).orElse(-1);
            queue.updateProgress(slot.taskId(), percent).ifPresent(task -> {
                if (task.progress() != before) {
                    emit(taskEvent(KernelEventType.TASK_PROGRESS, task, null));
                    publishState();
                }
            });
        } finally {
            lock.unlock();
        }
    }

    private void onTaskFinished(Slot slot, TaskOutcome outcome) {
        lock.lock();
        try {
            if (!workerPool.release(slot)) {
                log.debug("Ignoring late {} outcome of task {}", outcome.kind(), slot.taskId());
                if (running) {
                    // the abandoned run gave its thread back
                    reconcile();
                    admit();
                    publishState();
                }
                return;
            }
            switch (outcome.kind()) {
                case SUCCEEDED -> {
                    Task task = queue.complete(slot.taskId());
                    progressAggregator.recordCompletion(task);
                    log.debug("Task {} completed in {} ms", task.id(),
                            task.getDuration().map(Duration::toMillis).orElse(0L));
                    emit(taskEvent(KernelEventType.TASK_COMPLETED, task, "Task completed"));
                }
                case FAILED -> {
                    Task task = queue.recordFailure(slot.taskId(), outcome.error(), config.retryLimit());
                    if (task.status() == TaskStatus.FAILED) {
                        log.warn("Task {} ({}) failed after {} retries: {}",
                                task.id(), task.type(), task.retryCount(), outcome.error());
                        emit(taskEvent(KernelEventType.TASK_FAILED, task, outcome.error()));
                    } else {
                        log.info("Task {} ({}) failed, retry {}/{}: {}",
                                task.id(), task.type(), task.retryCount(), config.retryLimit(), outcome.error());
                        emit(taskEvent(KernelEventType.TASK_RETRYING, task, outcome.error()));
                    }
                }
                case INTERRUPTED -> queue.demote(slot.taskId()).ifPresent(task ->
                        emit(taskEvent(KernelEventType.TASK_INTERRUPTED, task, "Task interrupted")));
            }
            reconcile();
            admit();
            publishState();
        } finally {
            lock.unlock();
        }
    }

    // ==================== State machine ====================

    private void reconcile() {
        SchedulerState next = deriveState();
        SchedulerState previous = state;
        if (next == previous) {
            return;
        }
        state = next;
        if (next == SchedulerState.PAUSED_RESOURCE) {
            log.info("Processing paused by resource policy: {}", String.join("; ", violations));
        } else {
            log.info("Scheduler state {} -> {}", previous, next);
        }
        emit(new KernelEvent(KernelEventType.SCHEDULER_STATE_CHANGED, null, Instant.now(),
                "Scheduler " + previous + " -> " + next,
                Map.of("from", previous.name(), "to", next.name())));
        if (!next.isPaused()) {
            resumed.signalAll();
        }
    }

    private SchedulerState deriveState() {
        if (userPaused) {
            return SchedulerState.PAUSED_USER;
        }
        if (queue.count(TaskStatus.PENDING) == 0 && workerPool.activeCount() == 0) {
            return SchedulerState.IDLE;
        }
        if (!violations.isEmpty()) {
            return SchedulerState.PAUSED_RESOURCE;
        }
        return SchedulerState.ACTIVE;
    }

    /**
     * Admission pass: fills free slots with the best pending tasks that have a body
     * and no earlier run still executing. Abandoned runs count against the ceiling.
     */
    private void admit() {
        if (!running || stopping || state != SchedulerState.ACTIVE) {
            return;
        }
        int ceiling = settings.concurrencyCeiling();
        while (workerPool.busyCount() < ceiling) {
            Optional<Task> next = queue.dequeueNext(this::isDispatchable);
            if (next.isEmpty()) {
                break;
            }
            Task task = queue.markRunning(next.get().id());
            TaskBody body = bodyFor(task.type());
            workerPool.dispatch(task, body, SlotContext::new, this::onTaskFinished);
            log.debug("Started {} task {} ({} of {} slots busy)",
                    task.type(), task.id(), workerPool.activeCount(), ceiling);
            emit(taskEvent(KernelEventType.TASK_STARTED, task, "Task started"));
        }
        reconcile();
    }

    private boolean isDispatchable(Task task) {
        return taskBodies.containsKey(task.type()) && !workerPool.isExecuting(task.id());
    }

    private TaskBody bodyFor(TaskType type) {
        TaskBody body = taskBodies.get(type);
        if (body == null) {
            throw new IllegalStateException("No task body registered for " + type);
        }
        return body;
    }

    private ProcessingState buildState() {
        List<Task> tasks = queue.snapshot();
        QueueStats stats = queue.getStats();
        int queueLength = 0;
        int runningCount = 0;
        for (Task task : tasks) {
            switch (task.status()) {
                case PENDING, PAUSED -> queueLength++;
                case RUNNING -> {
                    queueLength++;
                    runningCount++;
                }
                case COMPLETED, FAILED, CANCELLED -> {
                }
            }
        }
        return new ProcessingState(
                state,
                running && state == SchedulerState.ACTIVE,
                queueLength,
                runningCount,
                progressAggregator.totalProgress(tasks),
                progressAggregator.currentTask(tasks).orElse(null),
                progressAggregator.estimatedTimeRemaining(tasks).orElse(null),
                resources,
                settings,
                violations,
                stats.completed(),
                stats.failed(),
                queue.isDurable()
        );
    }

    private void publishState() {
        ProcessingState snapshot = buildState();
        if (snapshot.durable() != durable) {
            durable = snapshot.durable();
            emit(new KernelEvent(KernelEventType.PERSISTENCE_DEGRADED, null, Instant.now(),
                    durable ? "Task queue is persisted again" : "Task queue is kept in memory only",
                    Map.of("durable", durable)));
        }
        statePublisher.publish(snapshot);
    }

    private void emit(KernelEvent event) {
        eventBus.emit(event);
    }

    private static KernelEvent taskEvent(KernelEventType type, Task task, String message) {
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("type", task.type().name());
        metadata.put("priority", task.priority().name());
        metadata.put("status", task.status().name());
        metadata.put("progress", task.progress());
        metadata.put("retryCount", task.retryCount());
        if (task.error() != null) {
            metadata.put("error", task.error());
        }
        task.getDuration().ifPresent(duration -> metadata.put("durationMs", duration.toMillis()));
        if (task.payload().get("photoIds") instanceof Collection<?> photoIds) {
            metadata.put("photoCount", photoIds.size());
        }
        return new KernelEvent(type, task.id(), Instant.now(), message, metadata);
    }

    /**
     * Context handed to a running body; bound to one slot so late calls from a
     * superseded run are ignored.
     */
    private final class SlotContext implements TaskContext {

        private final Slot slot;

        private SlotContext(Slot slot) {
            this.slot = slot;
        }

        @Override
        public String taskId() {
            return slot.taskId();
        }

        @Override
        public void reportProgress(int percent) {
            onProgress(slot, percent);
        }

        @Override
        public boolean shouldYield() {
            return stopping || state.isPaused();
        }

        @Override
        public void checkpoint() {
            if (stopping) {
                throw new TaskInterruptedException("Processing is stopping");
            }
            Duration pause = settings.intensity().yieldPause();
            if (!pause.isZero()) {
                try {
                    TimeUnit.MILLISECONDS.sleep(pause.toMillis());
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new TaskInterruptedException("Interrupted at checkpoint", e);
                }
            }
            awaitResume();
        }

        private void awaitResume() {
            lock.lock();
            try {
                while (state.isPaused() && !stopping && workerPool.owns(slot)) {
                    resumed.await();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TaskInterruptedException("Interrupted while paused", e);
            } finally {
                lock.unlock();
            }
            if (stopping) {
                throw new TaskInterruptedException("Processing is stopping");
            }
        }
    }
}
