package com.photocurator.node.kernel;

import com.photocurator.node.kernel.event.EventBus;
import com.photocurator.node.kernel.event.KernelEvent;
import com.photocurator.node.kernel.event.KernelEventType;
import com.photocurator.node.kernel.event.Subscription;
import com.photocurator.node.kernel.resource.DeviceResourceMonitor;
import com.photocurator.node.kernel.resource.ResourceMonitor;
import com.photocurator.node.kernel.resource.ResourceSampler;
import com.photocurator.node.notify.TaskNotifier;
import com.photocurator.node.queue.InMemoryTaskStore;
import com.photocurator.node.queue.JsonFileTaskStore;
import com.photocurator.node.queue.QueueStats;
import com.photocurator.node.queue.TaskQueue;
import com.photocurator.node.queue.TaskStore;
import com.photocurator.node.scheduler.BackgroundScheduler;
import com.photocurator.node.scheduler.ProcessingSettings;
import com.photocurator.node.scheduler.ProcessingState;
import com.photocurator.node.scheduler.SchedulerConfig;
import com.photocurator.node.scheduler.SchedulerState;
import com.photocurator.node.scheduler.SettingsUpdate;
import com.photocurator.node.scheduler.TaskStats;
import com.photocurator.node.task.Task;
import com.photocurator.node.task.TaskBody;
import com.photocurator.node.task.TaskPriority;
import com.photocurator.node.task.TaskType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Background processing kernel: lifecycle, wiring and the API the app talks to.
 * <p>
 * The kernel owns one {@link BackgroundScheduler} with its queue, event bus and
 * notifier. Queue operations require the kernel to be RUNNING; observers and task
 * bodies can be registered at any time.
 */
public class ProcessingKernel {

    private static final Logger log = LoggerFactory.getLogger(ProcessingKernel.class);

    private final String kernelId;
    private final AtomicReference<KernelState> state;
    private final SchedulerConfig config;
    private final EventBus eventBus;
    private final ResourceMonitor resourceMonitor;
    private final TaskQueue queue;
    private final BackgroundScheduler scheduler;
    private final TaskNotifier notifier;

    private volatile ResourceSampler resourceSampler;
    private volatile Instant startTime;

    /**
     * Creates a kernel. Null collaborators are replaced by defaults.
     *
     * @param config          scheduler configuration
     * @param resourceMonitor device resource monitor
     * @param store           queue persistence; a JSON file store in the configured directory when null
     * @param eventBus        event bus shared with other components
     */
    public ProcessingKernel(SchedulerConfig config,
                            ResourceMonitor resourceMonitor,
                            TaskStore store,
                            EventBus eventBus) {
        this.kernelId = UUID.randomUUID().toString();
        this.state = new AtomicReference<>(KernelState.CREATED);
        this.config = config != null ? config : SchedulerConfig.defaults();
        this.eventBus = eventBus != null ? eventBus : new EventBus();
        this.resourceMonitor = resourceMonitor != null ? resourceMonitor : new DeviceResourceMonitor();
        this.queue = new TaskQueue(store != null ? store : defaultStore(this.config),
                this.config.terminalRetention());
        this.scheduler = new BackgroundScheduler(queue, this.resourceMonitor, this.eventBus, this.config);
        this.notifier = new TaskNotifier(this.eventBus);
    }

    public ProcessingKernel(SchedulerConfig config) {
        this(config, null, null, null);
    }

    public ProcessingKernel() {
        this(SchedulerConfig.load());
    }

    private static TaskStore defaultStore(SchedulerConfig config) {
        if (config.storeDirectory() == null) {
            return new InMemoryTaskStore();
        }
        return new JsonFileTaskStore(config.storeDirectory());
    }

    // ==================== Lifecycle ====================

    /**
     * Starts notifications, resource sampling and the scheduler.
     *
     * @return future completing once the scheduler runs; failed when started from a wrong state
     */
    public CompletableFuture<StartResult> start() {
        if (state.get() == KernelState.RUNNING) {
            return CompletableFuture.completedFuture(
                    new StartResult(true, "Kernel already running", startTime, queue.queueLength()));
        }

        if (!state.compareAndSet(KernelState.CREATED, KernelState.STARTING) &&
            !state.compareAndSet(KernelState.STOPPED, KernelState.STARTING)) {
            return CompletableFuture.failedFuture(
                    new KernelException("Cannot start kernel from state: " + state.get()));
        }

        return CompletableFuture.supplyAsync(() -> {
            try {
                emit(new KernelEvent(KernelEventType.KERNEL_STARTING, kernelId, Instant.now()));

                int queued = queue.queueLength();
                emit(new KernelEvent(KernelEventType.QUEUE_LOADED, kernelId, Instant.now(),
                        queued + " tasks waiting", Map.of("queueLength", queued, "durable", queue.isDurable())));

                notifier.start();
                startSampling();
                scheduler.start();
                emit(new KernelEvent(KernelEventType.SCHEDULER_STARTED, kernelId, Instant.now()));

                startTime = Instant.now();
                state.set(KernelState.RUNNING);
                log.info("Processing kernel {} started with {} queued tasks", kernelId, queued);
                emit(new KernelEvent(KernelEventType.KERNEL_STARTED, kernelId, startTime));

                return new StartResult(true, "Kernel started", startTime, queued);
            } catch (RuntimeException e) {
                state.set(KernelState.FAILED);
                log.error("Processing kernel failed to start", e);
                emit(new KernelEvent(KernelEventType.KERNEL_START_FAILED, kernelId, Instant.now(), e.getMessage()));
                throw new KernelException("Kernel start failed: " + e.getMessage(), e);
            }
        });
    }

    /**
     * Stops the scheduler; tasks interrupted by the shutdown resume on the next start.
     */
    public CompletableFuture<Void> stop() {
        if (!state.compareAndSet(KernelState.RUNNING, KernelState.STOPPING)) {
            return CompletableFuture.completedFuture(null);
        }
        emit(new KernelEvent(KernelEventType.SHUTDOWN_STARTED, kernelId, Instant.now()));

        return CompletableFuture.runAsync(() -> {
            try {
                scheduler.stop();
                stopSampling();
                notifier.stop();
                state.set(KernelState.STOPPED);
                log.info("Processing kernel {} stopped", kernelId);
                emit(new KernelEvent(KernelEventType.SHUTDOWN_COMPLETE, kernelId, Instant.now()));
            } catch (RuntimeException e) {
                state.set(KernelState.FAILED);
                throw new KernelException("Shutdown failed: " + e.getMessage(), e);
            }
        });
    }

    /**
     * Stops the kernel and releases its dispatcher threads. A closed kernel cannot be restarted.
     */
    public void close() {
        stop().join();
        scheduler.close();
        eventBus.shutdown();
        state.set(KernelState.CLOSED);
    }

    /**
     * Sampler polled at the configured interval while the kernel runs. Only used
     * with a {@link DeviceResourceMonitor}; takes effect on the next start.
     */
    public void setResourceSampler(ResourceSampler sampler) {
        this.resourceSampler = sampler;
    }

    private void startSampling() {
        ResourceSampler sampler = resourceSampler;
        if (sampler == null) {
            return;
        }
        if (resourceMonitor instanceof DeviceResourceMonitor device) {
            device.startMonitoring(sampler, config.resourceSamplingInterval());
        } else {
            log.warn("Resource sampler ignored, {} pulls its own readings", resourceMonitor.getClass().getSimpleName());
        }
    }

    private void stopSampling() {
        if (resourceMonitor instanceof DeviceResourceMonitor device) {
            device.stopMonitoring();
        }
    }

    // ==================== Tasks ====================

    public Task enqueue(TaskType type, Map<String, Object> payload) {
        return enqueue(type, payload, null);
    }

    /**
     * Queues work at the given priority, or the type's default priority when null.
     * Returns the already queued task for duplicate work.
     *
     * @throws KernelException if the kernel is not running
     */
    public Task enqueue(TaskType type, Map<String, Object> payload, TaskPriority priority) {
        requireRunning("enqueue task");
        Objects.requireNonNull(type, "Task type cannot be null");
        return scheduler.enqueue(type, payload, priority);
    }

    public Task addPhotoAnalysisTask(List<String> photoIds) {
        return addPhotoAnalysisTask(photoIds, null);
    }

    public Task addPhotoAnalysisTask(List<String> photoIds, TaskPriority priority) {
        return enqueue(TaskType.PHOTO_ANALYSIS, photoPayload(photoIds), priority);
    }

    public Task addFaceDetectionTask(List<String> photoIds) {
        return addFaceDetectionTask(photoIds, null);
    }

    public Task addFaceDetectionTask(List<String> photoIds, TaskPriority priority) {
        return enqueue(TaskType.FACE_DETECTION, photoPayload(photoIds), priority);
    }

    public Task addClusteringTask(List<String> photoIds) {
        return addClusteringTask(photoIds, null);
    }

    public Task addClusteringTask(List<String> photoIds, TaskPriority priority) {
        return enqueue(TaskType.CLUSTERING, photoPayload(photoIds), priority);
    }

    public Task addCurationTask(List<String> photoIds) {
        return addCurationTask(photoIds, null);
    }

    public Task addCurationTask(List<String> photoIds, TaskPriority priority) {
        return enqueue(TaskType.CURATION, photoPayload(photoIds), priority);
    }

    private static Map<String, Object> photoPayload(List<String> photoIds) {
        Objects.requireNonNull(photoIds, "Photo ids cannot be null");
        return Map.of("photoIds", List.copyOf(photoIds));
    }

    public boolean cancelTask(String taskId) {
        requireRunning("cancel task");
        return scheduler.cancelTask(taskId);
    }

    public boolean pauseTask(String taskId) {
        requireRunning("pause task");
        return scheduler.pauseTask(taskId);
    }

    public boolean resumeTask(String taskId) {
        requireRunning("resume task");
        return scheduler.resumeTask(taskId);
    }

    public int requeue(Collection<String> taskIds) {
        requireRunning("requeue tasks");
        return scheduler.requeue(taskIds);
    }

    public int clearQueue() {
        requireRunning("clear queue");
        return scheduler.clearQueue();
    }

    public Optional<Task> getTask(String taskId) {
        return scheduler.getTask(taskId);
    }

    public void registerTaskBody(TaskType type, TaskBody body) {
        scheduler.registerTaskBody(type, body);
    }

    // ==================== Processing control ====================

    public void pauseProcessing() {
        requireRunning("pause processing");
        scheduler.pauseProcessing();
    }

    public void resumeProcessing() {
        requireRunning("resume processing");
        scheduler.resumeProcessing();
    }

    /**
     * @throws com.photocurator.node.scheduler.InvalidSettingsException when a value is out of range
     */
    public ProcessingSettings updateSettings(SettingsUpdate update) {
        return scheduler.updateSettings(update);
    }

    public ProcessingSettings getSettings() {
        return scheduler.getSettings();
    }

    // ==================== Observation ====================

    public ProcessingState getProcessingState() {
        return scheduler.getState();
    }

    public SchedulerState getSchedulerState() {
        return scheduler.getSchedulerState();
    }

    public TaskStats getTaskStats() {
        return scheduler.getTaskStats();
    }

    public QueueStats getQueueStats() {
        return scheduler.getQueueStats();
    }

    public boolean isDurable() {
        return queue.isDurable();
    }

    public Subscription subscribe(Consumer<ProcessingState> listener) {
        return scheduler.subscribe(listener);
    }

    /**
     * Subscribes to kernel events of one type, or every type with {@link KernelEventType#ALL}.
     *
     * @return subscription id for {@link #off(String)}
     */
    public String on(KernelEventType eventType, Consumer<KernelEvent> handler) {
        if (eventType == null || handler == null) {
            throw new IllegalArgumentException("Event type and handler cannot be null");
        }
        return eventBus.subscribe(eventType, handler);
    }

    public void off(String subscriptionId) {
        eventBus.unsubscribe(subscriptionId);
    }

    private void emit(KernelEvent event) {
        eventBus.emit(event);
    }

    private void requireRunning(String operation) {
        KernelState current = state.get();
        if (current != KernelState.RUNNING) {
            throw new KernelException("Cannot " + operation + " - kernel not running. State: " + current);
        }
    }

    // ==================== Accessors ====================

    public KernelState getState() {
        return state.get();
    }

    public boolean isRunning() {
        return state.get() == KernelState.RUNNING;
    }

    public String getKernelId() {
        return kernelId;
    }

    public Instant getStartTime() {
        return startTime;
    }

    public SchedulerConfig getConfig() {
        return config;
    }

    public ResourceMonitor getResourceMonitor() {
        return resourceMonitor;
    }

    public EventBus getEventBus() {
        return eventBus;
    }

    public TaskNotifier getNotifier() {
        return notifier;
    }

    // ==================== Inner Types ====================

    public enum KernelState {
        CREATED,
        STARTING,
        RUNNING,
        STOPPING,
        STOPPED,
        FAILED,
        CLOSED
    }

    /**
     * Result of {@link #start()}.
     *
     * @param queueLength non-terminal tasks found in the queue at start
     */
    public record StartResult(
            boolean success,
            String message,
            Instant startTime,
            int queueLength
    ) {}

    public static class KernelException extends RuntimeException {
        public KernelException(String message) {
            super(message);
        }

        public KernelException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
