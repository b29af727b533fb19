package com.photocurator.node.scheduler;

import com.photocurator.node.task.Task;
import com.photocurator.node.task.TaskBody;
import com.photocurator.node.task.TaskContext;
import com.photocurator.node.task.TaskInterruptedException;
import com.photocurator.node.task.TaskResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BiConsumer;
import java.util.function.Function;

/**
 * Execution slots for task bodies. The pool only runs what it is given; the
 * scheduler decides how many slots may be busy and releases a slot when it has
 * booked the outcome, so a task never occupies two slots.
 * <p>
 * A slot given up on shutdown is abandoned rather than freed: its body keeps its
 * thread until it returns, so it still counts as busy and its task cannot be
 * dispatched again before then.
 */
public class WorkerPool {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final int threads;
    private final Map<String, Slot> activeSlots = new ConcurrentHashMap<>();
    private final Map<String, Slot> abandonedSlots = new ConcurrentHashMap<>();
    private final AtomicLong runIds = new AtomicLong();
    private ExecutorService executor;

    public WorkerPool(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Worker pool needs at least one thread");
        }
        this.threads = threads;
    }

    public synchronized void start() {
        if (executor != null && !executor.isShutdown()) {
            return;
        }
        AtomicInteger counter = new AtomicInteger();
        executor = Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "photocurator-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Runs a task body in a free slot. Exactly one outcome is reported per dispatch.
     *
     * @param task           the task, already marked RUNNING
     * @param body           routine to run
     * @param contextFactory builds the context handed to the body
     * @param onFinish       receives the slot and its outcome on the worker thread
     * @return the occupied slot
     */
    public Slot dispatch(Task task,
                         TaskBody body,
                         Function<Slot, TaskContext> contextFactory,
                         BiConsumer<Slot, TaskOutcome> onFinish) {
        Objects.requireNonNull(task, "Task cannot be null");
        Objects.requireNonNull(body, "Task body cannot be null");

        if (abandonedSlots.containsKey(task.id())) {
            throw new IllegalStateException("Task " + task.id() + " is still executing an abandoned run");
        }
        Slot slot = new Slot(task.id(), runIds.incrementAndGet(), task);
        if (activeSlots.putIfAbsent(task.id(), slot) != null) {
            throw new IllegalStateException("Task " + task.id() + " already occupies a slot");
        }

        ExecutorService current;
        synchronized (this) {
            current = executor;
        }
        if (current == null || current.isShutdown()) {
            activeSlots.remove(task.id(), slot);
            throw new IllegalStateException("Worker pool is not running");
        }

        TaskContext context = contextFactory.apply(slot);
        current.execute(() -> {
            TaskOutcome outcome = TaskOutcome.failed(slot.taskId(), "Task body aborted");
            try {
                outcome = run(slot, body, context);
            } finally {
                book(slot, outcome, onFinish);
            }
        });
        return slot;
    }

    private TaskOutcome run(Slot slot, TaskBody body, TaskContext context) {
        String taskId = slot.taskId();
        try {
            TaskResult result = body.run(slot.task(), context);
            if (result == null || result.success()) {
                return TaskOutcome.succeeded(taskId, result != null ? result.data() : null);
            }
            return TaskOutcome.failed(taskId, result.error());
        } catch (TaskInterruptedException e) {
            log.debug("Task {} interrupted: {}", taskId, e.getMessage());
            return TaskOutcome.interrupted(taskId);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return TaskOutcome.interrupted(taskId);
        } catch (Exception e) {
            log.debug("Task {} body threw", taskId, e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return TaskOutcome.failed(taskId, message);
        }
    }

    private void book(Slot slot, TaskOutcome outcome, BiConsumer<Slot, TaskOutcome> onFinish) {
        try {
            onFinish.accept(slot, outcome);
        } catch (RuntimeException e) {
            log.error("Failed to book outcome {} of task {}", outcome.kind(), slot.taskId(), e);
        }
    }

    /**
     * Frees the slot if it is still the one registered for its task. An abandoned
     * slot is dropped as well, but its outcome no longer counts.
     *
     * @return false when the slot was already released or abandoned
     */
    public boolean release(Slot slot) {
        if (activeSlots.remove(slot.taskId(), slot)) {
            return true;
        }
        if (abandonedSlots.remove(slot.taskId(), slot)) {
            log.debug("Abandoned run {} of task {} returned", slot.runId(), slot.taskId());
        }
        return false;
    }

    /**
     * Gives up on a live slot whose body is still executing. The slot stays busy
     * until the body returns and is then dropped by {@link #release(Slot)}.
     *
     * @return false when the slot was no longer live
     */
    public boolean abandon(Slot slot) {
        if (!activeSlots.remove(slot.taskId(), slot)) {
            return false;
        }
        abandonedSlots.put(slot.taskId(), slot);
        return true;
    }

    /**
     * Whether a body for the task is executing, live or abandoned.
     */
    public boolean isExecuting(String taskId) {
        return activeSlots.containsKey(taskId) || abandonedSlots.containsKey(taskId);
    }

    /**
     * Whether the slot is still the live run of its task.
     */
    public boolean owns(Slot slot) {
        return activeSlots.get(slot.taskId()) == slot;
    }

    public int activeCount() {
        return activeSlots.size();
    }

    /**
     * Threads occupied by bodies: live slots plus abandoned runs still executing.
     */
    public int busyCount() {
        return activeSlots.size() + abandonedSlots.size();
    }

    public int abandonedCount() {
        return abandonedSlots.size();
    }

    public List<Slot> activeSlots() {
        return List.copyOf(activeSlots.values());
    }

    /**
     * Waits until every slot has been released or the timeout passes.
     *
     * @return true when the pool drained in time
     */
    public boolean awaitIdle(Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (!activeSlots.isEmpty()) {
            if (System.nanoTime() >= deadline) {
                return false;
            }
            TimeUnit.MILLISECONDS.sleep(10);
        }
        return true;
    }

    /**
     * Stops accepting work. Bodies still running are left to finish; they are never killed.
     */
    public synchronized void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
    }

    public int getThreads() {
        return threads;
    }

    /**
     * One occupied execution slot.
     *
     * @param taskId task occupying the slot
     * @param runId  unique per dispatch, distinguishes reruns of the same task
     * @param task   the task as dispatched
     */
    public record Slot(String taskId, long runId, Task task) {
    }

    /**
     * Terminal outcome of one slot run.
     */
    public record TaskOutcome(String taskId, Kind kind, Object data, String error) {

        public enum Kind {
            SUCCEEDED,
            FAILED,
            INTERRUPTED
        }

        static TaskOutcome succeeded(String taskId, Object data) {
            return new TaskOutcome(taskId, Kind.SUCCEEDED, data, null);
        }

        static TaskOutcome failed(String taskId, String error) {
            return new TaskOutcome(taskId, Kind.FAILED, null, error != null ? error : "Unknown error");
        }

        static TaskOutcome interrupted(String taskId) {
            return new TaskOutcome(taskId, Kind.INTERRUPTED, null, null);
        }
    }
}
