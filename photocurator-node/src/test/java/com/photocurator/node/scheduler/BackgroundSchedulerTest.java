package com.photocurator.node.scheduler;

import com.photocurator.node.kernel.event.EventBus;
import com.photocurator.node.kernel.event.KernelEvent;
import com.photocurator.node.kernel.event.KernelEventType;
import com.photocurator.node.kernel.resource.DeviceResourceMonitor;
import com.photocurator.node.kernel.resource.ThermalState;
import com.photocurator.node.queue.InMemoryTaskStore;
import com.photocurator.node.queue.TaskQueue;
import com.photocurator.node.task.Task;
import com.photocurator.node.task.TaskInterruptedException;
import com.photocurator.node.task.TaskPriority;
import com.photocurator.node.task.TaskResult;
import com.photocurator.node.task.TaskStatus;
import com.photocurator.node.task.TaskType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class BackgroundSchedulerTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Duration SETTLE = Duration.ofMillis(200);

    private DeviceResourceMonitor monitor;
    private EventBus eventBus;
    private TaskQueue queue;
    private BackgroundScheduler scheduler;
    private final List<KernelEvent> events = new CopyOnWriteArrayList<>();
    private final List<ControlledTaskBody> bodies = new ArrayList<>();

    @BeforeEach
    void setUp() {
        monitor = new DeviceResourceMonitor();
        eventBus = new EventBus();
        eventBus.subscribe(KernelEventType.ALL, events::add);
        queue = new TaskQueue(new InMemoryTaskStore());
        scheduler = newScheduler(SchedulerConfig.defaults().withShutdownGrace(Duration.ofMillis(300)));
    }

    @AfterEach
    void tearDown() {
        bodies.forEach(ControlledTaskBody::finishAll);
        scheduler.close();
        eventBus.shutdown();
    }

    private BackgroundScheduler newScheduler(SchedulerConfig config) {
        return new BackgroundScheduler(queue, monitor, eventBus, config);
    }

    private ControlledTaskBody register(TaskType type, ControlledTaskBody body) {
        bodies.add(body);
        scheduler.registerTaskBody(type, body);
        return body;
    }

    private Task enqueue(TaskType type, int index) {
        return scheduler.enqueue(type, Map.of("photoIds", List.of("photo-" + index)), null);
    }

    private Task enqueue(TaskType type, int index, TaskPriority priority) {
        return scheduler.enqueue(type, Map.of("photoIds", List.of("photo-" + index)), priority);
    }

    private long eventCount(KernelEventType type) {
        return events.stream().filter(event -> event.eventType() == type).count();
    }

    // ==================== Admission ====================

    @Test
    void fiveTasksWithLimitTwoRunTwoAndQueueThree() {
        ControlledTaskBody body = register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.cooperative());
        scheduler.updateSettings(SettingsUpdate.maxConcurrentTasks(2));
        scheduler.start();

        for (int i = 0; i < 5; i++) {
            enqueue(TaskType.PHOTO_ANALYSIS, i);
        }

        await().atMost(TIMEOUT).until(() -> body.started().size() == 2);
        ProcessingState state = scheduler.getState();
        assertThat(state.runningCount()).isEqualTo(2);
        assertThat(queue.count(TaskStatus.PENDING)).isEqualTo(3);
        assertThat(state.queueLength()).isEqualTo(5);
        assertThat(state.schedulerState()).isEqualTo(SchedulerState.ACTIVE);
        assertThat(state.processing()).isTrue();
    }

    @Test
    void runningCountNeverExceedsConcurrencyLimit() {
        ControlledTaskBody body = register(TaskType.FACE_DETECTION, ControlledTaskBody.cooperative());
        scheduler.updateSettings(SettingsUpdate.builder()
                .intensity(ProcessingIntensity.HIGH)
                .maxConcurrentTasks(3)
                .build());
        scheduler.start();

        for (int i = 0; i < 12; i++) {
            enqueue(TaskType.FACE_DETECTION, i);
        }
        for (int i = 0; i < 12; i++) {
            body.finish(1);
        }

        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 12);
        assertThat(body.maxRunning()).as("Bodies running at the same time").isLessThanOrEqualTo(3);
        await().atMost(TIMEOUT).until(() -> scheduler.getSchedulerState() == SchedulerState.IDLE);
    }

    @Test
    void higherPriorityStartsFirstAndEqualPrioritiesKeepInsertionOrder() {
        ControlledTaskBody body = register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.cooperative());
        scheduler.updateSettings(SettingsUpdate.builder()
                .intensity(ProcessingIntensity.LOW)
                .maxConcurrentTasks(1)
                .build());

        Task low = enqueue(TaskType.PHOTO_ANALYSIS, 1, TaskPriority.LOW);
        Task normalFirst = enqueue(TaskType.PHOTO_ANALYSIS, 2, TaskPriority.NORMAL);
        Task critical = enqueue(TaskType.PHOTO_ANALYSIS, 3, TaskPriority.CRITICAL);
        Task normalSecond = enqueue(TaskType.PHOTO_ANALYSIS, 4, TaskPriority.NORMAL);

        scheduler.start();
        body.finish(4);

        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 4);
        assertThat(body.started()).containsExactly(
                critical.id(), normalFirst.id(), normalSecond.id(), low.id());
    }

    @Test
    void idleSchedulerBecomesActiveOnEnqueueAndIdleWhenDrained() {
        ControlledTaskBody body = register(TaskType.CURATION, ControlledTaskBody.cooperative());
        scheduler.start();
        assertThat(scheduler.getSchedulerState()).isEqualTo(SchedulerState.IDLE);

        enqueue(TaskType.CURATION, 1);
        assertThat(scheduler.getSchedulerState()).isEqualTo(SchedulerState.ACTIVE);

        body.finish(1);
        await().atMost(TIMEOUT).until(() -> scheduler.getSchedulerState() == SchedulerState.IDLE);
        assertThat(scheduler.getState().queueLength()).isZero();
    }

    @Test
    void duplicateWorkIsNotQueuedTwice() {
        register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.cooperative());
        scheduler.start();

        Task first = enqueue(TaskType.PHOTO_ANALYSIS, 1);
        Task second = enqueue(TaskType.PHOTO_ANALYSIS, 1);

        assertThat(second.id()).isEqualTo(first.id());
        await().during(SETTLE).atMost(TIMEOUT).until(() -> eventCount(KernelEventType.TASK_ENQUEUED) == 1);
        assertThat(scheduler.getState().queueLength()).isEqualTo(1);
    }

    // ==================== Resource policy ====================

    @Test
    void lowBatteryPausesAdmissionUntilCleared() {
        ControlledTaskBody body = register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.cooperative());
        scheduler.updateSettings(SettingsUpdate.maxConcurrentTasks(1));
        scheduler.start();
        for (int i = 0; i < 3; i++) {
            enqueue(TaskType.PHOTO_ANALYSIS, i);
        }
        await().atMost(TIMEOUT).until(() -> body.started().size() == 1);

        monitor.setBatteryLevel(0.1);

        assertThat(scheduler.getSchedulerState())
                .as("One notification is enough to pause")
                .isEqualTo(SchedulerState.PAUSED_RESOURCE);
        assertThat(scheduler.getState().resourceViolations()).hasSize(1);
        assertThat(scheduler.getState().processing()).isFalse();

        body.finish(2);
        await().during(SETTLE).atMost(TIMEOUT).until(() -> body.started().size() == 1);

        monitor.setCharging(true);

        assertThat(scheduler.getSchedulerState()).isEqualTo(SchedulerState.ACTIVE);
        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 2);
        assertThat(body.started()).hasSize(3);
    }

    @Test
    void resumeDuringViolationStaysResourcePaused() {
        register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.cooperative());
        scheduler.start();
        enqueue(TaskType.PHOTO_ANALYSIS, 1);

        scheduler.pauseProcessing();
        assertThat(scheduler.getSchedulerState()).isEqualTo(SchedulerState.PAUSED_USER);

        monitor.setMemoryUsage(0.95);
        assertThat(scheduler.getSchedulerState())
                .as("A user pause takes precedence over resource pauses")
                .isEqualTo(SchedulerState.PAUSED_USER);

        scheduler.resumeProcessing();
        assertThat(scheduler.getSchedulerState()).isEqualTo(SchedulerState.PAUSED_RESOURCE);

        monitor.setMemoryUsage(0.3);
        assertThat(scheduler.getSchedulerState()).isEqualTo(SchedulerState.ACTIVE);
    }

    @Test
    void criticalThermalStatePausesAndNominalResumes() {
        ControlledTaskBody body = register(TaskType.CLUSTERING, ControlledTaskBody.cooperative());
        scheduler.start();
        enqueue(TaskType.CLUSTERING, 1);
        await().atMost(TIMEOUT).until(() -> body.started().size() == 1);

        monitor.setThermalState(ThermalState.CRITICAL);
        assertThat(scheduler.getSchedulerState()).isEqualTo(SchedulerState.PAUSED_RESOURCE);

        monitor.setThermalState(ThermalState.NOMINAL);
        assertThat(scheduler.getSchedulerState()).isEqualTo(SchedulerState.ACTIVE);

        body.finish(1);
        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 1);
        await().atMost(TIMEOUT).until(() -> eventCount(KernelEventType.SCHEDULER_STATE_CHANGED) >= 4);
    }

    @Test
    void disabledPolicyIgnoresViolation() {
        register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.cooperative());
        scheduler.updateSettings(SettingsUpdate.builder().pauseOnThermalThrottling(false).build());
        scheduler.start();
        enqueue(TaskType.PHOTO_ANALYSIS, 1);

        monitor.setThermalState(ThermalState.CRITICAL);

        assertThat(scheduler.getSchedulerState()).isEqualTo(SchedulerState.ACTIVE);
    }

    @Test
    void violationOnEmptyQueueReportsIdle() {
        scheduler.start();

        monitor.setBatteryLevel(0.05);

        assertThat(scheduler.getSchedulerState()).isEqualTo(SchedulerState.IDLE);
        assertThat(scheduler.getState().resourceViolations()).isNotEmpty();
    }

    // ==================== Settings ====================

    @Test
    void loweringIntensityLetsRunningTasksFinish() {
        ControlledTaskBody body = register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.cooperative());
        scheduler.updateSettings(SettingsUpdate.maxConcurrentTasks(2));
        scheduler.start();
        for (int i = 0; i < 4; i++) {
            enqueue(TaskType.PHOTO_ANALYSIS, i);
        }
        await().atMost(TIMEOUT).until(() -> body.started().size() == 2);

        scheduler.updateSettings(SettingsUpdate.intensity(ProcessingIntensity.LOW));
        assertThat(scheduler.getSettings().concurrencyCeiling()).isEqualTo(1);
        assertThat(scheduler.getState().runningCount()).as("Nothing is killed").isEqualTo(2);

        body.finish(1);
        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 1);
        await().during(SETTLE).atMost(TIMEOUT).until(() -> body.started().size() == 2);

        body.finish(1);
        await().atMost(TIMEOUT).until(() -> body.started().size() == 3);
        assertThat(scheduler.getState().runningCount()).isEqualTo(1);
    }

    @Test
    void raisingLimitAdmitsMoreTasksImmediately() {
        ControlledTaskBody body = register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.cooperative());
        scheduler.updateSettings(SettingsUpdate.maxConcurrentTasks(1));
        scheduler.start();
        for (int i = 0; i < 4; i++) {
            enqueue(TaskType.PHOTO_ANALYSIS, i);
        }
        await().atMost(TIMEOUT).until(() -> body.started().size() == 1);

        scheduler.updateSettings(SettingsUpdate.builder()
                .intensity(ProcessingIntensity.AGGRESSIVE)
                .maxConcurrentTasks(4)
                .build());

        await().atMost(TIMEOUT).until(() -> body.started().size() == 4);
    }

    @Test
    void invalidSettingsAreRejectedAtomically() {
        ProcessingSettings before = scheduler.getSettings();

        InvalidSettingsException error = catchThrowableOfType(() -> scheduler.updateSettings(SettingsUpdate.builder()
                .intensity(ProcessingIntensity.HIGH)
                .maxConcurrentTasks(9)
                .batteryThreshold(1.5)
                .build()), InvalidSettingsException.class);

        assertThat(error).isNotNull();
        assertThat(error.getViolations()).hasSize(2);

        assertThat(scheduler.getSettings()).isEqualTo(before);
        assertThat(eventCount(KernelEventType.SETTINGS_UPDATED)).isZero();
    }

    // ==================== Failures ====================

    @Test
    void taskFailingBeyondRetryLimitEndsFailedOnce() {
        AtomicInteger attempts = new AtomicInteger();
        scheduler.registerTaskBody(TaskType.FACE_DETECTION, (task, context) -> {
            attempts.incrementAndGet();
            throw new IllegalStateException("model not loaded");
        });
        scheduler.start();

        Task task = enqueue(TaskType.FACE_DETECTION, 1);

        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().failed() == 1);
        await().during(SETTLE).atMost(TIMEOUT).until(() -> attempts.get() == 3);

        assertThat(scheduler.getTask(task.id())).hasValueSatisfying(failed -> {
            assertThat(failed.status()).isEqualTo(TaskStatus.FAILED);
            assertThat(failed.retryCount()).isEqualTo(2);
            assertThat(failed.error()).isEqualTo("model not loaded");
        });
        await().atMost(TIMEOUT).until(() -> eventCount(KernelEventType.TASK_FAILED) == 1);
        assertThat(eventCount(KernelEventType.TASK_RETRYING)).isEqualTo(2);
        assertThat(scheduler.getState().failedTasks()).isEqualTo(1);
        await().atMost(TIMEOUT).until(() -> scheduler.getSchedulerState() == SchedulerState.IDLE);
    }

    @Test
    void failedResultIsRetriedLikeAnException() {
        AtomicInteger attempts = new AtomicInteger();
        scheduler.registerTaskBody(TaskType.CLUSTERING, (task, context) ->
                attempts.incrementAndGet() < 2 ? TaskResult.failure("not enough faces") : TaskResult.ok());
        scheduler.start();

        enqueue(TaskType.CLUSTERING, 1);

        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 1);
        assertThat(scheduler.getTaskStats().failed()).isZero();
        assertThat(attempts).hasValue(2);
    }

    @Test
    void taskWithoutBodyWaitsForItsBodyWithoutBlockingOthers() {
        ControlledTaskBody analysis = register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.cooperative());
        scheduler.updateSettings(SettingsUpdate.maxConcurrentTasks(1));
        scheduler.start();

        Task curation = enqueue(TaskType.CURATION, 1, TaskPriority.HIGH);
        Task photo = enqueue(TaskType.PHOTO_ANALYSIS, 2);
        await().atMost(TIMEOUT).until(() -> analysis.started().size() == 1);
        assertThat(analysis.started()).containsExactly(photo.id());

        analysis.finish(1);
        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 1);
        await().during(SETTLE).atMost(TIMEOUT).until(() ->
                scheduler.getTask(curation.id()).map(Task::status).orElseThrow() == TaskStatus.PENDING);
        assertThat(scheduler.getTaskStats().failed()).as("No retries are spent on a missing body").isZero();
        assertThat(scheduler.getTask(curation.id())).map(Task::retryCount).contains(0);

        ControlledTaskBody curator = register(TaskType.CURATION, ControlledTaskBody.cooperative());
        curator.finish(1);
        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 2);
        assertThat(curator.started()).containsExactly(curation.id());
    }

    // ==================== Queue operations ====================

    @Test
    void clearQueueRemovesWaitingTasksAndRunningOnesFinish() {
        ControlledTaskBody body = register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.cooperative());
        scheduler.updateSettings(SettingsUpdate.maxConcurrentTasks(1));
        scheduler.start();
        Task running = enqueue(TaskType.PHOTO_ANALYSIS, 1);
        enqueue(TaskType.PHOTO_ANALYSIS, 2);
        Task paused = enqueue(TaskType.PHOTO_ANALYSIS, 3);
        await().atMost(TIMEOUT).until(() -> body.started().size() == 1);
        assertThat(scheduler.pauseTask(paused.id())).isTrue();

        assertThat(scheduler.clearQueue()).isEqualTo(2);
        assertThat(scheduler.getState().queueLength()).isEqualTo(1);

        body.finish(1);
        await().atMost(TIMEOUT).until(() -> scheduler.getSchedulerState() == SchedulerState.IDLE);
        assertThat(scheduler.getTask(running.id())).map(Task::status).contains(TaskStatus.COMPLETED);
        assertThat(body.started()).containsExactly(running.id());
    }

    @Test
    void cancelPauseAndResumeSingleTasks() {
        ControlledTaskBody body = register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.cooperative());
        scheduler.updateSettings(SettingsUpdate.maxConcurrentTasks(1));
        scheduler.start();
        Task running = enqueue(TaskType.PHOTO_ANALYSIS, 1);
        Task toPause = enqueue(TaskType.PHOTO_ANALYSIS, 2);
        Task toCancel = enqueue(TaskType.PHOTO_ANALYSIS, 3);
        await().atMost(TIMEOUT).until(() -> body.started().size() == 1);

        assertThat(scheduler.cancelTask(running.id())).as("Running tasks cannot be cancelled").isFalse();
        assertThat(scheduler.cancelTask(toCancel.id())).isTrue();
        assertThat(scheduler.pauseTask(toPause.id())).isTrue();

        body.finish(1);
        await().atMost(TIMEOUT).until(() -> scheduler.getSchedulerState() == SchedulerState.IDLE);
        assertThat(scheduler.getState().queueLength()).as("The paused task still waits").isEqualTo(1);

        assertThat(scheduler.resumeTask(toPause.id())).isTrue();
        body.finish(1);
        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 2);
        assertThat(scheduler.getQueueStats().cancelled()).isEqualTo(1);
    }

    @Test
    void requeueRunsCompletedWorkAgain() {
        ControlledTaskBody body = register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.cooperative());
        scheduler.start();
        Task task = enqueue(TaskType.PHOTO_ANALYSIS, 1);
        body.finish(1);
        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 1);

        assertThat(scheduler.requeue(List.of(task.id()))).isEqualTo(1);

        body.finish(1);
        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 2);
        assertThat(body.started()).hasSize(2);
    }

    // ==================== Pausing and progress ====================

    @Test
    void userPauseHoldsRunningBodiesAtCheckpoint() {
        ControlledTaskBody body = register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.cooperative());
        scheduler.start();
        enqueue(TaskType.PHOTO_ANALYSIS, 1);
        await().atMost(TIMEOUT).until(() -> body.started().size() == 1);

        scheduler.pauseProcessing();
        // let the body park at its next checkpoint before handing it a permit
        await().during(SETTLE).atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 0);
        body.finish(1);

        await().during(SETTLE).atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 0);

        scheduler.resumeProcessing();
        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 1);
    }

    @Test
    void progressFeedsTotalProgressAndCurrentTask() {
        ControlledTaskBody body = register(TaskType.PHOTO_ANALYSIS,
                ControlledTaskBody.cooperative().reportingProgress(60));
        scheduler.updateSettings(SettingsUpdate.maxConcurrentTasks(1));
        scheduler.start();
        Task running = enqueue(TaskType.PHOTO_ANALYSIS, 1);
        enqueue(TaskType.PHOTO_ANALYSIS, 2);

        await().atMost(TIMEOUT).until(() -> scheduler.getState().totalProgress() == 30.0);
        ProcessingState state = scheduler.getState();
        assertThat(state.getCurrentTask()).map(Task::id).contains(running.id());
        assertThat(state.getEstimatedTimeRemaining()).as("No history yet").isEmpty();
        await().atMost(TIMEOUT).until(() -> eventCount(KernelEventType.TASK_PROGRESS) >= 1);

        body.finish(1);
        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 1);
        assertThat(scheduler.getState().getEstimatedTimeRemaining()).isPresent();
    }

    @Test
    void subscriberReceivesCurrentStateAndUpdates() {
        register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.cooperative());
        List<ProcessingState> states = new CopyOnWriteArrayList<>();
        scheduler.subscribe(states::add);

        await().atMost(TIMEOUT).until(() -> states.size() == 1);
        assertThat(states.get(0).schedulerState()).isEqualTo(SchedulerState.IDLE);

        scheduler.start();
        enqueue(TaskType.PHOTO_ANALYSIS, 1);

        await().atMost(TIMEOUT).until(() -> states.stream()
                .anyMatch(state -> state.schedulerState() == SchedulerState.ACTIVE && state.queueLength() == 1));
    }

    @Test
    void failingSubscriberDoesNotBreakOthers() {
        List<ProcessingState> states = new CopyOnWriteArrayList<>();
        scheduler.subscribe(state -> {
            throw new IllegalStateException("renderer crashed");
        });
        scheduler.subscribe(states::add);

        scheduler.start();

        await().atMost(TIMEOUT).until(() -> states.size() >= 2);
    }

    // ==================== Shutdown ====================

    @Test
    void stopInterruptsCooperativeBodiesWithoutUsingRetries() {
        ControlledTaskBody body = register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.cooperative());
        scheduler.start();
        Task task = enqueue(TaskType.PHOTO_ANALYSIS, 1);
        await().atMost(TIMEOUT).until(() -> body.started().size() == 1);

        scheduler.stop();

        assertThat(scheduler.getTask(task.id())).hasValueSatisfying(stopped -> {
            assertThat(stopped.status()).isEqualTo(TaskStatus.PENDING);
            assertThat(stopped.retryCount()).isZero();
        });
        assertThat(scheduler.isRunning()).isFalse();
        assertThat(scheduler.getState().processing()).isFalse();
        await().atMost(TIMEOUT).until(() -> eventCount(KernelEventType.TASK_INTERRUPTED) == 1);
    }

    @Test
    void stopDemotesBodiesThatOutliveTheGracePeriod() {
        ControlledTaskBody body = register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.stubborn());
        scheduler.start();
        Task task = enqueue(TaskType.PHOTO_ANALYSIS, 1);
        await().atMost(TIMEOUT).until(() -> body.started().size() == 1);

        scheduler.stop();
        assertThat(scheduler.getTask(task.id())).map(Task::status).contains(TaskStatus.PENDING);

        body.finish(1);
        await().atMost(TIMEOUT).until(() -> body.running() == 0);
        await().during(SETTLE).atMost(TIMEOUT).until(() ->
                scheduler.getTask(task.id()).map(Task::status).orElseThrow() == TaskStatus.PENDING);
        assertThat(scheduler.getTaskStats().completed()).as("Late outcome is ignored").isZero();
    }

    @Test
    void restartNeverRunsAnAbandonedTaskTwiceOrAboveTheCeiling() {
        ControlledTaskBody body = register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.stubborn());
        scheduler.updateSettings(SettingsUpdate.intensity(ProcessingIntensity.LOW));
        scheduler.start();
        Task first = enqueue(TaskType.PHOTO_ANALYSIS, 1);
        Task second = enqueue(TaskType.PHOTO_ANALYSIS, 2);
        await().atMost(TIMEOUT).until(() -> body.started().size() == 1);

        scheduler.stop();
        scheduler.start();

        // the abandoned body still holds the only slot
        await().during(SETTLE).atMost(TIMEOUT).until(() -> body.started().size() == 1);
        assertThat(scheduler.getState().runningCount()).isZero();

        body.finish(3);
        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 2);
        assertThat(body.maxRunning()).as("Bodies running at once never exceed the ceiling").isEqualTo(1);
        assertThat(body.started()).containsExactly(first.id(), first.id(), second.id());
    }

    @Test
    void clearQueueDropsFinishedTasksButKeepsStats() {
        ControlledTaskBody body = register(TaskType.FACE_DETECTION, ControlledTaskBody.cooperative());
        scheduler.start();
        List<Task> done = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            done.add(enqueue(TaskType.FACE_DETECTION, i));
        }
        body.finish(20);
        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 20);

        assertThat(scheduler.clearQueue()).as("Nothing was waiting").isZero();

        assertThat(scheduler.getTask(done.get(0).id())).isEmpty();
        assertThat(queue.snapshot()).isEmpty();
        assertThat(scheduler.getTaskStats().completed()).isEqualTo(20);
        assertThat(scheduler.getState().completedTasks()).isEqualTo(20);
    }

    @Test
    void restartedSchedulerPicksUpDemotedTasks() {
        ControlledTaskBody body = register(TaskType.PHOTO_ANALYSIS, ControlledTaskBody.cooperative());
        scheduler.start();
        enqueue(TaskType.PHOTO_ANALYSIS, 1);
        await().atMost(TIMEOUT).until(() -> body.started().size() == 1);
        scheduler.stop();

        scheduler.start();
        body.finish(1);

        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 1);
        assertThat(body.started()).hasSize(2);
    }

    @Test
    void interruptedExceptionFromBodyReturnsTaskToQueue() {
        AtomicInteger attempts = new AtomicInteger();
        scheduler.registerTaskBody(TaskType.CURATION, (task, context) -> {
            if (attempts.incrementAndGet() == 1) {
                throw new TaskInterruptedException("camera roll locked");
            }
            return TaskResult.ok();
        });
        scheduler.start();

        Task task = enqueue(TaskType.CURATION, 1);

        await().atMost(TIMEOUT).until(() -> scheduler.getTaskStats().completed() == 1);
        assertThat(scheduler.getTask(task.id())).map(Task::retryCount).contains(0);
    }
}
