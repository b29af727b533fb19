package com.photocurator.node.scheduler;

import com.photocurator.node.task.Task;
import com.photocurator.node.task.TaskStatus;
import com.photocurator.node.task.TaskType;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Comparator;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Derives progress figures from a task snapshot. Run times of completed tasks are
 * kept in a bounded history of their own, so the estimate survives the eviction of
 * finished tasks from the queue.
 */
public class ProgressAggregator {

    private static final Comparator<Task> MOST_ADVANCED = Comparator
            .comparingInt(Task::progress).reversed()
            .thenComparing(Task::startedAt, Comparator.nullsLast(Comparator.naturalOrder()));

    private final int historyWindow;
    private final Map<TaskType, Deque<Duration>> historyByType = new EnumMap<>(TaskType.class);
    private final Deque<Duration> history = new ArrayDeque<>();

    public ProgressAggregator(int historyWindow) {
        if (historyWindow < 1) {
            throw new IllegalArgumentException("History window must be at least 1");
        }
        this.historyWindow = historyWindow;
    }

    /**
     * Adds the run time of a completed task to the moving averages. Tasks without a
     * measurable run are ignored.
     */
    public synchronized void recordCompletion(Task task) {
        if (task.status() != TaskStatus.COMPLETED) {
            return;
        }
        task.getDuration().ifPresent(duration -> {
            push(history, duration);
            push(historyByType.computeIfAbsent(task.type(), type -> new ArrayDeque<>()), duration);
        });
    }

    /**
     * Mean progress over non-terminal tasks, 0 when there are none.
     */
    public double totalProgress(List<Task> tasks) {
        return tasks.stream()
                .filter(task -> !task.isTerminal())
                .mapToInt(Task::progress)
                .average()
                .orElse(0.0);
    }

    /**
     * The running task with the highest progress; ties go to the one started first.
     */
    public Optional<Task> currentTask(List<Task> tasks) {
        return tasks.stream()
                .filter(task -> task.status() == TaskStatus.RUNNING)
                .min(MOST_ADVANCED);
    }

    /**
     * Remaining tasks of each type times the moving average duration of that type.
     * Types without history fall back to the average over all types; empty when
     * nothing has completed yet or nothing remains.
     */
    public synchronized Optional<Duration> estimatedTimeRemaining(List<Task> tasks) {
        Map<TaskType, Integer> remaining = new EnumMap<>(TaskType.class);
        for (Task task : tasks) {
            if (!task.isTerminal()) {
                remaining.merge(task.type(), 1, Integer::sum);
            }
        }
        if (remaining.isEmpty() || history.isEmpty()) {
            return Optional.empty();
        }
        Duration overall = average(history);

        Duration total = Duration.ZERO;
        for (Map.Entry<TaskType, Integer> entry : remaining.entrySet()) {
            Duration perTask = averageDuration(entry.getKey()).orElse(overall);
            total = total.plus(perTask.multipliedBy(entry.getValue()));
        }
        return Optional.of(total);
    }

    /**
     * Moving average run time of the last completed tasks of one type.
     */
    public synchronized Optional<Duration> averageDuration(TaskType type) {
        Deque<Duration> durations = historyByType.get(type);
        if (durations == null || durations.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(average(durations));
    }

    private void push(Deque<Duration> window, Duration duration) {
        window.addLast(duration);
        while (window.size() > historyWindow) {
            window.removeFirst();
        }
    }

    private static Duration average(Deque<Duration> durations) {
        Duration sum = Duration.ZERO;
        for (Duration duration : durations) {
            sum = sum.plus(duration);
        }
        return sum.dividedBy(durations.size());
    }
}
