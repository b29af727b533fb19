package com.photocurator.node.task;

/**
 * The analysis routine behind a task type. Throwing is treated like returning a failure.
 */
@FunctionalInterface
public interface TaskBody {

    TaskResult run(Task task, TaskContext context) throws Exception;
}
