package com.planner.exception;

/**
 * Exception thrown when an operation references a task id the store does not hold.
 * No mutation has happened when this is thrown.
 */
public class TaskNotFoundException extends PlannerException {

    private final String taskId;

    public TaskNotFoundException(String taskId) {
        super("Task not found: " + taskId);
        this.taskId = taskId;
    }

    public String getTaskId() {
        return taskId;
    }
}
