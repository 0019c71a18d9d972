package com.planner.exception;

import java.util.List;

/**
 * Exception thrown when a task cannot be completed because some of its
 * dependencies are missing or not yet completed.
 */
public class DependencyException extends PlannerException {

    private final String taskId;
    private final List<String> unmetDependencies;

    public DependencyException(String taskId, List<String> unmetDependencies) {
        super("Unmet dependencies for task " + taskId + ": " + unmetDependencies);
        this.taskId = taskId;
        this.unmetDependencies = List.copyOf(unmetDependencies);
    }

    public String getTaskId() {
        return taskId;
    }

    /**
     * Dependency ids that are missing or incomplete, in declaration order.
     */
    public List<String> getUnmetDependencies() {
        return unmetDependencies;
    }
}
