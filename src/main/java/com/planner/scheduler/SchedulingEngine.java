package com.planner.scheduler;

import com.planner.core.Task;
import com.planner.snapshot.Snapshot;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Task prioritization engine for external consumers.
 * Creates and mutates tasks, gates completion on dependencies, and answers
 * "what should be worked on next?".
 * <p>
 * Returned tasks are snapshots; all changes go through this interface.
 */
public interface SchedulingEngine {

    /**
     * Create a task. Priority, tags and effort are inferred when no priority is given.
     *
     * @throws com.planner.exception.DeadlineParseException if the deadline text is not understood
     */
    Task createTask(CreateTaskRequest request);

    /**
     * Get a task by id.
     *
     * @throws com.planner.exception.TaskNotFoundException if absent
     */
    Task getTask(String id);

    /**
     * List tasks in creation order.
     *
     * @param includeCompleted Whether completed tasks are included
     */
    List<Task> listTasks(boolean includeCompleted);

    /**
     * Apply field changes. Unknown field names are ignored.
     *
     * @throws com.planner.exception.TaskNotFoundException if absent
     * @throws com.planner.exception.DeadlineParseException if a new deadline is not understood
     */
    Task updateTask(String id, Map<String, ?> fields);

    /**
     * Hard-delete a task. Deleting a missing id is a no-op.
     */
    void deleteTask(String id);

    /**
     * Set progress, clamped to [0, 100]; 100 completes the task.
     *
     * @return the task after the change
     * @throws com.planner.exception.TaskNotFoundException if absent
     */
    Task setProgress(String id, int progress);

    /**
     * Complete a task once every dependency exists and is completed.
     *
     * @return the completed task
     * @throws com.planner.exception.TaskNotFoundException if absent
     * @throws com.planner.exception.DependencyException if any dependency is missing or incomplete
     */
    Task completeTask(String id);

    /**
     * Most urgent active task by (priority, deadline), without consuming it.
     */
    Optional<Task> peekNext();

    /**
     * Most urgent active task by (priority, deadline), consuming its index entry.
     * The task stays in the store until the next mutation rebuilds the index.
     */
    Optional<Task> popNext();

    /**
     * Suggested working order blending priority with deadline urgency.
     *
     * @return active task ids, best first
     */
    List<String> globalSchedule();

    /**
     * Record that a reminder was delivered for this task.
     *
     * @throws com.planner.exception.TaskNotFoundException if absent
     */
    void markReminded(String id);

    /**
     * Counts for dashboards.
     */
    TaskSummary summary();

    /**
     * Capture every task.
     */
    Snapshot exportSnapshot();

    /**
     * Replace all tasks with the snapshot content. All-or-nothing.
     *
     * @throws com.planner.exception.SnapshotFormatException if the snapshot is malformed
     */
    void importSnapshot(Snapshot snapshot);

    /**
     * Export as a JSON document {@code {"tasks": [...]}}.
     */
    String exportJson();

    /**
     * Import a JSON document produced by {@link #exportJson()}. All-or-nothing.
     *
     * @throws com.planner.exception.SnapshotFormatException if the document is malformed
     */
    void importJson(String json);
}
