package com.planner.store;

import com.planner.core.Task;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Authoritative id to task mapping. Owns the priority index as a derived,
 * rebuildable cache.
 */
public interface TaskStore {

    /**
     * Insert a new task and push it into the index.
     *
     * @throws IllegalArgumentException if the id is already present
     */
    Task create(Task task);

    /**
     * Look up a task by id.
     *
     * @return the task, or empty if absent
     */
    Optional<Task> get(String id);

    /**
     * Look up a task by id.
     *
     * @throws com.planner.exception.TaskNotFoundException if absent
     */
    Task require(String id);

    /**
     * All tasks in insertion order, completed included.
     */
    List<Task> listAll();

    /**
     * Non-completed tasks in insertion order.
     */
    List<Task> listActive();

    /**
     * Apply an update to a task, recompute its ordering key and rebuild the index.
     *
     * @throws com.planner.exception.TaskNotFoundException if absent
     */
    Task update(String id, TaskUpdate update);

    /**
     * Hard-remove a task and rebuild the index. Missing ids are ignored.
     *
     * @return true if a task was removed
     */
    boolean delete(String id);

    /**
     * Replace the whole store content and rebuild the index.
     */
    void bulkReplace(Collection<Task> tasks);

    /**
     * Most urgent non-completed task, without removing its index entry.
     */
    Optional<Task> peekNext();

    /**
     * Most urgent non-completed task, removing its index entry.
     */
    Optional<Task> popNext();

    /**
     * Rebuild the index after a change made directly on a task.
     */
    void rebuildIndex();

    int size();
}
