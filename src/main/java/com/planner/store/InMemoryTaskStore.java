package com.planner.store;

import com.planner.core.Task;
import com.planner.exception.TaskNotFoundException;
import com.planner.priority.PriorityIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * In-memory task store backed by an insertion-ordered map.
 * <p>
 * Not thread-safe: the scheduling engine serializes access.
 */
public class InMemoryTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryTaskStore.class);

    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final PriorityIndex index = new PriorityIndex(tasks::get);

    public InMemoryTaskStore() {
        log.info("InMemoryTaskStore initialized");
    }

    @Override
    public Task create(Task task) {
        Objects.requireNonNull(task, "task cannot be null");
        if (tasks.containsKey(task.getId())) {
            throw new IllegalArgumentException("Duplicate task id: " + task.getId());
        }
        tasks.put(task.getId(), task);
        if (!task.isCompleted()) {
            index.push(task);
        }
        return task;
    }

    @Override
    public Optional<Task> get(String id) {
        return Optional.ofNullable(id != null ? tasks.get(id) : null);
    }

    @Override
    public Task require(String id) {
        return get(id).orElseThrow(() -> new TaskNotFoundException(id));
    }

    @Override
    public List<Task> listAll() {
        return List.copyOf(tasks.values());
    }

    @Override
    public List<Task> listActive() {
        List<Task> active = new ArrayList<>();
        for (Task task : tasks.values()) {
            if (!task.isCompleted()) {
                active.add(task);
            }
        }
        return active;
    }

    @Override
    public Task update(String id, TaskUpdate update) {
        Task task = require(id);
        update.applyTo(task);
        if (update.touchesOrdering()) {
            task.recomputeOrderingKey();
        }
        rebuildIndex();
        return task;
    }

    @Override
    public boolean delete(String id) {
        boolean removed = id != null && tasks.remove(id) != null;
        rebuildIndex();
        return removed;
    }

    @Override
    public void bulkReplace(Collection<Task> replacement) {
        tasks.clear();
        for (Task task : replacement) {
            tasks.put(task.getId(), task);
        }
        rebuildIndex();
        log.info("Store replaced with {} tasks", tasks.size());
    }

    @Override
    public Optional<Task> peekNext() {
        return index.peek();
    }

    @Override
    public Optional<Task> popNext() {
        return index.popNext();
    }

    @Override
    public void rebuildIndex() {
        index.rebuild(tasks.values());
    }

    @Override
    public int size() {
        return tasks.size();
    }
}
