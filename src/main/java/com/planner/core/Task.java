package com.planner.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One unit of work.
 * <p>
 * Mutable: title, description, priority, deadline, progress, dependencies, tags,
 * effort and flags change over the task's life. {@code id} and {@code createdAt}
 * are fixed at construction. After changing priority or deadline, call
 * {@link #recomputeOrderingKey()} before the task re-enters the priority index.
 * <p>
 * Tasks are equal when their ids are equal.
 */
public class Task {

    public static final int DEFAULT_PRIORITY = 5;
    public static final int MIN_PROGRESS = 0;
    public static final int MAX_PROGRESS = 100;

    private final String id;
    private final Instant createdAt;
    private String title;
    private String description;
    private int priority;
    private Instant deadline;
    private boolean completed;
    private int progress;
    private final List<String> dependencies = new ArrayList<>();
    private final List<String> tags = new ArrayList<>();
    private Integer estimatedEffortMinutes;
    private boolean autoAssigned;
    private boolean notified;

    private OrderingKey orderingKey;

    public Task(String id, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt cannot be null");
        this.title = "";
        this.description = "";
        this.priority = DEFAULT_PRIORITY;
        recomputeOrderingKey();
    }

    /**
     * Detached copy of the current state. Changes to the copy never reach this task.
     */
    public Task copy() {
        Task copy = new Task(id, createdAt);
        copy.title = title;
        copy.description = description;
        copy.priority = priority;
        copy.deadline = deadline;
        copy.completed = completed;
        copy.progress = progress;
        copy.dependencies.addAll(dependencies);
        copy.tags.addAll(tags);
        copy.estimatedEffortMinutes = estimatedEffortMinutes;
        copy.autoAssigned = autoAssigned;
        copy.notified = notified;
        copy.orderingKey = orderingKey;
        return copy;
    }

    /**
     * Recompute the derived ordering key from the current priority and deadline.
     *
     * @return the fresh key
     */
    public OrderingKey recomputeOrderingKey() {
        this.orderingKey = new OrderingKey(priority, deadline);
        return orderingKey;
    }

    /**
     * Ordering key as of the last {@link #recomputeOrderingKey()} call.
     */
    public OrderingKey getOrderingKey() {
        return orderingKey;
    }

    public String getId() {
        return id;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title != null ? title : "";
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description != null ? description : "";
    }

    public int getPriority() {
        return priority;
    }

    public void setPriority(int priority) {
        this.priority = priority;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public void setDeadline(Instant deadline) {
        this.deadline = deadline;
    }

    public boolean isCompleted() {
        return completed;
    }

    /**
     * Mark the task completed. There is no way back to incomplete.
     */
    public void markCompleted() {
        this.completed = true;
        this.progress = MAX_PROGRESS;
    }

    public int getProgress() {
        return progress;
    }

    /**
     * Set progress, clamped to [0, 100]. Reaching 100 completes the task.
     *
     * @return the clamped value actually stored
     */
    public int setProgress(int progress) {
        this.progress = Math.max(MIN_PROGRESS, Math.min(MAX_PROGRESS, progress));
        if (this.progress == MAX_PROGRESS) {
            this.completed = true;
        }
        return this.progress;
    }

    public List<String> getDependencies() {
        return Collections.unmodifiableList(dependencies);
    }

    /**
     * Add a dependency id unless already present. The id need not exist yet.
     */
    public void addDependency(String dependencyId) {
        if (dependencyId != null && !dependencies.contains(dependencyId)) {
            dependencies.add(dependencyId);
        }
    }

    public void setDependencies(List<String> dependencyIds) {
        dependencies.clear();
        if (dependencyIds != null) {
            dependencyIds.forEach(this::addDependency);
        }
    }

    public List<String> getTags() {
        return Collections.unmodifiableList(tags);
    }

    public void setTags(List<String> tags) {
        this.tags.clear();
        if (tags != null) {
            for (String tag : tags) {
                if (tag != null) {
                    this.tags.add(tag);
                }
            }
        }
    }

    public Integer getEstimatedEffortMinutes() {
        return estimatedEffortMinutes;
    }

    public void setEstimatedEffortMinutes(Integer estimatedEffortMinutes) {
        this.estimatedEffortMinutes = estimatedEffortMinutes;
    }

    public boolean isAutoAssigned() {
        return autoAssigned;
    }

    public void setAutoAssigned(boolean autoAssigned) {
        this.autoAssigned = autoAssigned;
    }

    public boolean isNotified() {
        return notified;
    }

    public void setNotified(boolean notified) {
        this.notified = notified;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Task task = (Task) o;
        return id.equals(task.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "Task{" +
                "id='" + id + '\'' +
                ", title='" + title + '\'' +
                ", priority=" + priority +
                ", deadline=" + deadline +
                ", completed=" + completed +
                ", progress=" + progress +
                '}';
    }
}
