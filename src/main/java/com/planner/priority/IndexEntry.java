package com.planner.priority;

import com.planner.core.OrderingKey;

import java.util.Objects;

/**
 * Immutable heap entry: an ordering key snapshot plus the task it points at.
 * Equal keys fall back to task id order so the heap stays totally ordered.
 */
public final class IndexEntry implements Comparable<IndexEntry> {

    private final OrderingKey key;
    private final String taskId;

    public IndexEntry(OrderingKey key, String taskId) {
        this.key = Objects.requireNonNull(key, "key cannot be null");
        this.taskId = Objects.requireNonNull(taskId, "taskId cannot be null");
    }

    public OrderingKey getKey() {
        return key;
    }

    public String getTaskId() {
        return taskId;
    }

    @Override
    public int compareTo(IndexEntry other) {
        int keyCmp = this.key.compareTo(other.key);
        if (keyCmp != 0) {
            return keyCmp;
        }
        return this.taskId.compareTo(other.taskId);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IndexEntry that = (IndexEntry) o;
        return key.equals(that.key) && taskId.equals(that.taskId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, taskId);
    }

    @Override
    public String toString() {
        return "IndexEntry{" +
                "taskId='" + taskId + '\'' +
                ", key=" + key +
                '}';
    }
}
