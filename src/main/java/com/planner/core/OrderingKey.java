package com.planner.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Ordering key for "what should be worked on next".
 * Encapsulates: priority + deadline
 * <p>
 * Comparison order:
 * 1. Priority (lower = more urgent)
 * 2. Deadline (earlier wins; no deadline sorts as +infinity)
 */
public final class OrderingKey implements Comparable<OrderingKey> {

    private final int priority;
    private final Instant deadline;

    /**
     * Create an ordering key.
     *
     * @param priority Task priority (lower = more urgent)
     * @param deadline Task deadline, or null for none
     */
    public OrderingKey(int priority, Instant deadline) {
        this.priority = priority;
        this.deadline = deadline;
    }

    public int getPriority() {
        return priority;
    }

    public Instant getDeadline() {
        return deadline;
    }

    public boolean hasDeadline() {
        return deadline != null;
    }

    @Override
    public int compareTo(OrderingKey other) {
        // 1. Compare priorities
        int priorityCmp = Integer.compare(this.priority, other.priority);
        if (priorityCmp != 0) {
            return priorityCmp;
        }

        // 2. Compare deadlines, absent = +infinity
        if (this.deadline == null) {
            return other.deadline == null ? 0 : 1;
        }
        if (other.deadline == null) {
            return -1;
        }
        return this.deadline.compareTo(other.deadline);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        OrderingKey that = (OrderingKey) o;
        return priority == that.priority && Objects.equals(deadline, that.deadline);
    }

    @Override
    public int hashCode() {
        return Objects.hash(priority, deadline);
    }

    @Override
    public String toString() {
        return "OrderingKey{" +
                "priority=" + priority +
                ", deadline=" + (deadline != null ? deadline : "none") +
                '}';
    }
}
