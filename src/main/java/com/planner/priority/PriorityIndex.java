package com.planner.priority;

import com.planner.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.function.Function;

/**
 * Lazy-deletion min-heap over non-completed tasks.
 * <p>
 * Entries are never updated in place. A task that is deleted or completed
 * after being pushed leaves a stale entry behind; stale entries are discarded
 * when they reach the top of the heap during {@link #peek()} or {@link #popNext()}.
 * After any bulk change the owner calls {@link #rebuild(Collection)}.
 * <p>
 * Not thread-safe: callers serialize access.
 */
public class PriorityIndex {

    private static final Logger log = LoggerFactory.getLogger(PriorityIndex.class);

    private final Function<String, Task> resolver;
    private PriorityQueue<IndexEntry> heap = new PriorityQueue<>();

    /**
     * @param resolver Looks up the live task for an id; returns null when absent
     */
    public PriorityIndex(Function<String, Task> resolver) {
        this.resolver = Objects.requireNonNull(resolver, "resolver cannot be null");
    }

    /**
     * Recompute the task's ordering key and insert an entry for it.
     */
    public void push(Task task) {
        IndexEntry entry = new IndexEntry(task.recomputeOrderingKey(), task.getId());
        heap.offer(entry);
        log.trace("Pushed {}, heap size: {}", entry, heap.size());
    }

    /**
     * Return the most urgent live task without removing its entry.
     * Stale entries found on top are discarded.
     */
    public Optional<Task> peek() {
        IndexEntry head;
        while ((head = heap.peek()) != null) {
            Task task = live(head);
            if (task != null) {
                return Optional.of(task);
            }
            heap.poll();
            log.trace("Discarded stale entry {}", head);
        }
        return Optional.empty();
    }

    /**
     * Remove and return the most urgent live task's entry.
     * The task itself stays in the store.
     */
    public Optional<Task> popNext() {
        IndexEntry head;
        while ((head = heap.poll()) != null) {
            Task task = live(head);
            if (task != null) {
                log.trace("Popped {}, heap size: {}", head, heap.size());
                return Optional.of(task);
            }
            log.trace("Discarded stale entry {}", head);
        }
        return Optional.empty();
    }

    /**
     * Discard the heap and push every non-completed task.
     */
    public void rebuild(Collection<Task> tasks) {
        PriorityQueue<IndexEntry> fresh = new PriorityQueue<>(Math.max(1, tasks.size()));
        for (Task task : tasks) {
            if (!task.isCompleted()) {
                fresh.offer(new IndexEntry(task.recomputeOrderingKey(), task.getId()));
            }
        }
        this.heap = fresh;
        log.trace("Rebuilt index with {} entries", heap.size());
    }

    /**
     * Number of heap entries, stale ones included.
     */
    public int size() {
        return heap.size();
    }

    public boolean isEmpty() {
        return heap.isEmpty();
    }

    private Task live(IndexEntry entry) {
        Task task = resolver.apply(entry.getTaskId());
        if (task == null || task.isCompleted()) {
            return null;
        }
        return task;
    }
}
