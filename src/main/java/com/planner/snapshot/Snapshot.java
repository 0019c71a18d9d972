package com.planner.snapshot;

import java.util.List;

/**
 * Full export of the store: every task, completed or not.
 *
 * @param tasks Task records in store order
 */
public record Snapshot(List<TaskRecord> tasks) {

    public Snapshot {
        tasks = tasks != null ? List.copyOf(tasks) : List.of();
    }
}
