package com.planner.scheduler;

import java.util.Map;

/**
 * Counts for dashboards.
 *
 * @param total              All tasks in the store
 * @param active             Non-completed tasks
 * @param completed          Completed tasks
 * @param activeByPriority   Active task count per priority value, ascending by priority
 */
public record TaskSummary(
        int total,
        int active,
        int completed,
        Map<Integer, Integer> activeByPriority
) {
}
