package com.planner.estimate;

import java.time.Instant;
import java.util.List;

/**
 * Result of heuristic estimation for a new task.
 *
 * @param priority               Derived priority (lower = more urgent)
 * @param deadline               Deadline to use; the heuristic never infers one, so this is the input deadline
 * @param tags                   Inferred tags, in the order the rules fired
 * @param estimatedEffortMinutes Estimated effort in minutes
 */
public record Estimate(
        int priority,
        Instant deadline,
        List<String> tags,
        int estimatedEffortMinutes
) {
    public Estimate {
        tags = List.copyOf(tags);
    }
}
