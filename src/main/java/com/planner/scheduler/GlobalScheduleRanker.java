package com.planner.scheduler;

import com.planner.core.Task;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Urgency-blended ranking of active tasks.
 * <p>
 * score = priority + urgencyHours / 24, where urgencyHours is -1000 for a
 * deadline strictly in the past, the hours left for a future deadline, and 0
 * without a deadline. Lower scores come first; ties keep input order.
 */
public class GlobalScheduleRanker {

    static final double OVERDUE_URGENCY_HOURS = -1000;
    private static final double HOURS_PER_DAY = 24.0;
    private static final double SECONDS_PER_HOUR = 3600.0;

    private final Clock clock;

    public GlobalScheduleRanker(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Rank the given tasks; completed tasks are skipped.
     *
     * @return task ids, best first
     */
    public List<String> rank(List<Task> tasks) {
        Instant now = clock.instant();
        List<Scored> scored = new ArrayList<>();
        for (Task task : tasks) {
            if (!task.isCompleted()) {
                scored.add(new Scored(task.getId(), score(task, now)));
            }
        }
        // List.sort is stable
        scored.sort(Comparator.comparingDouble(Scored::score));

        List<String> order = new ArrayList<>(scored.size());
        for (Scored s : scored) {
            order.add(s.taskId());
        }
        return order;
    }

    static double score(Task task, Instant now) {
        return task.getPriority() + urgencyHours(task.getDeadline(), now) / HOURS_PER_DAY;
    }

    static double urgencyHours(Instant deadline, Instant now) {
        if (deadline == null) {
            return 0;
        }
        if (deadline.isBefore(now)) {
            return OVERDUE_URGENCY_HOURS;
        }
        // toMillis() overflows for deadlines hundreds of millions of years out
        Duration remaining = Duration.between(now, deadline);
        return (remaining.getSeconds() + remaining.getNano() / 1e9) / SECONDS_PER_HOUR;
    }

    private record Scored(String taskId, double score) {}
}
