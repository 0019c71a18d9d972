package com.planner.scheduler;

import com.planner.core.Task;
import com.planner.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for GlobalScheduleRanker.
 */
class GlobalScheduleRankerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private final GlobalScheduleRanker ranker = new GlobalScheduleRanker(new MutableClock(NOW));

    private static Task task(String id, int priority, Instant deadline) {
        Task task = new Task(id, NOW);
        task.setPriority(priority);
        task.setDeadline(deadline);
        return task;
    }

    @ParameterizedTest
    @CsvSource({
            "0, 0.0",
            "6, 6.0",
            "36, 36.0",
            "-1, -1000.0"
    })
    @DisplayName("Urgency hours by deadline offset")
    void urgencyHours(long offsetHours, double expected) {
        assertEquals(expected, GlobalScheduleRanker.urgencyHours(NOW.plus(Duration.ofHours(offsetHours)), NOW), 1e-9);
    }

    @Test
    @DisplayName("No deadline contributes no urgency")
    void noDeadline() {
        assertEquals(0.0, GlobalScheduleRanker.urgencyHours(null, NOW));
        assertEquals(4.0, GlobalScheduleRanker.score(task("a", 4, null), NOW));
    }

    @Test
    @DisplayName("A far deadline can rank behind a worse priority without one")
    void farDeadlinePenalty() {
        Task farAway = task("far", 1, NOW.plus(Duration.ofDays(10)));
        Task plain = task("plain", 5, null);

        assertEquals(List.of("plain", "far"), ranker.rank(List.of(farAway, plain)));
    }

    @Test
    @DisplayName("Overdue tasks lead regardless of priority")
    void overdueLeads() {
        Task top = task("top", 1, null);
        Task overdue = task("overdue", 10, NOW.minusSeconds(1));

        assertEquals(List.of("overdue", "top"), ranker.rank(List.of(top, overdue)));
    }

    @Test
    @DisplayName("Ties keep input order and completed tasks are skipped")
    void stableAndActiveOnly() {
        Task first = task("first", 3, null);
        Task second = task("second", 3, null);
        Task done = task("done", 1, null);
        done.markCompleted();

        assertEquals(List.of("first", "second"), ranker.rank(List.of(first, second, done)));
        assertEquals(List.of("second", "first"), ranker.rank(List.of(second, first)));
    }

    @Test
    @DisplayName("Deadlines far beyond the millisecond range still rank")
    void extremeDeadline() {
        Instant remote = Instant.parse("+500000000-01-01T00:00:00Z");
        Task distant = task("distant", 1, remote);
        Task plain = task("plain", 5, null);

        assertTrue(GlobalScheduleRanker.urgencyHours(remote, NOW) > 4e12);
        assertEquals(List.of("plain", "distant"), ranker.rank(List.of(distant, plain)));
    }

    @Test
    @DisplayName("Empty input gives an empty schedule")
    void empty() {
        assertTrue(ranker.rank(List.of()).isEmpty());
    }
}
