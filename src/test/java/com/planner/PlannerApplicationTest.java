package com.planner;

import com.planner.config.PlannerConfig;
import com.planner.core.Task;
import com.planner.scheduler.DefaultSchedulingEngine;
import com.planner.scheduler.SchedulingEngine;
import com.planner.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the demo seeding done by PlannerApplication.
 */
class PlannerApplicationTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    @Test
    @DisplayName("Seeds three demo tasks with the call ranked first")
    void seedDemoTasks() {
        MutableClock clock = new MutableClock(NOW);
        SchedulingEngine engine = new DefaultSchedulingEngine(PlannerConfig.minimal(), clock);

        PlannerApplication.seedDemoTasks(engine, clock);

        List<Task> tasks = engine.listTasks(true);
        assertEquals(3, tasks.size());
        assertEquals("Welcome: Your Priority Planner is ready", tasks.get(0).getTitle());
        assertEquals(5, tasks.get(0).getPriority());
        assertNull(tasks.get(0).getDeadline());
        assertEquals(NOW.plus(Duration.ofDays(1)), tasks.get(1).getDeadline());
        assertEquals(NOW.plus(Duration.ofHours(8)), tasks.get(2).getDeadline());

        // priority 2 leads the strict queue
        assertEquals("Finish report by tomorrow", engine.peekNext().orElseThrow().getTitle());
        // 2 + 24/24 < 3 + 8/24 < 5
        List<String> order = engine.globalSchedule();
        assertEquals(List.of(tasks.get(1).getId(), tasks.get(2).getId(), tasks.get(0).getId()), order);
    }
}
