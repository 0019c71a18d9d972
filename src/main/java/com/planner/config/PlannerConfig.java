package com.planner.config;

import java.time.ZoneId;

/**
 * Root configuration for the planner.
 *
 * @param name                Planner name identifier
 * @param zone                Zone used to read deadlines written without an offset
 * @param seedDemoTasks       Whether the demo application seeds sample tasks
 * @param prettyPrintSnapshot Whether exported JSON is indented
 * @param reminder            Reminder sweep configuration
 */
public record PlannerConfig(
        String name,
        ZoneId zone,
        boolean seedDemoTasks,
        boolean prettyPrintSnapshot,
        ReminderConfig reminder
) {
    /**
     * Create a minimal configuration for testing.
     */
    public static PlannerConfig minimal() {
        return new PlannerConfig("planner", ZoneId.of("UTC"), false, true, ReminderConfig.defaults());
    }
}
