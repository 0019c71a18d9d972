package com.planner.config;

/**
 * Configuration for the reminder sweep.
 *
 * @param enabled         Whether the periodic sweep starts with the application
 * @param windowMinutes   Remind when the deadline is at most this many minutes away
 * @param graceMinutes    Still remind up to this many minutes after the deadline passed
 * @param intervalSeconds Delay between periodic sweeps
 */
public record ReminderConfig(
        boolean enabled,
        int windowMinutes,
        int graceMinutes,
        int intervalSeconds
) {
    public static ReminderConfig defaults() {
        return new ReminderConfig(false, 60, 60, 60);
    }
}
