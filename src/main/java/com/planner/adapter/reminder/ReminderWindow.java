package com.planner.adapter.reminder;

import com.planner.config.ReminderConfig;
import com.planner.core.Task;

import java.time.Duration;
import java.time.Instant;

/**
 * Decides whether a task is due for a reminder.
 * <p>
 * Due means: not completed, not yet notified, has a deadline, and the deadline
 * lies between {@code now - grace} and {@code now + window}, bounds included.
 *
 * @param window How far ahead of the deadline reminders start
 * @param grace  How long after the deadline reminders are still sent
 */
public record ReminderWindow(Duration window, Duration grace) {

    public static ReminderWindow from(ReminderConfig config) {
        return new ReminderWindow(
                Duration.ofMinutes(config.windowMinutes()),
                Duration.ofMinutes(config.graceMinutes()));
    }

    public boolean isDue(Task task, Instant now) {
        if (task.isCompleted() || task.isNotified() || task.getDeadline() == null) {
            return false;
        }
        Instant deadline = task.getDeadline();
        return !deadline.isAfter(now.plus(window)) && !deadline.isBefore(now.minus(grace));
    }
}
