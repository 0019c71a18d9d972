package com.planner.adapter.reminder;

import com.planner.core.Task;

/**
 * Delivers a reminder for a task whose deadline is near or just passed.
 * Implementations own the transport (log, mail, push, ...).
 */
@FunctionalInterface
public interface ReminderListener {

    /**
     * Deliver a reminder. Throwing leaves the task un-notified so a later sweep retries.
     */
    void remind(Task task);
}
