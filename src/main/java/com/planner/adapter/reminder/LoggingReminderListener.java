package com.planner.adapter.reminder;

import com.planner.core.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reminder listener that writes reminders to the application log.
 */
public class LoggingReminderListener implements ReminderListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingReminderListener.class);

    @Override
    public void remind(Task task) {
        log.info("Reminder: '{}' ({}) is due at {}", task.getTitle(), task.getId(), task.getDeadline());
    }
}
