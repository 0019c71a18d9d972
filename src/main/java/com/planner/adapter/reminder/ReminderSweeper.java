package com.planner.adapter.reminder;

import com.planner.core.Task;
import com.planner.exception.TaskNotFoundException;
import com.planner.scheduler.SchedulingEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Finds tasks inside the reminder window, hands each to a {@link ReminderListener}
 * and marks it reminded so it is never delivered twice.
 * <p>
 * Runs on demand via {@link #sweep()} or periodically after {@link #start(long)}.
 */
public class ReminderSweeper {

    private static final Logger log = LoggerFactory.getLogger(ReminderSweeper.class);

    private final SchedulingEngine engine;
    private final ReminderListener listener;
    private final ReminderWindow window;
    private final Clock clock;
    private final AtomicBoolean started = new AtomicBoolean(false);
    private ScheduledExecutorService scheduler;

    public ReminderSweeper(SchedulingEngine engine, ReminderListener listener, ReminderWindow window, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "engine cannot be null");
        this.listener = Objects.requireNonNull(listener, "listener cannot be null");
        this.window = Objects.requireNonNull(window, "window cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Deliver every due reminder once.
     *
     * @return number of reminders delivered
     */
    public int sweep() {
        Instant now = clock.instant();
        int delivered = 0;
        for (Task task : engine.listTasks(false)) {
            if (!window.isDue(task, now)) {
                continue;
            }
            try {
                listener.remind(task);
                engine.markReminded(task.getId());
                delivered++;
            } catch (TaskNotFoundException e) {
                log.debug("Task {} deleted before it could be marked reminded", task.getId());
            } catch (RuntimeException e) {
                log.warn("Reminder delivery failed for task {}, will retry", task.getId(), e);
            }
        }
        if (delivered > 0) {
            log.info("Delivered {} reminders", delivered);
        }
        return delivered;
    }

    /**
     * Start sweeping periodically on a single background thread.
     */
    public void start(long intervalSeconds) {
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("Interval must be positive");
        }
        if (!started.compareAndSet(false, true)) {
            log.warn("ReminderSweeper already started");
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "planner-reminder");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::sweepQuietly, 0, intervalSeconds, TimeUnit.SECONDS);
        log.info("ReminderSweeper started (interval={}s, window={}, grace={})",
                intervalSeconds, window.window(), window.grace());
    }

    public boolean isRunning() {
        return started.get() && scheduler != null && !scheduler.isShutdown();
    }

    /**
     * Stop the periodic sweep.
     */
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            log.info("ReminderSweeper shutdown");
        }
    }

    // A throwing task would cancel the periodic schedule
    private void sweepQuietly() {
        try {
            sweep();
        } catch (RuntimeException e) {
            log.error("Reminder sweep failed", e);
        }
    }
}
