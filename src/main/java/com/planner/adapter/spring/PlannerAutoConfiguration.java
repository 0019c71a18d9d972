package com.planner.adapter.spring;

import com.planner.adapter.reminder.LoggingReminderListener;
import com.planner.adapter.reminder.ReminderListener;
import com.planner.adapter.reminder.ReminderSweeper;
import com.planner.adapter.reminder.ReminderWindow;
import com.planner.config.ConfigLoader;
import com.planner.config.PlannerConfig;
import com.planner.scheduler.DefaultSchedulingEngine;
import com.planner.scheduler.SchedulingEngine;
import com.planner.store.InMemoryTaskStore;
import com.planner.store.TaskStore;
import com.planner.time.DeadlineParser;
import com.planner.time.DefaultDeadlineParser;
import com.planner.time.IdGenerator;
import com.planner.time.UuidIdGenerator;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring Boot auto-configuration for the planner.
 * Each collaborator can be overridden by declaring a bean of the same type.
 */
@Configuration
@ConditionalOnProperty(prefix = "planner", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PlannerProperties.class)
public class PlannerAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PlannerAutoConfiguration.class);

    private ReminderSweeper reminderSweeper;

    @Bean
    @ConditionalOnMissingBean
    public PlannerConfig plannerConfig(PlannerProperties properties) {
        log.info("Loading planner configuration from: {}", properties.getConfigPath());
        return ConfigLoader.load(properties.getConfigPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock plannerClock(PlannerConfig config) {
        return Clock.system(config.zone());
    }

    @Bean
    @ConditionalOnMissingBean
    public DeadlineParser deadlineParser(PlannerConfig config, Clock clock) {
        return new DefaultDeadlineParser(clock, config.zone());
    }

    @Bean
    @ConditionalOnMissingBean
    public IdGenerator idGenerator() {
        return new UuidIdGenerator();
    }

    @Bean
    @ConditionalOnMissingBean
    public TaskStore taskStore() {
        return new InMemoryTaskStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public SchedulingEngine schedulingEngine(PlannerConfig config,
                                             TaskStore store,
                                             DeadlineParser deadlineParser,
                                             IdGenerator idGenerator,
                                             Clock clock) {
        log.info("Creating SchedulingEngine: {}", config.name());
        return new DefaultSchedulingEngine(store, deadlineParser, idGenerator, clock, config.prettyPrintSnapshot());
    }

    @Bean
    @ConditionalOnMissingBean
    public ReminderListener reminderListener() {
        return new LoggingReminderListener();
    }

    @Bean
    @ConditionalOnMissingBean
    public ReminderSweeper reminderSweeper(PlannerConfig config,
                                           SchedulingEngine engine,
                                           ReminderListener listener,
                                           Clock clock) {
        this.reminderSweeper = new ReminderSweeper(engine, listener, ReminderWindow.from(config.reminder()), clock);
        if (config.reminder().enabled()) {
            reminderSweeper.start(config.reminder().intervalSeconds());
        }
        return reminderSweeper;
    }

    @PreDestroy
    public void shutdown() {
        if (reminderSweeper != null && reminderSweeper.isRunning()) {
            log.info("Shutting down ReminderSweeper");
            reminderSweeper.shutdown();
        }
    }
}
