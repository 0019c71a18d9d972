package com.planner.adapter.spring;

import com.planner.adapter.reminder.ReminderSweeper;
import com.planner.config.PlannerConfig;
import com.planner.scheduler.CreateTaskRequest;
import com.planner.scheduler.SchedulingEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.ZoneId;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PlannerAutoConfiguration wiring.
 */
class PlannerAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(PlannerAutoConfiguration.class));

    @Test
    @DisplayName("Wires a working engine from the configured file")
    void wiresEngine() {
        contextRunner
                .withPropertyValues("planner.config-path=classpath:planner-test.yaml")
                .run(context -> {
                    PlannerConfig config = context.getBean(PlannerConfig.class);
                    assertEquals("test-planner", config.name());
                    assertEquals(ZoneId.of("Europe/Berlin"), config.zone());

                    SchedulingEngine engine = context.getBean(SchedulingEngine.class);
                    engine.createTask(CreateTaskRequest.builder().title("Wired").priority(2).build());
                    assertEquals("Wired", engine.peekNext().orElseThrow().getTitle());

                    assertTrue(context.getBean(ReminderSweeper.class).isRunning());
                });
    }

    @Test
    @DisplayName("Nothing is registered when disabled")
    void disabled() {
        contextRunner
                .withPropertyValues("planner.enabled=false")
                .run(context -> {
                    assertTrue(context.getBeansOfType(SchedulingEngine.class).isEmpty());
                    assertTrue(context.getBeansOfType(PlannerConfig.class).isEmpty());
                });
    }
}
