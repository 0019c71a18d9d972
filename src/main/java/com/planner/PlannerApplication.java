package com.planner;

import com.planner.config.PlannerConfig;
import com.planner.core.Task;
import com.planner.scheduler.CreateTaskRequest;
import com.planner.scheduler.SchedulingEngine;
import com.planner.spring.EnablePlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Example Spring Boot application demonstrating planner usage.
 */
@SpringBootApplication
@EnablePlanner
public class PlannerApplication {

    private static final Logger log = LoggerFactory.getLogger(PlannerApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(PlannerApplication.class, args);
    }

    @Bean
    public CommandLineRunner demo(SchedulingEngine engine, PlannerConfig config, Clock clock) {
        return args -> {
            if (!config.seedDemoTasks()) {
                log.info("Demo seeding disabled");
                return;
            }
            log.info("=== Planner Demo Started ===");
            seedDemoTasks(engine, clock);

            engine.peekNext().ifPresent(next ->
                    log.info("Next up: '{}' (priority={})", next.getTitle(), next.getPriority()));

            List<String> order = engine.globalSchedule();
            for (int i = 0; i < order.size(); i++) {
                Task task = engine.getTask(order.get(i));
                log.info("Suggested #{}: {}", i + 1, task.getTitle());
            }
        };
    }

    /**
     * Seed the sample tasks shown on first start.
     */
    static void seedDemoTasks(SchedulingEngine engine, Clock clock) {
        engine.createTask(CreateTaskRequest.builder()
                .title("Welcome: Your Priority Planner is ready")
                .description("This is a demo task (auto-generated)")
                .priority(5)
                .build());
        engine.createTask(CreateTaskRequest.builder()
                .title("Finish report by tomorrow")
                .description("Q3 summary")
                .priority(2)
                .deadline(clock.instant().plus(Duration.ofDays(1)).toString())
                .build());
        engine.createTask(CreateTaskRequest.builder()
                .title("Quick call with team")
                .description("Discuss milestones")
                .priority(3)
                .deadline(clock.instant().plus(Duration.ofHours(8)).toString())
                .build());
    }
}
