package com.planner.snapshot;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.planner.core.Task;

import java.util.List;

/**
 * Flat, serializable form of one task.
 * Timestamps are ISO-8601 text; a missing deadline is {@code null}.
 * Boxed fields are optional on import and take creation defaults when absent.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record TaskRecord(
        String id,
        String title,
        String description,
        Integer priority,
        String deadline,
        @JsonAlias("created_at") String createdAt,
        Boolean completed,
        Integer progress,
        List<String> dependencies,
        List<String> tags,
        @JsonAlias("estimated_minutes") Integer estimatedEffortMinutes,
        @JsonAlias("auto_assigned") Boolean autoAssigned,
        @JsonAlias("reminded") Boolean notified
) {
    /**
     * Capture every field of a task.
     */
    public static TaskRecord from(Task task) {
        return new TaskRecord(
                task.getId(),
                task.getTitle(),
                task.getDescription(),
                task.getPriority(),
                task.getDeadline() != null ? task.getDeadline().toString() : null,
                task.getCreatedAt().toString(),
                task.isCompleted(),
                task.getProgress(),
                List.copyOf(task.getDependencies()),
                List.copyOf(task.getTags()),
                task.getEstimatedEffortMinutes(),
                task.isAutoAssigned(),
                task.isNotified()
        );
    }
}
