package com.planner.snapshot;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.planner.core.Task;
import com.planner.exception.SnapshotFormatException;
import com.planner.time.IdGenerator;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Converts between tasks, {@link Snapshot} and the JSON document {@code {"tasks": [...]}}.
 * <p>
 * Decoding validates the whole payload before returning anything, so a caller
 * can replace its store only once the payload is known good.
 */
public class SnapshotCodec {

    private final ObjectMapper objectMapper;
    private final IdGenerator idGenerator;
    private final Clock clock;

    public SnapshotCodec(IdGenerator idGenerator, Clock clock, boolean prettyPrint) {
        this.idGenerator = Objects.requireNonNull(idGenerator, "idGenerator cannot be null");
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.INDENT_OUTPUT, prettyPrint);
    }

    public Snapshot toSnapshot(Collection<Task> tasks) {
        List<TaskRecord> records = new ArrayList<>(tasks.size());
        for (Task task : tasks) {
            records.add(TaskRecord.from(task));
        }
        return new Snapshot(records);
    }

    /**
     * Rebuild tasks from a snapshot, applying creation defaults to missing fields.
     *
     * @throws SnapshotFormatException on duplicate ids or unreadable timestamps
     */
    public List<Task> toTasks(Snapshot snapshot) {
        if (snapshot == null) {
            throw new SnapshotFormatException("Snapshot is missing");
        }
        List<Task> tasks = new ArrayList<>(snapshot.tasks().size());
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < snapshot.tasks().size(); i++) {
            Task task = toTask(snapshot.tasks().get(i), i);
            if (!seen.add(task.getId())) {
                throw new SnapshotFormatException("Duplicate task id at index " + i + ": " + task.getId());
            }
            tasks.add(task);
        }
        return tasks;
    }

    public String write(Snapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize snapshot", e);
        }
    }

    /**
     * Parse a JSON snapshot document.
     *
     * @throws SnapshotFormatException if the text is not a valid snapshot document
     */
    public Snapshot read(String json) {
        if (json == null || json.isBlank()) {
            throw new SnapshotFormatException("Snapshot payload is empty");
        }
        try {
            Snapshot snapshot = objectMapper.readValue(json, Snapshot.class);
            if (snapshot == null) {
                throw new SnapshotFormatException("Snapshot payload is null");
            }
            return snapshot;
        } catch (JsonProcessingException e) {
            throw new SnapshotFormatException("Malformed snapshot: " + e.getOriginalMessage(), e);
        }
    }

    private Task toTask(TaskRecord record, int index) {
        if (record == null) {
            throw new SnapshotFormatException("Task record at index " + index + " is null");
        }
        String id = record.id() != null && !record.id().isBlank() ? record.id() : idGenerator.newId();
        Instant createdAt = record.createdAt() != null
                ? parseTimestamp(record.createdAt(), "createdAt", index)
                : clock.instant();

        Task task = new Task(id, createdAt);
        task.setTitle(record.title());
        task.setDescription(record.description());
        task.setPriority(record.priority() != null ? record.priority() : Task.DEFAULT_PRIORITY);
        if (record.deadline() != null && !record.deadline().isBlank()) {
            task.setDeadline(parseTimestamp(record.deadline(), "deadline", index));
        }
        task.setDependencies(record.dependencies());
        task.setTags(record.tags());
        task.setEstimatedEffortMinutes(record.estimatedEffortMinutes());
        task.setAutoAssigned(Boolean.TRUE.equals(record.autoAssigned()));
        task.setNotified(Boolean.TRUE.equals(record.notified()));
        task.setProgress(record.progress() != null ? record.progress() : Task.MIN_PROGRESS);
        if (Boolean.TRUE.equals(record.completed())) {
            task.markCompleted();
        }
        task.recomputeOrderingKey();
        return task;
    }

    private static Instant parseTimestamp(String text, String field, int index) {
        try {
            TemporalAccessor parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(
                    text.strip(), ZonedDateTime::from, LocalDateTime::from);
            if (parsed instanceof ZonedDateTime zoned) {
                return zoned.toInstant();
            }
            return ((LocalDateTime) parsed).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            throw new SnapshotFormatException(
                    "Invalid " + field + " at index " + index + ": '" + text + "'", e);
        }
    }
}
