package com.planner.snapshot;

import com.planner.core.Task;
import com.planner.exception.SnapshotFormatException;
import com.planner.support.SequentialIdGenerator;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for SnapshotCodec.
 */
class SnapshotCodecTest {

    private static final Instant NOW = Instant.parse("2025-06-01T12:00:00Z");

    private SnapshotCodec codec;

    @BeforeEach
    void setUp() {
        codec = new SnapshotCodec(new SequentialIdGenerator(), Clock.fixed(NOW, ZoneOffset.UTC), false);
    }

    private Task fullTask() {
        Task task = new Task("abc", Instant.parse("2025-05-30T08:00:00.123456Z"));
        task.setTitle("Write release notes");
        task.setDescription("for 2.0");
        task.setPriority(2);
        task.setDeadline(Instant.parse("2025-06-02T17:30:00Z"));
        task.setProgress(40);
        task.setDependencies(List.of("dep-1", "dep-2"));
        task.setTags(List.of("high", "docs"));
        task.setEstimatedEffortMinutes(45);
        task.setAutoAssigned(true);
        task.setNotified(true);
        return task;
    }

    @Test
    @DisplayName("JSON export and import reproduce every field")
    void fieldForFieldRoundTrip() {
        Task original = fullTask();
        Task bare = new Task("bare", NOW);

        String json = codec.write(codec.toSnapshot(List.of(original, bare)));
        List<Task> restored = codec.toTasks(codec.read(json));

        assertEquals(2, restored.size());
        assertEquals(TaskRecord.from(original), TaskRecord.from(restored.get(0)));
        assertEquals(TaskRecord.from(bare), TaskRecord.from(restored.get(1)));
        assertNull(restored.get(1).getDeadline());
        assertNull(restored.get(1).getEstimatedEffortMinutes());
        assertEquals(original.getOrderingKey(), restored.get(0).getOrderingKey());
    }

    @Test
    @DisplayName("Missing deadline is written as null")
    void nullDeadlineInJson() {
        String json = codec.write(codec.toSnapshot(List.of(new Task("bare", NOW))));

        assertTrue(json.contains("\"deadline\":null"), json);
        assertTrue(json.startsWith("{\"tasks\":["), json);
    }

    @Test
    @DisplayName("Missing optional fields take creation defaults")
    void defaultsForMissingFields() {
        List<Task> tasks = codec.toTasks(codec.read("{\"tasks\":[{\"title\":\"only a title\"}]}"));

        Task task = tasks.get(0);
        assertEquals("task-1", task.getId());
        assertEquals("only a title", task.getTitle());
        assertEquals("", task.getDescription());
        assertEquals(Task.DEFAULT_PRIORITY, task.getPriority());
        assertEquals(NOW, task.getCreatedAt());
        assertEquals(0, task.getProgress());
        assertFalse(task.isCompleted());
        assertFalse(task.isAutoAssigned());
        assertFalse(task.isNotified());
        assertTrue(task.getTags().isEmpty());
    }

    @Test
    @DisplayName("Snake_case field names and zone-less timestamps are accepted")
    void legacyFieldNames() {
        String json = """
                {"tasks": [{
                    "id": "legacy",
                    "created_at": "2025-05-01T09:30:00.500000",
                    "deadline": "2025-05-02T10:00:00",
                    "estimated_minutes": 20,
                    "auto_assigned": true,
                    "reminded": true,
                    "unknown_field": 42
                }]}
                """;

        Task task = codec.toTasks(codec.read(json)).get(0);

        assertEquals(Instant.parse("2025-05-01T09:30:00.500Z"), task.getCreatedAt());
        assertEquals(Instant.parse("2025-05-02T10:00:00Z"), task.getDeadline());
        assertEquals(20, task.getEstimatedEffortMinutes());
        assertTrue(task.isAutoAssigned());
        assertTrue(task.isNotified());
    }

    @Test
    @DisplayName("Completed flag and progress keep the progress invariant")
    void progressInvariantOnImport() {
        String json = "{\"tasks\":[" +
                "{\"id\":\"a\",\"progress\":100,\"completed\":false}," +
                "{\"id\":\"b\",\"progress\":30,\"completed\":true}," +
                "{\"id\":\"c\",\"progress\":-4}]}";

        List<Task> tasks = codec.toTasks(codec.read(json));

        assertTrue(tasks.get(0).isCompleted());
        assertEquals(100, tasks.get(1).getProgress());
        assertEquals(0, tasks.get(2).getProgress());
    }

    @Test
    @DisplayName("A document without tasks is an empty snapshot")
    void emptyDocument() {
        assertTrue(codec.read("{}").tasks().isEmpty());
    }

    @ParameterizedTest
    @DisplayName("Malformed payloads raise SnapshotFormatException")
    @ValueSource(strings = {
            "",
            "not json",
            "[1, 2]",
            "{\"tasks\": 5}",
            "{\"tasks\": [null]}",
            "{\"tasks\": [{\"priority\": \"very\"}]}",
            "{\"tasks\": [{\"id\": \"x\", \"deadline\": \"someday\"}]}",
            "{\"tasks\": [{\"id\": \"x\"}, {\"id\": \"x\"}]}"
    })
    void malformed(String json) {
        assertThrows(SnapshotFormatException.class, () -> codec.toTasks(codec.read(json)));
    }
}
