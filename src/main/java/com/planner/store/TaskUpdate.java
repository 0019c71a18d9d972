package com.planner.store;

import com.planner.core.Task;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * A validated set of field changes for one task.
 * <p>
 * Built from a loosely typed field map; every value is converted up front so
 * that applying the update cannot fail halfway. Unknown field names are ignored.
 * {@code id}, {@code createdAt} and {@code completed} are never updatable.
 */
public final class TaskUpdate {

    private String title;
    private boolean hasTitle;
    private String description;
    private boolean hasDescription;
    private int priority;
    private boolean hasPriority;
    private Instant deadline;
    private boolean hasDeadline;
    private int progress;
    private boolean hasProgress;
    private List<String> dependencies;
    private boolean hasDependencies;
    private List<String> tags;
    private boolean hasTags;
    private Integer estimatedEffortMinutes;
    private boolean hasEstimatedEffortMinutes;
    private boolean autoAssigned;
    private boolean hasAutoAssigned;
    private boolean notified;
    private boolean hasNotified;

    private TaskUpdate() {
    }

    public static TaskUpdate empty() {
        return new TaskUpdate();
    }

    /**
     * Convert a field map into an update.
     *
     * @param fields           Field name to raw value
     * @param deadlineResolver Turns deadline text into an instant; blank text means no deadline
     * @throws IllegalArgumentException if a recognized field has a value of the wrong shape
     */
    public static TaskUpdate fromFields(Map<String, ?> fields, Function<String, Instant> deadlineResolver) {
        TaskUpdate update = new TaskUpdate();
        if (fields == null) {
            return update;
        }
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            String name = entry.getKey();
            Object value = entry.getValue();
            switch (name) {
                case "title" -> update.title(asString(name, value));
                case "description" -> update.description(asString(name, value));
                case "priority" -> update.priority(asInt(name, value));
                case "deadline" -> update.deadline(asDeadline(name, value, deadlineResolver));
                case "progress" -> update.progress(asInt(name, value));
                case "dependencies" -> update.dependencies(asStringList(name, value));
                case "tags" -> update.tags(asStringList(name, value));
                case "estimatedEffortMinutes", "estimated_minutes" ->
                        update.estimatedEffortMinutes(value == null ? null : asInt(name, value));
                case "autoAssigned", "auto_assigned" -> update.autoAssigned(asBoolean(name, value));
                case "notified", "reminded" -> update.notified(asBoolean(name, value));
                default -> {
                    // unrecognized fields are ignored
                }
            }
        }
        return update;
    }

    public TaskUpdate title(String title) {
        this.title = title;
        this.hasTitle = true;
        return this;
    }

    public TaskUpdate description(String description) {
        this.description = description;
        this.hasDescription = true;
        return this;
    }

    public TaskUpdate priority(int priority) {
        this.priority = priority;
        this.hasPriority = true;
        return this;
    }

    public TaskUpdate deadline(Instant deadline) {
        this.deadline = deadline;
        this.hasDeadline = true;
        return this;
    }

    public TaskUpdate progress(int progress) {
        this.progress = progress;
        this.hasProgress = true;
        return this;
    }

    public TaskUpdate dependencies(List<String> dependencies) {
        this.dependencies = dependencies;
        this.hasDependencies = true;
        return this;
    }

    public TaskUpdate tags(List<String> tags) {
        this.tags = tags;
        this.hasTags = true;
        return this;
    }

    public TaskUpdate estimatedEffortMinutes(Integer estimatedEffortMinutes) {
        this.estimatedEffortMinutes = estimatedEffortMinutes;
        this.hasEstimatedEffortMinutes = true;
        return this;
    }

    public TaskUpdate autoAssigned(boolean autoAssigned) {
        this.autoAssigned = autoAssigned;
        this.hasAutoAssigned = true;
        return this;
    }

    public TaskUpdate notified(boolean notified) {
        this.notified = notified;
        this.hasNotified = true;
        return this;
    }

    /**
     * Whether the update changes the priority or the deadline.
     */
    public boolean touchesOrdering() {
        return hasPriority || hasDeadline;
    }

    void applyTo(Task task) {
        if (hasTitle) task.setTitle(title);
        if (hasDescription) task.setDescription(description);
        if (hasPriority) task.setPriority(priority);
        if (hasDeadline) task.setDeadline(deadline);
        if (hasProgress) task.setProgress(progress);
        if (hasDependencies) task.setDependencies(dependencies);
        if (hasTags) task.setTags(tags);
        if (hasEstimatedEffortMinutes) task.setEstimatedEffortMinutes(estimatedEffortMinutes);
        if (hasAutoAssigned) task.setAutoAssigned(autoAssigned);
        if (hasNotified) task.setNotified(notified);
    }

    // Conversion helpers

    private static String asString(String name, Object value) {
        return value != null ? value.toString() : "";
    }

    private static int asInt(String name, Object value) {
        if (value instanceof Number number) {
            // Fractional or out-of-range values are rejected, never narrowed
            try {
                return new BigDecimal(number.toString()).intValueExact();
            } catch (ArithmeticException | NumberFormatException e) {
                throw new IllegalArgumentException("Field '" + name + "' must be an integer: " + number, e);
            }
        }
        if (value instanceof String text) {
            try {
                return Integer.parseInt(text.strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Field '" + name + "' must be an integer: " + text, e);
            }
        }
        throw new IllegalArgumentException("Field '" + name + "' must be an integer: " + value);
    }

    private static boolean asBoolean(String name, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text) {
            return Boolean.parseBoolean(text.strip());
        }
        throw new IllegalArgumentException("Field '" + name + "' must be a boolean: " + value);
    }

    private static List<String> asStringList(String name, Object value) {
        if (value == null) {
            return List.of();
        }
        if (value instanceof Collection<?> items) {
            List<String> result = new ArrayList<>(items.size());
            for (Object item : items) {
                if (item != null) {
                    result.add(item.toString());
                }
            }
            return result;
        }
        throw new IllegalArgumentException("Field '" + name + "' must be a list: " + value);
    }

    private static Instant asDeadline(String name, Object value, Function<String, Instant> deadlineResolver) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof String text) {
            return text.isBlank() ? null : deadlineResolver.apply(text);
        }
        throw new IllegalArgumentException("Field '" + name + "' must be text: " + value);
    }
}
