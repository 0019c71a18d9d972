package com.planner.scheduler;

import java.util.ArrayList;
import java.util.List;

/**
 * Input for {@link SchedulingEngine#createTask(CreateTaskRequest)}.
 * Immutable after creation. A null priority asks the engine to infer one.
 */
public final class CreateTaskRequest {

    private final String title;
    private final String description;
    private final String deadlineText;
    private final Integer priority;
    private final List<String> dependencyIds;
    private final List<String> tags;
    private final Integer effortMinutes;
    private final boolean naturalLanguageAssist;

    private CreateTaskRequest(Builder builder) {
        this.title = builder.title != null ? builder.title : "";
        this.description = builder.description != null ? builder.description : "";
        this.deadlineText = builder.deadlineText;
        this.priority = builder.priority;
        this.dependencyIds = List.copyOf(builder.dependencyIds);
        this.tags = List.copyOf(builder.tags);
        this.effortMinutes = builder.effortMinutes;
        this.naturalLanguageAssist = builder.naturalLanguageAssist;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static CreateTaskRequest of(String title, String description) {
        return builder().title(title).description(description).build();
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public String getDeadlineText() {
        return deadlineText;
    }

    public Integer getPriority() {
        return priority;
    }

    public List<String> getDependencyIds() {
        return dependencyIds;
    }

    public List<String> getTags() {
        return tags;
    }

    public Integer getEffortMinutes() {
        return effortMinutes;
    }

    public boolean isNaturalLanguageAssist() {
        return naturalLanguageAssist;
    }

    @Override
    public String toString() {
        return "CreateTaskRequest{" +
                "title='" + title + '\'' +
                ", deadlineText='" + deadlineText + '\'' +
                ", priority=" + priority +
                ", dependencyIds=" + dependencyIds +
                ", naturalLanguageAssist=" + naturalLanguageAssist +
                '}';
    }

    /**
     * Builder for CreateTaskRequest.
     */
    public static class Builder {
        private String title;
        private String description;
        private String deadlineText;
        private Integer priority;
        private final List<String> dependencyIds = new ArrayList<>();
        private final List<String> tags = new ArrayList<>();
        private Integer effortMinutes;
        private boolean naturalLanguageAssist;

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder deadline(String deadlineText) {
            this.deadlineText = deadlineText;
            return this;
        }

        public Builder priority(Integer priority) {
            this.priority = priority;
            return this;
        }

        public Builder dependsOn(String dependencyId) {
            if (dependencyId != null) {
                this.dependencyIds.add(dependencyId);
            }
            return this;
        }

        public Builder dependsOn(List<String> dependencyIds) {
            if (dependencyIds != null) {
                dependencyIds.forEach(this::dependsOn);
            }
            return this;
        }

        public Builder tag(String tag) {
            if (tag != null) {
                this.tags.add(tag);
            }
            return this;
        }

        public Builder tags(List<String> tags) {
            if (tags != null) {
                tags.forEach(this::tag);
            }
            return this;
        }

        public Builder effortMinutes(Integer effortMinutes) {
            this.effortMinutes = effortMinutes;
            return this;
        }

        public Builder naturalLanguageAssist(boolean naturalLanguageAssist) {
            this.naturalLanguageAssist = naturalLanguageAssist;
            return this;
        }

        public CreateTaskRequest build() {
            return new CreateTaskRequest(this);
        }
    }
}
