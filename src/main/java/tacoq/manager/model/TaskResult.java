package tacoq.manager.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * The single recorded outcome of a task. Immutable after creation.
 */
public final class TaskResult {
    private final UUID id;
    private final UUID taskId;
    private final String outputData;
    private final String errorData;
    private final Instant completedAt;
    private final UUID workerId;
    private final Instant createdAt;

    private TaskResult(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.taskId = Objects.requireNonNull(builder.taskId, "taskId is required");
        this.outputData = builder.outputData;
        this.errorData = builder.errorData;
        this.completedAt = builder.completedAt;
        this.workerId = Objects.requireNonNull(builder.workerId, "workerId is required");
        this.createdAt = builder.createdAt;
    }

    public UUID id() {
        return id;
    }

    public UUID taskId() {
        return taskId;
    }

    public String outputData() {
        return outputData;
    }

    public String errorData() {
        return errorData;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public UUID workerId() {
        return workerId;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private UUID id;
        private UUID taskId;
        private String outputData;
        private String errorData;
        private Instant completedAt;
        private UUID workerId;
        private Instant createdAt;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder taskId(UUID taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder outputData(String outputData) {
            this.outputData = outputData;
            return this;
        }

        public Builder errorData(String errorData) {
            this.errorData = errorData;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder workerId(UUID workerId) {
            this.workerId = workerId;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public TaskResult build() {
            return new TaskResult(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskResult that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TaskResult{taskId=" + taskId + ", workerId=" + workerId + ", failed=" + (errorData != null) + "}";
    }
}
