package tacoq.manager.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable domain model of a task instance.
 * The store is authoritative; instances are snapshots.
 */
public final class Task {
    private final UUID id;
    private final UUID taskTypeId;
    private final String inputData; // raw JSON, may be null
    private final TaskStatus status;
    private final Instant createdAt;
    private final UUID assignedTo; // worker ID while QUEUED or RUNNING

    private Task(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.taskTypeId = Objects.requireNonNull(builder.taskTypeId, "taskTypeId is required");
        this.inputData = builder.inputData;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.createdAt = builder.createdAt;
        this.assignedTo = builder.assignedTo;
    }

    public UUID id() {
        return id;
    }

    public UUID taskTypeId() {
        return taskTypeId;
    }

    public String inputData() {
        return inputData;
    }

    public TaskStatus status() {
        return status;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public UUID assignedTo() {
        return assignedTo;
    }

    public boolean isAssignedTo(UUID workerId) {
        return assignedTo != null && assignedTo.equals(workerId);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .taskTypeId(taskTypeId)
                .inputData(inputData)
                .status(status)
                .createdAt(createdAt)
                .assignedTo(assignedTo);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private UUID id;
        private UUID taskTypeId;
        private String inputData;
        private TaskStatus status = TaskStatus.PENDING;
        private Instant createdAt;
        private UUID assignedTo;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder taskTypeId(UUID taskTypeId) {
            this.taskTypeId = taskTypeId;
            return this;
        }

        public Builder inputData(String inputData) {
            this.inputData = inputData;
            return this;
        }

        public Builder status(TaskStatus status) {
            this.status = status;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder assignedTo(UUID assignedTo) {
            this.assignedTo = assignedTo;
            return this;
        }

        public Task build() {
            return new Task(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Task task))
            return false;
        return Objects.equals(id, task.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Task{id=" + id + ", status=" + status + ", assignedTo=" + assignedTo + "}";
    }
}
