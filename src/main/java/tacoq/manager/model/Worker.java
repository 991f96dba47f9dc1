package tacoq.manager.model;

import java.time.Instant;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;

/**
 * Immutable domain model of a registered worker and its declared capabilities.
 */
public final class Worker {
    private final UUID id;
    private final String name;
    private final Instant registeredAt;
    private final Instant lastHeartbeat;
    private final WorkerLiveness liveness;
    private final Set<UUID> capabilities; // task type IDs

    private Worker(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.name = Objects.requireNonNull(builder.name, "name is required");
        this.registeredAt = builder.registeredAt;
        this.lastHeartbeat = builder.lastHeartbeat;
        this.liveness = Objects.requireNonNull(builder.liveness, "liveness is required");
        this.capabilities = builder.capabilities == null ? Set.of() : Set.copyOf(builder.capabilities);
    }

    public UUID id() {
        return id;
    }

    public String name() {
        return name;
    }

    public Instant registeredAt() {
        return registeredAt;
    }

    public Instant lastHeartbeat() {
        return lastHeartbeat;
    }

    public WorkerLiveness liveness() {
        return liveness;
    }

    public Set<UUID> capabilities() {
        return capabilities;
    }

    public boolean canExecute(UUID taskTypeId) {
        return capabilities.contains(taskTypeId);
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .registeredAt(registeredAt)
                .lastHeartbeat(lastHeartbeat)
                .liveness(liveness)
                .capabilities(capabilities);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private UUID id;
        private String name;
        private Instant registeredAt;
        private Instant lastHeartbeat;
        private WorkerLiveness liveness = WorkerLiveness.ALIVE;
        private Set<UUID> capabilities;

        public Builder id(UUID id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder registeredAt(Instant registeredAt) {
            this.registeredAt = registeredAt;
            return this;
        }

        public Builder lastHeartbeat(Instant lastHeartbeat) {
            this.lastHeartbeat = lastHeartbeat;
            return this;
        }

        public Builder liveness(WorkerLiveness liveness) {
            this.liveness = liveness;
            return this;
        }

        public Builder capabilities(Set<UUID> capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Worker build() {
            return new Worker(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Worker worker))
            return false;
        return Objects.equals(id, worker.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Worker{id=" + id + ", name='" + name + "', liveness=" + liveness + "}";
    }
}
