package tacoq.manager.model;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A named category of work. Immutable once created.
 */
public record TaskType(UUID id, String name, Instant createdAt) {

    public TaskType {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(name, "name is required");
    }

    /** Name of the transport queue carrying dispatches of this type */
    public String queueName() {
        return queueName(name);
    }

    public static String queueName(String typeName) {
        return "tasks." + typeName;
    }
}
