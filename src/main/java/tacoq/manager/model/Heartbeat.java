package tacoq.manager.model;

import java.time.Instant;
import java.util.UUID;

/**
 * One entry of the append-only heartbeat log.
 */
public record Heartbeat(UUID id, UUID workerId, Instant heartbeatTime, Instant createdAt) {
}
