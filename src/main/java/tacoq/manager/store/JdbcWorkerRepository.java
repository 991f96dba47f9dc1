package tacoq.manager.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.exception.StoreException;
import tacoq.manager.model.Heartbeat;
import tacoq.manager.model.TaskStatus;
import tacoq.manager.model.Worker;
import tacoq.manager.model.WorkerLiveness;
import tacoq.manager.repository.WorkerRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.UUID;

import static tacoq.manager.store.JdbcSupport.getUuid;
import static tacoq.manager.store.JdbcSupport.setTimestamp;
import static tacoq.manager.store.JdbcSupport.sourcesOf;
import static tacoq.manager.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of WorkerRepository.
 * Liveness changes are conditional updates so concurrent detectors
 * and heartbeats cannot undo each other.
 */
public class JdbcWorkerRepository implements WorkerRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcWorkerRepository.class);

    private static final String RECORD_RECLAIMS_SQL = """
                INSERT INTO task_reclaims (task_id, worker_id)
                SELECT id, assigned_to FROM tasks
                WHERE assigned_to = ? AND status IN (%s)
            """.formatted(sourcesOf(TaskStatus.PENDING));

    private static final String RECLAIM_SQL = """
                UPDATE tasks
                SET status = 'PENDING', assigned_to = NULL
                WHERE assigned_to = ? AND status IN (%s)
            """.formatted(sourcesOf(TaskStatus.PENDING));

    private final Database db;

    public JdbcWorkerRepository(Database db) {
        this.db = db;
    }

    @Override
    public int register(Worker worker) {
        String updateSql = """
                    UPDATE workers
                    SET name = ?, registered_at = ?, last_heartbeat = ?, liveness = 'ALIVE'
                    WHERE id = ?
                """;

        String insertSql = """
                    INSERT INTO workers (id, name, registered_at, last_heartbeat, liveness)
                    VALUES (?, ?, ?, ?, 'ALIVE')
                """;

        try (Connection conn = db.getConnection()) {
            try {
                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, worker.name());
                    setTimestamp(ps, 2, worker.registeredAt());
                    setTimestamp(ps, 3, worker.registeredAt());
                    ps.setObject(4, worker.id());
                    updated = ps.executeUpdate();
                }

                if (updated == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        ps.setObject(1, worker.id());
                        ps.setString(2, worker.name());
                        setTimestamp(ps, 3, worker.registeredAt());
                        setTimestamp(ps, 4, worker.registeredAt());
                        ps.executeUpdate();
                    }
                }

                replaceCapabilities(conn, worker);
                insertHeartbeat(conn, worker.id(), worker.registeredAt(), worker.registeredAt());

                int reclaimed = reclaim(conn, worker.id());

                conn.commit();

                log.info("Worker {} ({}) {} with {} capabilities", worker.id(), worker.name(),
                        updated == 0 ? "registered" : "re-registered", worker.capabilities().size());
                if (reclaimed > 0) {
                    log.info("Reclaimed {} tasks left over from a previous run of worker {}", reclaimed, worker.id());
                }
                return reclaimed;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to register worker: " + worker.id(), e);
        }
    }

    /**
     * Return the worker's in-flight tasks to PENDING, remembering who they were taken from
     * so a late result from that worker is not recorded.
     */
    private int reclaim(Connection conn, UUID workerId) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(RECORD_RECLAIMS_SQL)) {
            ps.setObject(1, workerId);
            ps.executeUpdate();
        }
        try (PreparedStatement ps = conn.prepareStatement(RECLAIM_SQL)) {
            ps.setObject(1, workerId);
            return ps.executeUpdate();
        }
    }

    private void replaceCapabilities(Connection conn, Worker worker) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement("DELETE FROM worker_task_types WHERE worker_id = ?")) {
            ps.setObject(1, worker.id());
            ps.executeUpdate();
        }

        if (worker.capabilities().isEmpty()) {
            return;
        }

        String sql = "INSERT INTO worker_task_types (worker_id, task_type_id, created_at) VALUES (?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            for (UUID taskTypeId : worker.capabilities()) {
                ps.setObject(1, worker.id());
                ps.setObject(2, taskTypeId);
                setTimestamp(ps, 3, worker.registeredAt());
                ps.addBatch();
            }
            ps.executeBatch();
        }
    }

    private void insertHeartbeat(Connection conn, UUID workerId, Instant heartbeatTime, Instant receivedAt)
            throws SQLException {
        String sql = "INSERT INTO worker_heartbeats (id, worker_id, heartbeat_time, created_at) VALUES (?, ?, ?, ?)";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, UUID.randomUUID());
            ps.setObject(2, workerId);
            setTimestamp(ps, 3, heartbeatTime);
            setTimestamp(ps, 4, receivedAt);
            ps.executeUpdate();
        }
    }

    @Override
    public Optional<Worker> findById(UUID workerId) {
        String sql = "SELECT * FROM workers WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, workerId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                Map<UUID, Set<UUID>> capabilities = loadCapabilities(conn, workerId);
                return Optional.of(mapRow(rs, capabilities));
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to find worker: " + workerId, e);
        }
    }

    @Override
    public List<Worker> findAll() {
        String sql = "SELECT * FROM workers ORDER BY registered_at";

        try (Connection conn = db.getConnection()) {
            Map<UUID, Set<UUID>> capabilities = loadCapabilities(conn, null);
            List<Worker> workers = new ArrayList<>();
            try (PreparedStatement ps = conn.prepareStatement(sql);
                    ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    workers.add(mapRow(rs, capabilities));
                }
            }
            return workers;
        } catch (SQLException e) {
            throw new StoreException("Failed to list workers", e);
        }
    }

    private Map<UUID, Set<UUID>> loadCapabilities(Connection conn, UUID workerId) throws SQLException {
        String sql = workerId == null
                ? "SELECT worker_id, task_type_id FROM worker_task_types"
                : "SELECT worker_id, task_type_id FROM worker_task_types WHERE worker_id = ?";

        Map<UUID, Set<UUID>> result = new HashMap<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            if (workerId != null) {
                ps.setObject(1, workerId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.computeIfAbsent(getUuid(rs, "worker_id"), k -> new HashSet<>())
                            .add(getUuid(rs, "task_type_id"));
                }
            }
        }
        return result;
    }

    @Override
    public Set<UUID> findCapable(UUID taskTypeId, WorkerLiveness liveness) {
        String sql = """
                    SELECT w.id FROM workers w
                    JOIN worker_task_types c ON c.worker_id = w.id
                    WHERE c.task_type_id = ? AND w.liveness = ?
                    ORDER BY w.registered_at
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, taskTypeId);
            ps.setString(2, liveness.name());

            Set<UUID> ids = new LinkedHashSet<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(getUuid(rs, "id"));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new StoreException("Failed to find capable workers for task type: " + taskTypeId, e);
        }
    }

    @Override
    public Optional<WorkerLiveness> recordHeartbeat(UUID workerId, Instant heartbeatTime, Instant receivedAt,
            Instant suspectBefore) {
        String lockSql = "SELECT liveness, last_heartbeat FROM workers WHERE id = ? FOR UPDATE";

        String updateSql = """
                    UPDATE workers
                    SET last_heartbeat = GREATEST(last_heartbeat, CAST(? AS TIMESTAMP)), liveness = ?
                    WHERE id = ? AND liveness <> 'DEAD'
                """;

        try (Connection conn = db.getConnection()) {
            try {
                WorkerLiveness current;
                Instant latest;
                try (PreparedStatement ps = conn.prepareStatement(lockSql)) {
                    ps.setObject(1, workerId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            return Optional.empty();
                        }
                        current = WorkerLiveness.valueOf(rs.getString("liveness"));
                        latest = toInstant(rs.getTimestamp("last_heartbeat"));
                    }
                }

                insertHeartbeat(conn, workerId, heartbeatTime, receivedAt);

                if (current == WorkerLiveness.DEAD) {
                    conn.commit();
                    return Optional.of(WorkerLiveness.DEAD);
                }

                if (latest == null || heartbeatTime.isAfter(latest)) {
                    latest = heartbeatTime;
                }
                // only a heartbeat that is still fresh clears suspicion
                WorkerLiveness next = current == WorkerLiveness.SUSPECTED && !latest.isBefore(suspectBefore)
                        ? WorkerLiveness.ALIVE
                        : current;

                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    setTimestamp(ps, 1, heartbeatTime);
                    ps.setString(2, next.name());
                    ps.setObject(3, workerId);
                    ps.executeUpdate();
                }
                conn.commit();

                if (current == WorkerLiveness.SUSPECTED && next == WorkerLiveness.ALIVE) {
                    log.info("Worker {} recovered from SUSPECTED", workerId);
                } else if (current == WorkerLiveness.SUSPECTED) {
                    log.debug("Stale heartbeat from suspected worker {} at {}", workerId, heartbeatTime);
                }
                return Optional.of(next);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to record heartbeat for worker: " + workerId, e);
        }
    }

    @Override
    public List<UUID> markSuspected(Instant lastHeartbeatBefore) {
        String selectSql = "SELECT id FROM workers WHERE liveness = 'ALIVE' AND last_heartbeat < ? ORDER BY id";

        String updateSql = """
                    UPDATE workers
                    SET liveness = 'SUSPECTED'
                    WHERE id = ? AND liveness = 'ALIVE' AND last_heartbeat < ?
                """;

        try (Connection conn = db.getConnection()) {
            try {
                List<UUID> candidates = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(selectSql)) {
                    setTimestamp(ps, 1, lastHeartbeatBefore);
                    try (ResultSet rs = ps.executeQuery()) {
                        while (rs.next()) {
                            candidates.add(getUuid(rs, "id"));
                        }
                    }
                }

                List<UUID> suspected = new ArrayList<>();
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    for (UUID id : candidates) {
                        ps.setObject(1, id);
                        setTimestamp(ps, 2, lastHeartbeatBefore);
                        int updated = ps.executeUpdate();
                        // one worker per transaction
                        conn.commit();
                        if (updated > 0) {
                            suspected.add(id);
                        }
                    }
                }

                conn.commit();
                return suspected;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to mark suspected workers", e);
        }
    }

    @Override
    public List<UUID> findDeathCandidates(Instant lastHeartbeatBefore) {
        String sql = """
                    SELECT id FROM workers
                    WHERE liveness <> 'DEAD' AND last_heartbeat < ?
                    ORDER BY last_heartbeat
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            setTimestamp(ps, 1, lastHeartbeatBefore);
            List<UUID> ids = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    ids.add(getUuid(rs, "id"));
                }
            }
            return ids;
        } catch (SQLException e) {
            throw new StoreException("Failed to find death candidates", e);
        }
    }

    @Override
    public OptionalInt markDeadAndReclaim(UUID workerId, Instant lastHeartbeatBefore) {
        String markSql = lastHeartbeatBefore == null
                ? "UPDATE workers SET liveness = 'DEAD' WHERE id = ? AND liveness <> 'DEAD'"
                : "UPDATE workers SET liveness = 'DEAD' WHERE id = ? AND liveness <> 'DEAD' AND last_heartbeat < ?";

        try (Connection conn = db.getConnection()) {
            try {
                try (PreparedStatement ps = conn.prepareStatement(markSql)) {
                    ps.setObject(1, workerId);
                    if (lastHeartbeatBefore != null) {
                        setTimestamp(ps, 2, lastHeartbeatBefore);
                    }
                    if (ps.executeUpdate() == 0) {
                        // another detector got there first, or a heartbeat arrived
                        conn.rollback();
                        return OptionalInt.empty();
                    }
                }

                int reclaimed = reclaim(conn, workerId);

                conn.commit();
                return OptionalInt.of(reclaimed);
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to mark worker dead: " + workerId, e);
        }
    }

    @Override
    public List<Heartbeat> findHeartbeats(UUID workerId, int limit) {
        String sql = """
                    SELECT * FROM worker_heartbeats
                    WHERE worker_id = ?
                    ORDER BY heartbeat_time DESC, created_at DESC
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, workerId);
            ps.setInt(2, limit);

            List<Heartbeat> heartbeats = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    heartbeats.add(new Heartbeat(
                            getUuid(rs, "id"),
                            getUuid(rs, "worker_id"),
                            toInstant(rs.getTimestamp("heartbeat_time")),
                            toInstant(rs.getTimestamp("created_at"))));
                }
            }
            return heartbeats;
        } catch (SQLException e) {
            throw new StoreException("Failed to find heartbeats for worker: " + workerId, e);
        }
    }

    @Override
    public int countByLiveness(WorkerLiveness liveness) {
        String sql = "SELECT COUNT(*) FROM workers WHERE liveness = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, liveness.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count workers", e);
        }
    }

    private Worker mapRow(ResultSet rs, Map<UUID, Set<UUID>> capabilities) throws SQLException {
        UUID id = getUuid(rs, "id");
        return Worker.builder()
                .id(id)
                .name(rs.getString("name"))
                .registeredAt(toInstant(rs.getTimestamp("registered_at")))
                .lastHeartbeat(toInstant(rs.getTimestamp("last_heartbeat")))
                .liveness(WorkerLiveness.valueOf(rs.getString("liveness")))
                .capabilities(capabilities.getOrDefault(id, Set.of()))
                .build();
    }
}
