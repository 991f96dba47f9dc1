package tacoq.manager.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.exception.StoreException;
import tacoq.manager.model.ReportOutcome;
import tacoq.manager.model.ResultReport;
import tacoq.manager.model.Task;
import tacoq.manager.model.TaskResult;
import tacoq.manager.model.TaskStatus;
import tacoq.manager.model.WorkerLiveness;
import tacoq.manager.repository.TaskRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static tacoq.manager.store.JdbcSupport.getUuid;
import static tacoq.manager.store.JdbcSupport.isUniqueViolation;
import static tacoq.manager.store.JdbcSupport.setTimestamp;
import static tacoq.manager.store.JdbcSupport.setUuid;
import static tacoq.manager.store.JdbcSupport.sourcesOf;
import static tacoq.manager.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of TaskRepository.
 * Status changes are conditional updates; a zero row count means the task
 * was moved by someone else.
 */
public class JdbcTaskRepository implements TaskRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskRepository.class);

    private final Database db;

    public JdbcTaskRepository(Database db) {
        this.db = db;
    }

    @Override
    public void save(Task task) {
        String sql = """
                    INSERT INTO tasks (id, task_type_id, input_data, status, created_at, assigned_to)
                    VALUES (?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, task.id());
            ps.setObject(2, task.taskTypeId());
            ps.setString(3, task.inputData());
            ps.setString(4, task.status().name());
            setTimestamp(ps, 5, task.createdAt() != null ? task.createdAt() : Instant.now());
            setUuid(ps, 6, task.assignedTo());

            ps.executeUpdate();
            conn.commit();

            log.debug("Saved task {} of type {}", task.id(), task.taskTypeId());
        } catch (SQLException e) {
            throw new StoreException("Failed to save task: " + task.id(), e);
        }
    }

    @Override
    public Optional<Task> findById(UUID taskId) {
        String sql = "SELECT * FROM tasks WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find task: " + taskId, e);
        }
    }

    @Override
    public List<UUID> findTypesWithPending() {
        String sql = "SELECT DISTINCT task_type_id FROM tasks WHERE status = 'PENDING'";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<UUID> ids = new ArrayList<>();
            while (rs.next()) {
                ids.add(getUuid(rs, "task_type_id"));
            }
            return ids;
        } catch (SQLException e) {
            throw new StoreException("Failed to find task types with pending tasks", e);
        }
    }

    @Override
    public List<Task> findPendingByType(UUID taskTypeId, int limit) {
        String sql = """
                    SELECT * FROM tasks
                    WHERE task_type_id = ? AND status = 'PENDING'
                    ORDER BY created_at, seq
                    LIMIT ?
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, taskTypeId);
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find pending tasks for type: " + taskTypeId, e);
        }
    }

    @Override
    public List<Task> findByStatus(TaskStatus status, int limit) {
        String sql = "SELECT * FROM tasks WHERE status = ? ORDER BY created_at, seq LIMIT ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            ps.setInt(2, limit);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find tasks by status: " + status, e);
        }
    }

    @Override
    public List<Task> findAssignedTo(UUID workerId) {
        String sql = "SELECT * FROM tasks WHERE assigned_to = ? ORDER BY created_at, seq";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, workerId);
            return executeQuery(ps);
        } catch (SQLException e) {
            throw new StoreException("Failed to find tasks assigned to worker: " + workerId, e);
        }
    }

    @Override
    public Map<UUID, Integer> countInFlightByWorker() {
        String sql = """
                    SELECT assigned_to, COUNT(*) AS cnt FROM tasks
                    WHERE status IN ('QUEUED', 'RUNNING')
                    GROUP BY assigned_to
                """;

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            Map<UUID, Integer> counts = new HashMap<>();
            while (rs.next()) {
                counts.put(getUuid(rs, "assigned_to"), rs.getInt("cnt"));
            }
            return counts;
        } catch (SQLException e) {
            throw new StoreException("Failed to count in-flight tasks", e);
        }
    }

    @Override
    public boolean assign(UUID taskId, UUID workerId) {
        // Locking the worker row serializes this with a concurrent death declaration:
        // either the death sees the QUEUED task and reclaims it, or we see DEAD.
        String lockSql = "SELECT liveness FROM workers WHERE id = ? FOR UPDATE";

        String updateSql = """
                    UPDATE tasks
                    SET status = 'QUEUED', assigned_to = ?
                    WHERE id = ? AND status IN (%s)
                      AND EXISTS (SELECT 1 FROM worker_task_types c
                                  WHERE c.worker_id = ? AND c.task_type_id = tasks.task_type_id)
                """.formatted(sourcesOf(TaskStatus.QUEUED));

        try (Connection conn = db.getConnection()) {
            try {
                try (PreparedStatement ps = conn.prepareStatement(lockSql)) {
                    ps.setObject(1, workerId);
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next() || WorkerLiveness.valueOf(rs.getString("liveness")) != WorkerLiveness.ALIVE) {
                            conn.rollback();
                            return false;
                        }
                    }
                }

                int updated;
                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setObject(1, workerId);
                    ps.setObject(2, taskId);
                    ps.setObject(3, workerId);
                    updated = ps.executeUpdate();
                }

                if (updated == 0) {
                    conn.rollback();
                    return false;
                }

                conn.commit();
                return true;
            } catch (SQLException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to assign task " + taskId + " to worker " + workerId, e);
        }
    }

    @Override
    public boolean markRunning(UUID taskId, UUID workerId) {
        String sql = """
                    UPDATE tasks
                    SET status = 'RUNNING'
                    WHERE id = ? AND status IN (%s) AND assigned_to = ?
                """.formatted(sourcesOf(TaskStatus.RUNNING));

        return executeGuardedUpdate(sql, taskId, workerId, "mark task running: " + taskId);
    }

    @Override
    public boolean rollbackAssignment(UUID taskId, UUID workerId) {
        // narrower than the table: once started, a task only goes back through reclaim
        String sql = """
                    UPDATE tasks
                    SET status = 'PENDING', assigned_to = NULL
                    WHERE id = ? AND status = 'QUEUED' AND assigned_to = ?
                """;

        return executeGuardedUpdate(sql, taskId, workerId, "roll back assignment of task: " + taskId);
    }

    @Override
    public boolean cancel(UUID taskId) {
        String sql = """
                    UPDATE tasks
                    SET status = 'CANCELLED', assigned_to = NULL
                    WHERE id = ? AND status IN (%s)
                """.formatted(sourcesOf(TaskStatus.CANCELLED));

        return executeGuardedUpdate(sql, taskId, null, "cancel task: " + taskId);
    }

    private boolean executeGuardedUpdate(String sql, UUID taskId, UUID workerId, String what) {
        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, taskId);
            if (workerId != null) {
                ps.setObject(2, workerId);
            }
            int updated = ps.executeUpdate();
            conn.commit();
            return updated > 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to " + what, e);
        }
    }

    @Override
    public ReportOutcome finalizeWithResult(ResultReport report, UUID resultId, Instant completedAt) {
        // worker row before task row, the same order assign and reclaim lock in
        String reporterSql = "SELECT liveness FROM workers WHERE id = ? FOR UPDATE";
        String lockSql = "SELECT status, assigned_to FROM tasks WHERE id = ? FOR UPDATE";
        String reclaimedSql = "SELECT 1 FROM task_reclaims WHERE task_id = ? AND worker_id = ? LIMIT 1";

        String insertSql = """
                    INSERT INTO task_results (id, task_id, output_data, error_data, completed_at, worker_id, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?)
                """;

        String updateSql = """
                    UPDATE tasks
                    SET status = ?, assigned_to = NULL
                    WHERE id = ? AND status IN (%s)
                """.formatted(sourcesOf(report.targetStatus()));

        try (Connection conn = db.getConnection()) {
            try {
                WorkerLiveness reporter = null;
                try (PreparedStatement ps = conn.prepareStatement(reporterSql)) {
                    ps.setObject(1, report.workerId());
                    try (ResultSet rs = ps.executeQuery()) {
                        if (rs.next()) {
                            reporter = WorkerLiveness.valueOf(rs.getString("liveness"));
                        }
                    }
                }

                TaskStatus current;
                UUID assignedTo;
                try (PreparedStatement ps = conn.prepareStatement(lockSql)) {
                    ps.setObject(1, report.taskId());
                    try (ResultSet rs = ps.executeQuery()) {
                        if (!rs.next()) {
                            conn.rollback();
                            return ReportOutcome.NOT_FOUND;
                        }
                        current = TaskStatus.valueOf(rs.getString("status"));
                        assignedTo = getUuid(rs, "assigned_to");
                    }
                }

                ReportOutcome early = null;
                if (!current.canTransitionTo(report.targetStatus())) {
                    early = current.hasResult() ? ReportOutcome.DUPLICATE
                            : current == TaskStatus.CANCELLED ? ReportOutcome.CANCELLED
                            : ReportOutcome.ORPHANED;
                }
                if (early == null && (reporter == null || reporter == WorkerLiveness.DEAD)) {
                    // never attribute work to a worker that is dead or unknown
                    early = ReportOutcome.ORPHANED;
                }
                if (early == null && !report.workerId().equals(assignedTo)
                        && wasReclaimedFrom(conn, reclaimedSql, report.taskId(), report.workerId())) {
                    // late result of an earlier run; the current assignee owns the task now
                    early = ReportOutcome.ORPHANED;
                }
                if (early != null) {
                    conn.rollback();
                    return early;
                }

                try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                    ps.setObject(1, resultId);
                    ps.setObject(2, report.taskId());
                    ps.setString(3, report.outputData());
                    ps.setString(4, report.errorData());
                    setTimestamp(ps, 5, completedAt);
                    ps.setObject(6, report.workerId());
                    setTimestamp(ps, 7, completedAt);
                    ps.executeUpdate();
                }

                try (PreparedStatement ps = conn.prepareStatement(updateSql)) {
                    ps.setString(1, report.targetStatus().name());
                    ps.setObject(2, report.taskId());
                    if (ps.executeUpdate() == 0) {
                        conn.rollback();
                        return ReportOutcome.DUPLICATE;
                    }
                }

                conn.commit();
                return ReportOutcome.RECORDED;
            } catch (SQLException e) {
                conn.rollback();
                if (isUniqueViolation(e)) {
                    return ReportOutcome.DUPLICATE;
                }
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to record result for task: " + report.taskId(), e);
        }
    }

    private static boolean wasReclaimedFrom(Connection conn, String sql, UUID taskId, UUID workerId)
            throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setObject(1, taskId);
            ps.setObject(2, workerId);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    @Override
    public Optional<TaskResult> findResult(UUID taskId) {
        String sql = "SELECT * FROM task_results WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(TaskResult.builder()
                            .id(getUuid(rs, "id"))
                            .taskId(getUuid(rs, "task_id"))
                            .outputData(rs.getString("output_data"))
                            .errorData(rs.getString("error_data"))
                            .completedAt(toInstant(rs.getTimestamp("completed_at")))
                            .workerId(getUuid(rs, "worker_id"))
                            .createdAt(toInstant(rs.getTimestamp("created_at")))
                            .build());
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find result for task: " + taskId, e);
        }
    }

    @Override
    public int countByStatus(TaskStatus status) {
        String sql = "SELECT COUNT(*) FROM tasks WHERE status = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, status.name());
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return rs.getInt(1);
                }
            }
            return 0;
        } catch (SQLException e) {
            throw new StoreException("Failed to count tasks", e);
        }
    }

    private List<Task> executeQuery(PreparedStatement ps) throws SQLException {
        List<Task> results = new ArrayList<>();
        try (ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                results.add(mapRow(rs));
            }
        }
        return results;
    }

    private Task mapRow(ResultSet rs) throws SQLException {
        return Task.builder()
                .id(getUuid(rs, "id"))
                .taskTypeId(getUuid(rs, "task_type_id"))
                .inputData(rs.getString("input_data"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .createdAt(toInstant(rs.getTimestamp("created_at")))
                .assignedTo(getUuid(rs, "assigned_to"))
                .build();
    }
}
