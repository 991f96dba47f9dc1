package tacoq.manager.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.exception.StoreException;
import tacoq.manager.model.TaskType;
import tacoq.manager.repository.TaskTypeRepository;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

import static tacoq.manager.store.JdbcSupport.getUuid;
import static tacoq.manager.store.JdbcSupport.isUniqueViolation;
import static tacoq.manager.store.JdbcSupport.setTimestamp;
import static tacoq.manager.store.JdbcSupport.toInstant;

/**
 * JDBC implementation of TaskTypeRepository.
 */
public class JdbcTaskTypeRepository implements TaskTypeRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskTypeRepository.class);

    private final Database db;

    public JdbcTaskTypeRepository(Database db) {
        this.db = db;
    }

    @Override
    public TaskType createIfAbsent(TaskType taskType) {
        Optional<TaskType> existing = findByName(taskType.name());
        if (existing.isPresent()) {
            return existing.get();
        }

        String sql = "INSERT INTO task_types (id, name, created_at) VALUES (?, ?, ?)";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, taskType.id());
            ps.setString(2, taskType.name());
            setTimestamp(ps, 3, taskType.createdAt());
            ps.executeUpdate();
            conn.commit();

            log.info("Task type created: {} ({})", taskType.name(), taskType.id());
            return taskType;
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                // lost a race with another creator of the same name
                return findByName(taskType.name())
                        .orElseThrow(() -> new StoreException("Task type vanished: " + taskType.name(), e));
            }
            throw new StoreException("Failed to create task type: " + taskType.name(), e);
        }
    }

    @Override
    public Optional<TaskType> findById(UUID id) {
        String sql = "SELECT * FROM task_types WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setObject(1, id);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find task type: " + id, e);
        }
    }

    @Override
    public Optional<TaskType> findByName(String name) {
        String sql = "SELECT * FROM task_types WHERE name = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find task type: " + name, e);
        }
    }

    @Override
    public List<TaskType> findAll() {
        String sql = "SELECT * FROM task_types ORDER BY name";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql);
                ResultSet rs = ps.executeQuery()) {

            List<TaskType> types = new ArrayList<>();
            while (rs.next()) {
                types.add(mapRow(rs));
            }
            return types;
        } catch (SQLException e) {
            throw new StoreException("Failed to list task types", e);
        }
    }

    @Override
    public Set<UUID> findMissing(Collection<UUID> ids) {
        Set<UUID> missing = new LinkedHashSet<>(ids);
        if (missing.isEmpty()) {
            return missing;
        }

        String sql = "SELECT id FROM task_types WHERE id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            for (UUID id : ids) {
                ps.setObject(1, id);
                try (ResultSet rs = ps.executeQuery()) {
                    if (rs.next()) {
                        missing.remove(id);
                    }
                }
            }
            return missing;
        } catch (SQLException e) {
            throw new StoreException("Failed to check task types", e);
        }
    }

    private TaskType mapRow(ResultSet rs) throws SQLException {
        return new TaskType(
                getUuid(rs, "id"),
                rs.getString("name"),
                toInstant(rs.getTimestamp("created_at")));
    }
}
