package tacoq.manager.repository;

import tacoq.manager.model.TaskType;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Repository interface for task type persistence.
 * Task types are never deleted, so an existence check stays valid once it passed.
 */
public interface TaskTypeRepository {

    /**
     * Create a task type, or return the existing one with the same name.
     *
     * @param taskType the candidate (its ID is used only if the name is new)
     * @return the stored task type
     */
    TaskType createIfAbsent(TaskType taskType);

    Optional<TaskType> findById(UUID id);

    Optional<TaskType> findByName(String name);

    List<TaskType> findAll();

    /**
     * @param ids candidate task type IDs
     * @return the subset of IDs that do not exist
     */
    Set<UUID> findMissing(Collection<UUID> ids);
}
