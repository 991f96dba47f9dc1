package tacoq.manager.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.config.ManagerConfig;
import tacoq.manager.exception.InvalidCapabilityException;
import tacoq.manager.model.TaskType;
import tacoq.manager.repository.TaskTypeRepository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Service layer for task types.
 */
public class TaskTypeService {

    private static final Logger log = LoggerFactory.getLogger(TaskTypeService.class);

    // used verbatim in queue names
    private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9_.-]{1,255}");

    private final TaskTypeRepository taskTypeRepository;
    private final ManagerConfig config;

    public TaskTypeService(TaskTypeRepository taskTypeRepository, ManagerConfig config) {
        this.taskTypeRepository = taskTypeRepository;
        this.config = config;
    }

    /**
     * Create a task type, or return the existing one with that name.
     */
    public TaskType create(String name) {
        if (name == null || !VALID_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("invalid task type name: " + name);
        }
        return taskTypeRepository.createIfAbsent(new TaskType(UUID.randomUUID(), name, config.clock().instant()));
    }

    public Optional<TaskType> findByName(String name) {
        return taskTypeRepository.findByName(name);
    }

    public Optional<TaskType> findById(UUID id) {
        return taskTypeRepository.findById(id);
    }

    public List<TaskType> list() {
        return taskTypeRepository.findAll();
    }

    /**
     * Resolve task type names to IDs. Unknown names are created when auto-creation
     * is enabled, otherwise the whole set is rejected.
     *
     * @throws InvalidCapabilityException listing every unknown name
     */
    public Set<UUID> resolve(Collection<String> names) {
        Set<UUID> ids = new LinkedHashSet<>();
        List<String> unknown = new ArrayList<>();

        for (String name : names) {
            Optional<TaskType> type = taskTypeRepository.findByName(name);
            if (type.isPresent()) {
                ids.add(type.get().id());
            } else {
                unknown.add(name);
            }
        }

        if (unknown.isEmpty()) {
            return ids;
        }
        if (!config.autoCreateTaskTypes()) {
            throw new InvalidCapabilityException(unknown);
        }

        for (String name : unknown) {
            TaskType created = create(name);
            log.info("Task type {} created on first use", name);
            ids.add(created.id());
        }
        return ids;
    }

    /**
     * @throws InvalidCapabilityException if any ID does not name an existing task type
     */
    public void requireExisting(Collection<UUID> ids) {
        Set<UUID> missing = taskTypeRepository.findMissing(ids);
        if (!missing.isEmpty()) {
            throw new InvalidCapabilityException(missing);
        }
    }
}
