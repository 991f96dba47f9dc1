package tacoq.manager.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.config.ManagerConfig;
import tacoq.manager.exception.TaskNotFoundException;
import tacoq.manager.exception.UnknownTaskTypeException;
import tacoq.manager.model.Task;
import tacoq.manager.model.TaskDetails;
import tacoq.manager.model.TaskStatus;
import tacoq.manager.model.TaskType;
import tacoq.manager.model.Transition;
import tacoq.manager.repository.TaskRepository;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Service layer for task submission and task-level signals.
 */
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final TaskRepository taskRepository;
    private final TaskTypeService taskTypeService;
    private final TaskLifecycle lifecycle;
    private final ManagerConfig config;
    private final List<Consumer<Task>> submissionListeners = new CopyOnWriteArrayList<>();

    public TaskService(TaskRepository taskRepository, TaskTypeService taskTypeService, TaskLifecycle lifecycle,
            ManagerConfig config) {
        this.taskRepository = taskRepository;
        this.taskTypeService = taskTypeService;
        this.lifecycle = lifecycle;
        this.config = config;
    }

    /**
     * Called after every submitted task.
     */
    public void addSubmissionListener(Consumer<Task> listener) {
        submissionListeners.add(listener);
    }

    /**
     * Submit a task in PENDING.
     *
     * @param typeName  name of an existing task type
     * @param inputData opaque payload, may be null
     * @return the new task ID
     * @throws UnknownTaskTypeException if no task type has that name
     */
    public UUID submit(String typeName, String inputData) {
        if (typeName == null || typeName.isBlank()) {
            throw new IllegalArgumentException("taskType is required");
        }
        TaskType type = taskTypeService.findByName(typeName)
                .orElseThrow(() -> new UnknownTaskTypeException(typeName));

        Task task = Task.builder()
                .id(UUID.randomUUID())
                .taskTypeId(type.id())
                .inputData(inputData)
                .status(TaskStatus.PENDING)
                .createdAt(config.clock().instant())
                .build();

        taskRepository.save(task);
        log.info("Task {} submitted (type {})", task.id(), typeName);

        for (Consumer<Task> listener : submissionListeners) {
            listener.accept(task);
        }
        return task.id();
    }

    /**
     * Cancel a task that has not started executing.
     *
     * @return STALE if the task is already RUNNING or terminal
     */
    public Transition cancel(UUID taskId) {
        requireTask(taskId);
        return lifecycle.cancel(taskId);
    }

    /**
     * Start signal from the assigned worker.
     */
    public Transition markRunning(UUID taskId, UUID workerId) {
        requireTask(taskId);
        return lifecycle.markRunning(taskId, workerId);
    }

    public Optional<Task> findById(UUID taskId) {
        return taskRepository.findById(taskId);
    }

    /**
     * A task with its result, if any.
     */
    public Optional<TaskDetails> find(UUID taskId) {
        return taskRepository.findById(taskId)
                .map(task -> new TaskDetails(task,
                        task.status().hasResult() ? taskRepository.findResult(taskId).orElse(null) : null));
    }

    public List<Task> findByStatus(TaskStatus status, int limit) {
        return taskRepository.findByStatus(status, limit);
    }

    public int countByStatus(TaskStatus status) {
        return taskRepository.countByStatus(status);
    }

    public Map<TaskStatus, Integer> countAllByStatus() {
        Map<TaskStatus, Integer> counts = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            counts.put(status, taskRepository.countByStatus(status));
        }
        return counts;
    }

    private void requireTask(UUID taskId) {
        if (taskRepository.findById(taskId).isEmpty()) {
            throw new TaskNotFoundException(taskId);
        }
    }
}
