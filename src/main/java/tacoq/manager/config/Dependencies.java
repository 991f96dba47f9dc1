package tacoq.manager.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.api.internal.v1.QueueController;
import tacoq.manager.api.internal.v1.TaskReportController;
import tacoq.manager.api.internal.v1.WorkerLifecycleController;
import tacoq.manager.api.v1.HealthController;
import tacoq.manager.api.v1.TaskController;
import tacoq.manager.api.v1.TaskTypeController;
import tacoq.manager.api.v1.WorkerController;
import tacoq.manager.repository.TaskRepository;
import tacoq.manager.repository.TaskTypeRepository;
import tacoq.manager.repository.WorkerRepository;
import tacoq.manager.scheduler.Dispatcher;
import tacoq.manager.scheduler.LivenessDetector;
import tacoq.manager.scheduler.ResultConsumer;
import tacoq.manager.scheduler.Scheduler;
import tacoq.manager.server.RouterHandler;
import tacoq.manager.service.ResultReconciler;
import tacoq.manager.service.TaskLifecycle;
import tacoq.manager.service.TaskService;
import tacoq.manager.service.TaskTypeService;
import tacoq.manager.service.WorkerRegistry;
import tacoq.manager.store.Database;
import tacoq.manager.store.JdbcTaskRepository;
import tacoq.manager.store.JdbcTaskTypeRepository;
import tacoq.manager.store.JdbcWorkerRepository;
import tacoq.manager.transport.InMemoryQueueTransport;
import tacoq.manager.transport.QueueTransport;

/**
 * Manual dependency injection container.
 * Creates and wires all service dependencies.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(ManagerConfig.fromEnv());
 * deps.startScheduler(); // dispatcher, liveness sweep, result consumer
 * UUID taskId = deps.taskService().submit("render", "{}");
 * // ...
 * deps.close();
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final ManagerConfig config;
    private final Database database;
    private final QueueTransport transport;

    private final TaskTypeRepository taskTypeRepository;
    private final WorkerRepository workerRepository;
    private final TaskRepository taskRepository;

    private final TaskTypeService taskTypeService;
    private final WorkerRegistry workerRegistry;
    private final TaskLifecycle taskLifecycle;
    private final TaskService taskService;
    private final ResultReconciler resultReconciler;

    private final Dispatcher dispatcher;
    private final LivenessDetector livenessDetector;
    private final ResultConsumer resultConsumer;
    private final Scheduler scheduler;

    // Router (lazy-initialized)
    private RouterHandler routerHandler;

    private Dependencies(ManagerConfig config, QueueTransport transport) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // Infrastructure
        this.database = new Database(config);
        this.transport = transport;

        // Repositories
        this.taskTypeRepository = new JdbcTaskTypeRepository(database);
        this.workerRepository = new JdbcWorkerRepository(database);
        this.taskRepository = new JdbcTaskRepository(database);

        // Services
        this.taskTypeService = new TaskTypeService(taskTypeRepository, config);
        this.workerRegistry = new WorkerRegistry(workerRepository, taskTypeService, config);
        this.taskLifecycle = new TaskLifecycle(taskRepository);
        this.taskService = new TaskService(taskRepository, taskTypeService, taskLifecycle, config);
        this.resultReconciler = new ResultReconciler(taskRepository, config);

        // Background loops
        this.dispatcher = new Dispatcher(taskRepository, taskTypeService, workerRegistry, taskLifecycle, transport,
                config);
        this.livenessDetector = new LivenessDetector(workerRepository, config);
        this.resultConsumer = new ResultConsumer(transport, resultReconciler, config);
        this.scheduler = new Scheduler(dispatcher, livenessDetector, resultConsumer, config);

        // New work or a new worker: dispatch without waiting for the next tick
        taskService.addSubmissionListener(task -> scheduler.nudgeDispatcher());
        workerRegistry.addRegistrationListener(worker -> scheduler.nudgeDispatcher());

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and an in-process transport.
     */
    public static Dependencies create(ManagerConfig config) {
        return new Dependencies(config, new InMemoryQueueTransport());
    }

    /**
     * Create dependencies with the given config and transport.
     */
    public static Dependencies create(ManagerConfig config, QueueTransport transport) {
        return new Dependencies(config, transport);
    }

    /**
     * Create dependencies with environment-based config.
     */
    public static Dependencies create() {
        return create(ManagerConfig.fromEnv());
    }

    // Getters
    public ManagerConfig config() {
        return config;
    }

    public Database database() {
        return database;
    }

    public QueueTransport transport() {
        return transport;
    }

    public TaskTypeRepository taskTypeRepository() {
        return taskTypeRepository;
    }

    public WorkerRepository workerRepository() {
        return workerRepository;
    }

    public TaskRepository taskRepository() {
        return taskRepository;
    }

    public TaskTypeService taskTypeService() {
        return taskTypeService;
    }

    public WorkerRegistry workerRegistry() {
        return workerRegistry;
    }

    public TaskLifecycle taskLifecycle() {
        return taskLifecycle;
    }

    public TaskService taskService() {
        return taskService;
    }

    public ResultReconciler resultReconciler() {
        return resultReconciler;
    }

    public Dispatcher dispatcher() {
        return dispatcher;
    }

    public LivenessDetector livenessDetector() {
        return livenessDetector;
    }

    public ResultConsumer resultConsumer() {
        return resultConsumer;
    }

    public Scheduler scheduler() {
        return scheduler;
    }

    /**
     * Get a fully configured RouterHandler with all controllers registered.
     * This is the main entry point for serving HTTP requests.
     */
    public synchronized RouterHandler routerHandler() {
        if (routerHandler == null) {
            routerHandler = new RouterHandler(config)
                    // public API
                    .registerController(new HealthController(database, workerRegistry, taskService))
                    .registerController(new TaskTypeController(taskTypeService))
                    .registerController(new TaskController(taskService))
                    .registerController(new WorkerController(workerRegistry))
                    // internal API
                    .registerController(new WorkerLifecycleController(workerRegistry, config))
                    .registerController(new TaskReportController(taskService, resultReconciler))
                    .registerController(new QueueController(transport, taskTypeService));
            log.info("RouterHandler created with {} controllers", routerHandler.controllerCount());
        }
        return routerHandler;
    }

    /**
     * Start the dispatcher, the liveness sweep and the result consumer.
     */
    public void startScheduler() {
        scheduler.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop scheduler first
        try {
            scheduler.stop();
        } catch (Exception e) {
            log.warn("Error stopping scheduler: {}", e.getMessage());
        }

        try {
            transport.close();
        } catch (Exception e) {
            log.warn("Error closing transport: {}", e.getMessage());
        }

        try {
            database.close();
        } catch (Exception e) {
            log.warn("Error closing database: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
