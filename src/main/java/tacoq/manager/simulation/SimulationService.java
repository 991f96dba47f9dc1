package tacoq.manager.simulation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.config.ManagerConfig;
import tacoq.manager.service.TaskService;
import tacoq.manager.service.WorkerRegistry;
import tacoq.manager.transport.QueueTransport;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Service managing simulated workers.
 * Call start() to spawn N workers, stop() to shut them all down.
 */
public final class SimulationService {

    private static final Logger log = LoggerFactory.getLogger(SimulationService.class);

    private final WorkerRegistry workerRegistry;
    private final TaskService taskService;
    private final QueueTransport transport;
    private final ManagerConfig config;

    private ExecutorService executor;
    private final List<SimulatedWorker> workers = new ArrayList<>();
    private volatile boolean running;

    public SimulationService(WorkerRegistry workerRegistry, TaskService taskService, QueueTransport transport,
            ManagerConfig config) {
        this.workerRegistry = workerRegistry;
        this.taskService = taskService;
        this.transport = transport;
        this.config = config;
    }

    /**
     * Start N simulated workers, all capable of the given task types.
     */
    public synchronized List<SimulatedWorker> start(int count, List<String> taskTypes, int delayMinMs,
            int delayMaxMs, double failRate) {
        if (running) {
            log.warn("Simulation already running");
            return List.copyOf(workers);
        }

        workers.clear();
        executor = Executors.newFixedThreadPool(count, r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            return t;
        });

        for (int i = 1; i <= count; i++) {
            SimulatedWorker worker = new SimulatedWorker(
                    UUID.randomUUID(), "sim-" + i, taskTypes, workerRegistry, taskService, transport,
                    config.heartbeatTimeout().dividedBy(3), delayMinMs, delayMaxMs, failRate);
            workers.add(worker);
            executor.submit(worker);
        }

        running = true;
        log.info("Simulation started: {} workers on {}, delay {}..{}ms, failRate {}",
                count, taskTypes, delayMinMs, delayMaxMs, failRate);
        return List.copyOf(workers);
    }

    /**
     * Stop all simulated workers and unregister them, returning their in-flight tasks to PENDING.
     */
    public synchronized void stop() {
        if (!running)
            return;

        running = false;

        if (executor != null) {
            executor.shutdownNow();
            try {
                executor.awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            executor = null;
        }

        for (SimulatedWorker worker : workers) {
            try {
                workerRegistry.unregister(worker.workerId());
            } catch (Exception e) {
                log.debug("Failed to unregister sim worker {}: {}", worker.workerId(), e.getMessage());
            }
        }
        workers.clear();

        log.info("Simulation stopped");
    }

    public boolean isRunning() {
        return running;
    }

    public int completedCount() {
        return workers.stream().mapToInt(SimulatedWorker::completedCount).sum();
    }
}
