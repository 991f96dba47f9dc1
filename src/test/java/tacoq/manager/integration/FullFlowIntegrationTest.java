package tacoq.manager.integration;

import tacoq.manager.config.Dependencies;
import tacoq.manager.config.ManagerConfig;
import tacoq.manager.model.TaskStatus;
import tacoq.manager.model.WorkerLiveness;
import tacoq.manager.simulation.SimulatedWorker;
import tacoq.manager.simulation.SimulationService;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full flow with simulated workers: submit, dispatch, execute, report, reconcile.
 */
class FullFlowIntegrationTest {

    private Dependencies deps;
    private SimulationService simulation;

    private void start(ManagerConfig config) {
        deps = Dependencies.create(config);
        deps.startScheduler();
        simulation = new SimulationService(deps.workerRegistry(), deps.taskService(), deps.transport(),
                deps.config());
    }

    private static ManagerConfig config() {
        return ManagerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-flow-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withDispatchInterval(Duration.ofMillis(50))
                .withResultPollTimeout(Duration.ofMillis(50))
                .withAutoCreateTaskTypes(true);
    }

    @AfterEach
    void tearDown() {
        if (simulation != null)
            simulation.stop();
        if (deps != null)
            deps.close();
    }

    @Test
    @DisplayName("Simulated workers drain every submitted task")
    void simulatedWorkersCompleteAllTasks() {
        start(config());
        List<SimulatedWorker> workers = simulation.start(3, List.of("render"), 5, 20, 0.0);

        Awaitility.await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertEquals(3, deps.workerRegistry().countByLiveness(WorkerLiveness.ALIVE)));

        List<UUID> tasks = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            tasks.add(deps.taskService().submit("render", "{\"frame\":" + i + "}"));
        }

        Awaitility.await().atMost(Duration.ofSeconds(30))
                .untilAsserted(() -> assertEquals(20, deps.taskService().countByStatus(TaskStatus.COMPLETED)));

        for (UUID id : tasks) {
            assertTrue(deps.taskRepository().findResult(id).isPresent(), "result for " + id);
        }
        assertEquals(0, deps.taskService().countByStatus(TaskStatus.QUEUED));
        assertEquals(0, deps.taskService().countByStatus(TaskStatus.RUNNING));
        assertEquals(20, workers.stream().mapToInt(SimulatedWorker::completedCount).sum());
    }

    @Test
    @DisplayName("Failures are recorded as FAILED with error data")
    void failuresAreRecorded() {
        start(config());
        simulation.start(2, List.of("render", "encode"), 1, 5, 0.5);

        Awaitility.await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertEquals(2, deps.workerRegistry().countByLiveness(WorkerLiveness.ALIVE)));

        for (int i = 0; i < 10; i++) {
            deps.taskService().submit(i % 2 == 0 ? "render" : "encode", null);
        }

        Awaitility.await().atMost(Duration.ofSeconds(30)).untilAsserted(() -> assertEquals(10,
                deps.taskService().countByStatus(TaskStatus.COMPLETED)
                        + deps.taskService().countByStatus(TaskStatus.FAILED)));

        for (var task : deps.taskService().findByStatus(TaskStatus.FAILED, 10)) {
            assertNotNull(deps.taskRepository().findResult(task.id()).orElseThrow().errorData());
        }
    }

    @Test
    @DisplayName("Partitioned worker is declared dead, then registers again when heartbeats resume")
    void partitionedWorkerRejoins() {
        start(config()
                .withHeartbeatTimeout(Duration.ofMillis(200))
                .withDeathTimeout(Duration.ofMillis(600))
                .withLivenessSweepInterval(Duration.ofMillis(50))
                .validate());
        SimulatedWorker worker = simulation.start(1, List.of("render"), 5, 10, 0.0).get(0);

        Awaitility.await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertEquals(1, deps.workerRegistry().countByLiveness(WorkerLiveness.ALIVE)));

        worker.pauseHeartbeats(true);
        Awaitility.await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertEquals(WorkerLiveness.DEAD,
                deps.workerRegistry().findById(worker.workerId()).orElseThrow().liveness()));

        worker.pauseHeartbeats(false);
        Awaitility.await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> assertEquals(WorkerLiveness.ALIVE,
                deps.workerRegistry().findById(worker.workerId()).orElseThrow().liveness()));

        UUID taskId = deps.taskService().submit("render", null);
        Awaitility.await().atMost(Duration.ofSeconds(10)).untilAsserted(() -> assertEquals(TaskStatus.COMPLETED,
                deps.taskService().findById(taskId).orElseThrow().status()));
    }

    @Test
    @DisplayName("Stopping the simulation returns unfinished work to PENDING")
    void stoppingWorkersReclaimsTheirTasks() {
        start(config());
        simulation.start(1, List.of("render"), 2000, 2000, 0.0);

        Awaitility.await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertEquals(1, deps.workerRegistry().countByLiveness(WorkerLiveness.ALIVE)));

        UUID taskId = deps.taskService().submit("render", null);
        Awaitility.await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertEquals(TaskStatus.RUNNING,
                        deps.taskService().findById(taskId).orElseThrow().status()));

        simulation.stop();

        assertEquals(TaskStatus.PENDING, deps.taskService().findById(taskId).orElseThrow().status());
        assertEquals(1, deps.workerRegistry().countByLiveness(WorkerLiveness.DEAD));
    }
}
