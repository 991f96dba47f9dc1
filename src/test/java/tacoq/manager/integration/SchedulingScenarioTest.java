package tacoq.manager.integration;

import tacoq.manager.config.Dependencies;
import tacoq.manager.config.ManagerConfig;
import tacoq.manager.model.ReportOutcome;
import tacoq.manager.model.ResultReport;
import tacoq.manager.model.Task;
import tacoq.manager.model.TaskStatus;
import tacoq.manager.model.TaskType;
import tacoq.manager.model.WorkerLiveness;
import tacoq.manager.transport.Delivery;
import tacoq.manager.transport.DispatchMessage;
import tacoq.manager.transport.MessageCodec;
import tacoq.manager.transport.QueueTransport;
import tacoq.manager.transport.ResultMessage;
import org.awaitility.Awaitility;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end scheduling scenarios with the background loops running.
 */
class SchedulingScenarioTest {

    private Dependencies deps;

    private Dependencies start(Duration heartbeatTimeout, Duration deathTimeout) {
        ManagerConfig config = ManagerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-scenario-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withHeartbeatTimeout(heartbeatTimeout)
                .withDeathTimeout(deathTimeout)
                .withLivenessSweepInterval(Duration.ofMillis(50))
                .withDispatchInterval(Duration.ofMillis(50))
                .withResultPollTimeout(Duration.ofMillis(50))
                .validate();
        deps = Dependencies.create(config);
        deps.startScheduler();
        return deps;
    }

    @AfterEach
    void tearDown() {
        if (deps != null)
            deps.close();
    }

    private Task task(UUID id) {
        return deps.taskService().findById(id).orElseThrow();
    }

    private int resultRows() throws Exception {
        try (var conn = deps.database().getConnection();
                var st = conn.createStatement();
                var rs = st.executeQuery("SELECT COUNT(*) FROM task_results")) {
            rs.next();
            return rs.getInt(1);
        }
    }

    private void publishResult(ResultReport report) {
        deps.transport().publish(QueueTransport.RESULTS_QUEUE, MessageCodec.encode(ResultMessage.from(report)));
    }

    @Test
    @DisplayName("Task waits for a capable worker, is dispatched to it and completes")
    void taskWaitsThenCompletes() throws Exception {
        start(Duration.ofSeconds(30), Duration.ofSeconds(90));
        TaskType render = deps.taskTypeService().create("render");
        UUID taskId = deps.taskService().submit("render", "{\"scene\":\"castle\"}");

        // no workers: several dispatch passes go by
        TimeUnit.MILLISECONDS.sleep(300);
        assertEquals(TaskStatus.PENDING, task(taskId).status());
        assertEquals(0, deps.transport().depth(render.queueName()));

        UUID worker = UUID.randomUUID();
        deps.workerRegistry().register(worker, "w", Set.of(render.id()));
        deps.workerRegistry().heartbeat(worker, null);

        Awaitility.await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertEquals(TaskStatus.QUEUED, task(taskId).status()));
        assertEquals(worker, task(taskId).assignedTo());

        Delivery delivery = deps.transport().poll(render.queueName(), Duration.ofSeconds(1)).orElseThrow();
        DispatchMessage message = MessageCodec.decodeDispatch(delivery.body());
        assertEquals(taskId, message.taskId());
        assertEquals(worker, message.workerId());
        deps.transport().ack(delivery.tag());

        publishResult(ResultReport.success(taskId, worker, "{\"frames\":24}"));

        Awaitility.await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertEquals(TaskStatus.COMPLETED, task(taskId).status()));
        assertNull(task(taskId).assignedTo());
        assertEquals(1, resultRows());
        assertEquals("{\"frames\":24}", deps.taskRepository().findResult(taskId).orElseThrow().outputData());
    }

    @Test
    @DisplayName("Silent worker is declared dead, its task is reclaimed and its late result is orphaned")
    void deadWorkerTaskIsReclaimed() throws Exception {
        start(Duration.ofMillis(200), Duration.ofMillis(600));
        TaskType render = deps.taskTypeService().create("render");
        UUID worker = UUID.randomUUID();
        deps.workerRegistry().register(worker, "w", Set.of(render.id()));
        UUID taskId = deps.taskService().submit("render", "{}");

        Awaitility.await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertEquals(TaskStatus.QUEUED, task(taskId).status()));

        // the worker never heartbeats again
        Awaitility.await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            Task task = task(taskId);
            assertEquals(TaskStatus.PENDING, task.status());
            assertNull(task.assignedTo());
        });
        assertEquals(WorkerLiveness.DEAD, deps.workerRegistry().findById(worker).orElseThrow().liveness());

        ReportOutcome late = deps.resultReconciler().reconcile(ResultReport.success(taskId, worker, "{}"));
        assertEquals(ReportOutcome.ORPHANED, late);
        assertEquals(0, resultRows());
        assertEquals(TaskStatus.PENDING, task(taskId).status());
    }

    @Test
    @DisplayName("Reclaimed task is dispatched again once a worker registers")
    void reclaimedTaskIsRedispatched() {
        start(Duration.ofMillis(200), Duration.ofMillis(600));
        TaskType render = deps.taskTypeService().create("render");
        UUID first = UUID.randomUUID();
        deps.workerRegistry().register(first, "first", Set.of(render.id()));
        UUID taskId = deps.taskService().submit("render", "{}");

        Awaitility.await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertEquals(WorkerLiveness.DEAD,
                        deps.workerRegistry().findById(first).orElseThrow().liveness()));

        UUID second = UUID.randomUUID();
        deps.workerRegistry().register(second, "second", Set.of(render.id()));

        Awaitility.await().atMost(Duration.ofSeconds(5)).untilAsserted(() -> {
            Task task = task(taskId);
            assertEquals(TaskStatus.QUEUED, task.status());
            assertEquals(second, task.assignedTo());
        });
    }

    @Test
    @DisplayName("Redelivered result creates no second result row")
    void redeliveredResultIsIdempotent() throws Exception {
        start(Duration.ofSeconds(30), Duration.ofSeconds(90));
        TaskType render = deps.taskTypeService().create("render");
        UUID worker = UUID.randomUUID();
        deps.workerRegistry().register(worker, "w", Set.of(render.id()));
        UUID taskId = deps.taskService().submit("render", "{}");

        Awaitility.await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertEquals(TaskStatus.QUEUED, task(taskId).status()));

        ResultReport report = ResultReport.failure(taskId, worker, "{\"error\":\"oom\"}");
        publishResult(report);
        publishResult(report);

        Awaitility.await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertEquals(0, deps.transport().depth(QueueTransport.RESULTS_QUEUE)));
        Awaitility.await().atMost(Duration.ofSeconds(5))
                .untilAsserted(() -> assertEquals(TaskStatus.FAILED, task(taskId).status()));
        assertEquals(1, resultRows());
    }
}
