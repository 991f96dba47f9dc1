package tacoq.manager.service;

import tacoq.manager.config.Dependencies;
import tacoq.manager.config.ManagerConfig;
import tacoq.manager.exception.TaskNotFoundException;
import tacoq.manager.exception.UnknownTaskTypeException;
import tacoq.manager.model.ResultReport;
import tacoq.manager.model.TaskDetails;
import tacoq.manager.model.TaskStatus;
import tacoq.manager.model.TaskType;
import tacoq.manager.model.Transition;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TaskServiceTest {

    private Dependencies deps;
    private TaskService tasks;
    private TaskType render;

    @BeforeEach
    void setUp() {
        ManagerConfig config = ManagerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-task-service-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        deps = Dependencies.create(config);
        tasks = deps.taskService();
        render = deps.taskTypeService().create("render");
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private UUID worker() {
        UUID id = UUID.randomUUID();
        deps.workerRegistry().register(id, "w", Set.of(render.id()));
        return id;
    }

    @Test
    void submitCreatesPendingTask() {
        UUID id = tasks.submit("render", "{\"scene\":\"a\"}");

        TaskDetails details = tasks.find(id).orElseThrow();
        assertEquals(TaskStatus.PENDING, details.task().status());
        assertEquals(render.id(), details.task().taskTypeId());
        assertEquals("{\"scene\":\"a\"}", details.task().inputData());
        assertNull(details.task().assignedTo());
        assertFalse(details.hasResult());
    }

    @Test
    void submitWithUnknownTypeCreatesNothing() {
        assertThrows(UnknownTaskTypeException.class, () -> tasks.submit("paint", "{}"));
        assertThrows(IllegalArgumentException.class, () -> tasks.submit(" ", "{}"));
        assertEquals(0, tasks.countByStatus(TaskStatus.PENDING));
    }

    @Test
    void submitNotifiesListeners() {
        List<UUID> seen = new ArrayList<>();
        tasks.addSubmissionListener(task -> seen.add(task.id()));

        UUID id = tasks.submit("render", null);

        assertEquals(List.of(id), seen);
    }

    @Test
    void cancelPendingAndQueuedButNotRunning() {
        UUID worker = worker();
        UUID pending = tasks.submit("render", null);
        UUID running = tasks.submit("render", null);
        deps.taskLifecycle().assign(running, worker);
        assertEquals(Transition.APPLIED, tasks.markRunning(running, worker));

        assertEquals(Transition.APPLIED, tasks.cancel(pending));
        assertEquals(Transition.STALE, tasks.cancel(pending));
        assertEquals(Transition.STALE, tasks.cancel(running));
        assertEquals(TaskStatus.CANCELLED, tasks.findById(pending).orElseThrow().status());
    }

    @Test
    void signalsForUnknownTasksFail() {
        UUID missing = UUID.randomUUID();
        assertThrows(TaskNotFoundException.class, () -> tasks.cancel(missing));
        assertThrows(TaskNotFoundException.class, () -> tasks.markRunning(missing, UUID.randomUUID()));
        assertTrue(tasks.find(missing).isEmpty());
    }

    @Test
    void startSignalFromAnotherWorkerIsStale() {
        UUID worker = worker();
        UUID id = tasks.submit("render", null);
        deps.taskLifecycle().assign(id, worker);

        assertEquals(Transition.STALE, tasks.markRunning(id, UUID.randomUUID()));
        assertEquals(TaskStatus.QUEUED, tasks.findById(id).orElseThrow().status());
    }

    @Test
    void findIncludesResultOnceRecorded() {
        UUID worker = worker();
        UUID id = tasks.submit("render", null);
        deps.taskLifecycle().assign(id, worker);
        deps.resultReconciler().reconcile(ResultReport.success(id, worker, "{\"frames\":3}"));

        TaskDetails details = tasks.find(id).orElseThrow();
        assertEquals(TaskStatus.COMPLETED, details.task().status());
        assertTrue(details.hasResult());
        assertEquals("{\"frames\":3}", details.result().outputData());
    }

    @Test
    void countsEveryStatus() {
        tasks.submit("render", null);
        tasks.submit("render", null);

        Map<TaskStatus, Integer> counts = tasks.countAllByStatus();

        assertEquals(TaskStatus.values().length, counts.size());
        assertEquals(2, counts.get(TaskStatus.PENDING));
        assertEquals(0, counts.get(TaskStatus.FAILED));
    }
}
