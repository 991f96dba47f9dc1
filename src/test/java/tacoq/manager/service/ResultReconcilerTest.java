package tacoq.manager.service;

import tacoq.manager.MutableClock;
import tacoq.manager.config.Dependencies;
import tacoq.manager.config.ManagerConfig;
import tacoq.manager.model.ReportOutcome;
import tacoq.manager.model.ResultReport;
import tacoq.manager.model.Task;
import tacoq.manager.model.TaskStatus;
import tacoq.manager.model.TaskType;
import tacoq.manager.model.WorkerLiveness;
import org.junit.jupiter.api.*;

import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ResultReconcilerTest {

    private MutableClock clock;
    private Dependencies deps;
    private ResultReconciler reconciler;
    private TaskType render;
    private UUID worker;
    private UUID task;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        ManagerConfig config = ManagerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-reconciler-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withClock(clock);
        deps = Dependencies.create(config);
        reconciler = deps.resultReconciler();

        render = deps.taskTypeService().create("render");
        worker = UUID.randomUUID();
        deps.workerRegistry().register(worker, "w1", Set.of(render.id()));
        task = deps.taskService().submit("render", "{}");
        assertTrue(deps.taskLifecycle().assign(task, worker).applied());
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    private TaskStatus status() {
        return deps.taskService().findById(task).orElseThrow().status();
    }

    @Test
    void successCompletesTask() {
        assertEquals(ReportOutcome.RECORDED, reconciler.reconcile(ResultReport.success(task, worker, "{\"ok\":1}")));
        assertEquals(TaskStatus.COMPLETED, status());
    }

    @Test
    void failureFailsTask() {
        assertEquals(ReportOutcome.RECORDED, reconciler.reconcile(ResultReport.failure(task, worker, "{\"e\":1}")));
        assertEquals(TaskStatus.FAILED, status());
    }

    @Test
    void redeliveredResultIsDuplicate() {
        ResultReport report = ResultReport.success(task, worker, "{}");
        reconciler.reconcile(report);

        assertEquals(ReportOutcome.DUPLICATE, reconciler.reconcile(report));
        assertEquals(TaskStatus.COMPLETED, status());
    }

    @Test
    void lateResultAfterReclaimIsOrphaned() {
        deps.workerRegistry().unregister(worker);

        assertEquals(ReportOutcome.ORPHANED, reconciler.reconcile(ResultReport.success(task, worker, "{}")));
        assertEquals(TaskStatus.PENDING, status());
        assertTrue(deps.taskRepository().findResult(task).isEmpty());
    }

    private UUID secondWorker() {
        UUID id = UUID.randomUUID();
        deps.workerRegistry().register(id, "w2", Set.of(render.id()));
        return id;
    }

    @Test
    void lateResultFromDeadWorkerDoesNotTakeReassignedTask() {
        clock.advance(deps.config().deathTimeout().plusSeconds(10));
        deps.livenessDetector().sweep();
        assertEquals(WorkerLiveness.DEAD, deps.workerRegistry().findById(worker).orElseThrow().liveness());

        UUID owner = secondWorker();
        assertTrue(deps.taskLifecycle().assign(task, owner).applied());

        assertEquals(ReportOutcome.ORPHANED, reconciler.reconcile(ResultReport.success(task, worker, "{\"late\":1}")));
        Task queued = deps.taskService().findById(task).orElseThrow();
        assertEquals(TaskStatus.QUEUED, queued.status());
        assertEquals(owner, queued.assignedTo());
        assertTrue(deps.taskRepository().findResult(task).isEmpty());

        // the current owner's result is the one recorded
        assertEquals(ReportOutcome.RECORDED, reconciler.reconcile(ResultReport.success(task, owner, "{\"ok\":1}")));
        assertEquals(owner, deps.taskRepository().findResult(task).orElseThrow().workerId());
    }

    @Test
    void lateResultFromPreviousRunIsOrphanedAfterReregistration() {
        deps.workerRegistry().register(worker, "w1", Set.of(render.id()));
        assertEquals(TaskStatus.PENDING, status());

        UUID owner = secondWorker();
        assertTrue(deps.taskLifecycle().assign(task, owner).applied());

        assertEquals(ReportOutcome.ORPHANED, reconciler.reconcile(ResultReport.success(task, worker, "{}")));
        assertEquals(TaskStatus.QUEUED, status());
    }

    @Test
    void resultFromAnotherLiveConsumerIsRecorded() {
        UUID consumer = secondWorker();

        assertEquals(ReportOutcome.RECORDED, reconciler.reconcile(ResultReport.success(task, consumer, "{}")));
        assertEquals(consumer, deps.taskRepository().findResult(task).orElseThrow().workerId());
    }

    @Test
    void resultFromUnknownWorkerIsOrphaned() {
        assertEquals(ReportOutcome.ORPHANED,
                reconciler.reconcile(ResultReport.success(task, UUID.randomUUID(), "{}")));
        assertEquals(TaskStatus.QUEUED, status());
    }

    @Test
    void resultForCancelledTaskIsDiscarded() {
        deps.taskService().cancel(task);

        assertEquals(ReportOutcome.CANCELLED, reconciler.reconcile(ResultReport.success(task, worker, "{}")));
        assertEquals(TaskStatus.CANCELLED, status());
    }

    @Test
    void resultForUnknownTaskIsReportedNotThrown() {
        assertEquals(ReportOutcome.NOT_FOUND,
                reconciler.reconcile(ResultReport.success(UUID.randomUUID(), worker, "{}")));
    }

    @Test
    void malformedReportIsRejected() {
        ResultReport both = new ResultReport(task, worker, true, "{}", "{}");
        ResultReport noWorker = new ResultReport(task, null, true, "{}", null);

        assertThrows(IllegalArgumentException.class, () -> reconciler.reconcile(both));
        assertThrows(IllegalArgumentException.class, () -> reconciler.reconcile(noWorker));
        assertEquals(TaskStatus.QUEUED, status());
    }

    @Test
    void emptyOutcomeIsAccepted() {
        assertEquals(ReportOutcome.RECORDED, reconciler.reconcile(ResultReport.success(task, worker, null)));
        assertNull(deps.taskRepository().findResult(task).orElseThrow().outputData());
    }
}
