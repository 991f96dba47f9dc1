package tacoq.manager.service;

import tacoq.manager.MutableClock;
import tacoq.manager.config.Dependencies;
import tacoq.manager.config.ManagerConfig;
import tacoq.manager.exception.InvalidCapabilityException;
import tacoq.manager.exception.WorkerNotFoundException;
import tacoq.manager.model.HeartbeatOutcome;
import tacoq.manager.model.Task;
import tacoq.manager.model.TaskStatus;
import tacoq.manager.model.TaskType;
import tacoq.manager.model.Worker;
import tacoq.manager.model.WorkerLiveness;
import org.junit.jupiter.api.*;

import java.time.Duration;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class WorkerRegistryTest {

    private MutableClock clock;
    private Dependencies deps;
    private WorkerRegistry registry;
    private TaskType render;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2026-01-01T10:00:00Z");
        ManagerConfig config = ManagerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-registry-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withClock(clock);
        deps = Dependencies.create(config);
        registry = deps.workerRegistry();
        render = deps.taskTypeService().create("render");
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    @Test
    void registerWithKnownCapabilities() {
        UUID id = UUID.randomUUID();
        Worker worker = registry.register(id, "w1", Set.of(render.id()));

        assertEquals(WorkerLiveness.ALIVE, worker.liveness());
        assertEquals(Set.of(id), registry.capableWorkers(render.id()));
        assertEquals(clock.instant(), registry.findById(id).orElseThrow().lastHeartbeat());
    }

    @Test
    void unknownCapabilityRejectsRegistrationWithoutWriting() {
        UUID id = UUID.randomUUID();
        UUID bogus = UUID.randomUUID();

        InvalidCapabilityException e = assertThrows(InvalidCapabilityException.class,
                () -> registry.register(id, "w1", Set.of(render.id(), bogus)));

        assertTrue(e.getMessage().contains(bogus.toString()));
        assertTrue(registry.findById(id).isEmpty());
        assertTrue(registry.findAll().isEmpty());
    }

    @Test
    void registerByNamesRejectsUnknownNamesUnlessAutoCreated() {
        UUID id = UUID.randomUUID();

        assertThrows(InvalidCapabilityException.class,
                () -> registry.registerByNames(id, "w1", List.of("render", "transcode")));
        assertTrue(registry.findById(id).isEmpty());
        assertTrue(deps.taskTypeService().findByName("transcode").isEmpty());
    }

    @Test
    void registerByNamesCreatesTypesWhenEnabled() {
        ManagerConfig config = ManagerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-registry-auto-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE")
                .withAutoCreateTaskTypes(true);
        try (Dependencies auto = Dependencies.create(config)) {
            UUID id = UUID.randomUUID();
            Worker worker = auto.workerRegistry().registerByNames(id, "w1", List.of("transcode"));

            TaskType created = auto.taskTypeService().findByName("transcode").orElseThrow();
            assertEquals(Set.of(created.id()), worker.capabilities());
        }
    }

    @Test
    void registrationNotifiesListeners() {
        AtomicInteger calls = new AtomicInteger();
        registry.addRegistrationListener(w -> calls.incrementAndGet());

        registry.register(UUID.randomUUID(), "w1", Set.of(render.id()));

        assertEquals(1, calls.get());
    }

    @Test
    void heartbeatFromUnknownWorkerFails() {
        assertThrows(WorkerNotFoundException.class, () -> registry.heartbeat(UUID.randomUUID(), null));
    }

    @Test
    void heartbeatTimestampIsCappedAtReceiveTime() {
        UUID id = UUID.randomUUID();
        registry.register(id, "w1", Set.of(render.id()));
        clock.advance(Duration.ofSeconds(5));

        // worker clock runs an hour ahead
        assertEquals(HeartbeatOutcome.ACCEPTED, registry.heartbeat(id, clock.instant().plus(Duration.ofHours(1))));

        assertEquals(clock.instant(), registry.findById(id).orElseThrow().lastHeartbeat());
        assertEquals(clock.instant(), registry.recentHeartbeats(id, 1).get(0).heartbeatTime());
    }

    @Test
    void deadWorkerMustRegisterAgain() {
        UUID id = UUID.randomUUID();
        registry.register(id, "w1", Set.of(render.id()));
        registry.unregister(id);

        assertEquals(HeartbeatOutcome.REREGISTER_REQUIRED, registry.heartbeat(id, null));
        assertEquals(WorkerLiveness.DEAD, registry.findById(id).orElseThrow().liveness());
        assertTrue(registry.capableWorkers(render.id()).isEmpty());

        registry.register(id, "w1", Set.of(render.id()));
        assertEquals(HeartbeatOutcome.ACCEPTED, registry.heartbeat(id, null));
        assertEquals(Set.of(id), registry.capableWorkers(render.id()));
    }

    @Test
    void unregisterReturnsInFlightTasksToPending() {
        UUID id = UUID.randomUUID();
        registry.register(id, "w1", Set.of(render.id()));
        UUID taskId = deps.taskService().submit("render", "{}");
        assertTrue(deps.taskLifecycle().assign(taskId, id).applied());

        assertEquals(1, registry.unregister(id));

        Task task = deps.taskService().findById(taskId).orElseThrow();
        assertEquals(TaskStatus.PENDING, task.status());
        assertNull(task.assignedTo());
        assertEquals(1, registry.countByLiveness(WorkerLiveness.DEAD));
    }

    @Test
    void unregisterUnknownWorkerFails() {
        assertThrows(WorkerNotFoundException.class, () -> registry.unregister(UUID.randomUUID()));
    }

    @Test
    void registerValidatesArguments() {
        assertThrows(IllegalArgumentException.class, () -> registry.register(null, "w1", Set.of()));
        assertThrows(IllegalArgumentException.class, () -> registry.register(UUID.randomUUID(), " ", Set.of()));
    }
}
