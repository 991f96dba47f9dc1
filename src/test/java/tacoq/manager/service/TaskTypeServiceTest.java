package tacoq.manager.service;

import tacoq.manager.config.Dependencies;
import tacoq.manager.config.ManagerConfig;
import tacoq.manager.exception.InvalidCapabilityException;
import tacoq.manager.model.TaskType;
import org.junit.jupiter.api.*;

import java.util.List;
import java.util.Set;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TaskTypeServiceTest {

    private Dependencies deps;
    private TaskTypeService service;

    @BeforeEach
    void setUp() {
        ManagerConfig config = ManagerConfig.defaults()
                .withDatabaseUrl("jdbc:h2:mem:test-task-types-" + System.nanoTime()
                        + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE");
        deps = Dependencies.create(config);
        service = deps.taskTypeService();
    }

    @AfterEach
    void tearDown() {
        deps.close();
    }

    @Test
    void createIsIdempotentByName() {
        TaskType first = service.create("render");
        TaskType second = service.create("render");

        assertEquals(first.id(), second.id());
        assertEquals(1, service.list().size());
        assertEquals("tasks.render", first.queueName());
    }

    @Test
    void rejectsNamesUnsafeForQueues() {
        assertThrows(IllegalArgumentException.class, () -> service.create("has space"));
        assertThrows(IllegalArgumentException.class, () -> service.create(""));
        assertThrows(IllegalArgumentException.class, () -> service.create(null));
        assertDoesNotThrow(() -> service.create("video.encode-v2_hd"));
    }

    @Test
    void resolveListsEveryUnknownName() {
        service.create("render");

        InvalidCapabilityException e = assertThrows(InvalidCapabilityException.class,
                () -> service.resolve(List.of("render", "paint", "sculpt")));

        assertEquals(Set.of("paint", "sculpt"), e.unknown());
    }

    @Test
    void requireExistingChecksIds() {
        TaskType render = service.create("render");

        assertDoesNotThrow(() -> service.requireExisting(Set.of(render.id())));
        assertDoesNotThrow(() -> service.requireExisting(Set.of()));
        assertThrows(InvalidCapabilityException.class,
                () -> service.requireExisting(Set.of(render.id(), UUID.randomUUID())));
    }
}
