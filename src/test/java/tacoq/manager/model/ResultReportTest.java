package tacoq.manager.model;

import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class ResultReportTest {

    private final UUID task = UUID.randomUUID();
    private final UUID worker = UUID.randomUUID();

    @Test
    void factoriesProduceValidReports() {
        ResultReport ok = ResultReport.success(task, worker, "{}");
        ResultReport failed = ResultReport.failure(task, worker, "{\"e\":1}");

        assertDoesNotThrow(ok::validate);
        assertDoesNotThrow(failed::validate);
        assertEquals(TaskStatus.COMPLETED, ok.targetStatus());
        assertEquals(TaskStatus.FAILED, failed.targetStatus());
    }

    @Test
    void bothPayloadsAreRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new ResultReport(task, worker, true, "{}", "{}").validate());
        assertThrows(IllegalArgumentException.class,
                () -> new ResultReport(task, worker, false, "{}", "{}").validate());
    }

    @Test
    void payloadMustMatchOutcome() {
        assertThrows(IllegalArgumentException.class,
                () -> new ResultReport(task, worker, true, null, "{}").validate());
        assertThrows(IllegalArgumentException.class,
                () -> new ResultReport(task, worker, false, "{}", null).validate());
    }

    @Test
    void neitherPayloadIsAllowed() {
        assertDoesNotThrow(() -> new ResultReport(task, worker, false, null, null).validate());
    }

    @Test
    void idsAreRequired() {
        assertThrows(IllegalArgumentException.class, () -> ResultReport.success(null, worker, "{}").validate());
        assertThrows(IllegalArgumentException.class, () -> ResultReport.success(task, null, "{}").validate());
    }
}
