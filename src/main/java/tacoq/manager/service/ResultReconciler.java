package tacoq.manager.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tacoq.manager.config.ManagerConfig;
import tacoq.manager.model.ReportOutcome;
import tacoq.manager.model.ResultReport;
import tacoq.manager.repository.TaskRepository;

import java.util.UUID;

/**
 * Applies worker-reported outcomes to tasks.
 * Duplicate, orphaned and late results are outcomes, not errors, because delivery
 * is at-least-once and reclaimed tasks may still be finished by their old worker.
 */
public class ResultReconciler {

    private static final Logger log = LoggerFactory.getLogger(ResultReconciler.class);

    private final TaskRepository taskRepository;
    private final ManagerConfig config;

    public ResultReconciler(TaskRepository taskRepository, ManagerConfig config) {
        this.taskRepository = taskRepository;
        this.config = config;
    }

    /**
     * Record a result. The result row and the status change commit together.
     *
     * @throws IllegalArgumentException if the report is malformed
     * @throws tacoq.manager.exception.StoreException on store failure; the report may be retried
     */
    public ReportOutcome reconcile(ResultReport report) {
        report.validate();

        ReportOutcome outcome = taskRepository.finalizeWithResult(report, UUID.randomUUID(), config.clock().instant());

        switch (outcome) {
            case RECORDED -> log.info("Task {} {} by worker {}", report.taskId(),
                    report.success() ? "completed" : "failed", report.workerId());
            case DUPLICATE -> log.debug("Duplicate result for task {} from worker {} ignored",
                    report.taskId(), report.workerId());
            case ORPHANED -> log.warn("Orphaned result for reclaimed task {} from worker {} discarded",
                    report.taskId(), report.workerId());
            case CANCELLED -> log.info("Result for cancelled task {} from worker {} discarded",
                    report.taskId(), report.workerId());
            case NOT_FOUND -> log.warn("Result for unknown task {} from worker {}",
                    report.taskId(), report.workerId());
        }
        return outcome;
    }
}
