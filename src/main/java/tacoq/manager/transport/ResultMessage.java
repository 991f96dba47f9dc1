package tacoq.manager.transport;

import com.fasterxml.jackson.annotation.JsonProperty;
import tacoq.manager.model.ResultReport;

import java.util.UUID;

/**
 * Outcome published by a worker to the results queue.
 */
public record ResultMessage(
        @JsonProperty("taskId") UUID taskId,
        @JsonProperty("workerId") UUID workerId,
        @JsonProperty("success") boolean success,
        @JsonProperty("outputData") String outputData,
        @JsonProperty("errorData") String errorData) {

    public static ResultMessage from(ResultReport report) {
        return new ResultMessage(report.taskId(), report.workerId(), report.success(),
                report.outputData(), report.errorData());
    }

    public ResultReport toReport() {
        return new ResultReport(taskId, workerId, success, outputData, errorData);
    }
}
