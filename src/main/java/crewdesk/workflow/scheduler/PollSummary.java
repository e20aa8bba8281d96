package crewdesk.workflow.scheduler;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import crewdesk.workflow.model.TaskType;

import java.util.List;

/**
 * Result of one worker poll.
 */
public record PollSummary(
        @JsonProperty("processed") int processed,
        @JsonProperty("succeeded") int succeeded,
        @JsonProperty("failed") int failed,
        @JsonProperty("skipped") int skipped,
        @JsonProperty("details") List<TaskOutcome> details) {

    public enum Outcome {
        COMPLETED,
        RETRYING,
        FAILED,
        SKIPPED
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record TaskOutcome(
            @JsonProperty("taskId") String taskId,
            @JsonProperty("type") TaskType type,
            @JsonProperty("outcome") Outcome outcome,
            @JsonProperty("error") String error) {
    }
}
