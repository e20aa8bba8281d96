package crewdesk.workflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import crewdesk.workflow.model.ScheduleResult;

import java.util.List;

/**
 * Tasks planned by a follow-up request. Tasks that were already live count
 * as existing, not created.
 */
public record ScheduleResponse(
        @JsonProperty("created") int created,
        @JsonProperty("existing") int existing,
        @JsonProperty("taskIds") List<String> taskIds) {

    public static ScheduleResponse from(List<ScheduleResult> results) {
        int created = (int) results.stream().filter(ScheduleResult::created).count();
        List<String> ids = results.stream().map(ScheduleResult::taskId).toList();
        return new ScheduleResponse(created, results.size() - created, ids);
    }
}
