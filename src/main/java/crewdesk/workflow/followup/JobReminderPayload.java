package crewdesk.workflow.followup;

import com.fasterxml.jackson.annotation.JsonProperty;
import crewdesk.workflow.model.ReminderType;

public record JobReminderPayload(
        @JsonProperty("jobId") long jobId,
        @JsonProperty("cleanerId") long cleanerId,
        @JsonProperty("reminderType") ReminderType reminderType) {
}
