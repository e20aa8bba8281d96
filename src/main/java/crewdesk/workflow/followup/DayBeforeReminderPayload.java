package crewdesk.workflow.followup;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

public record DayBeforeReminderPayload(
        @JsonProperty("jobId") long jobId,
        @JsonProperty("phone") String phone,
        @JsonProperty("name") String name,
        @JsonProperty("appointmentDate") LocalDate appointmentDate) {
}
