package crewdesk.workflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDate;

/**
 * POST /api/v1/jobs/{jobId}/reminders/day-before
 */
public record DayBeforeReminderRequest(
        @JsonProperty("tenantId") String tenantId,
        @JsonProperty("phone") String phone,
        @JsonProperty("name") String name,
        @JsonProperty("appointmentDate") LocalDate appointmentDate) {

    public void validate() {
        if (phone == null || phone.isBlank()) {
            throw new IllegalArgumentException("phone is required");
        }
        if (appointmentDate == null) {
            throw new IllegalArgumentException("appointmentDate is required");
        }
    }
}
