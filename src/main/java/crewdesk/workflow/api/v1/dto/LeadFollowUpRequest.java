package crewdesk.workflow.api.v1.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Request DTO for planning a lead's follow-up sequence.
 * POST /api/v1/leads/{leadId}/follow-up
 */
public record LeadFollowUpRequest(
        @JsonProperty("tenantId") String tenantId,
        @JsonProperty("phone") String phone,
        @JsonProperty("name") String name,
        @JsonProperty("delaysMinutes") List<Integer> delaysMinutes) {

    public void validate() {
        if (phone == null || phone.isBlank()) {
            throw new IllegalArgumentException("phone is required");
        }
    }
}
